package com.heroes.heroes_api.model;

import java.util.Objects;

import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "hero", indexes = {
        @Index(name = "ix_hero_name", columnList = "name"),
        @Index(name = "ix_hero_age", columnList = "age")
})
public class Hero {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private Integer age;

    @Column(name = "secret_name", nullable = false)
    private String secretName;

    @Column(name = "hashed_password", nullable = false, unique = true)
    private String hashedPassword;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private Team team;

    public Hero() {}

    public Hero(String name, Integer age, String secretName, String hashedPassword) {
        this.name = name;
        this.age = age;
        this.secretName = secretName;
        this.hashedPassword = hashedPassword;
    }

    /**
     * Moves this hero to the given team (or to no team) and keeps both sides
     * of the association in step within the current persistence context.
     */
    public void assignTeam(Team newTeam) {
        if (team != null) {
            team.getHeroes().remove(this);
        }
        team = newTeam;
        if (newTeam != null && !newTeam.getHeroes().contains(this)) {
            newTeam.getHeroes().add(this);
        }
    }

    public Long getTeamId() {
        return team != null ? team.getId() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Hero hero = (Hero) o;
        if (id == null || hero.id == null) {
            return false;
        }
        return Objects.equals(id, hero.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Hero{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", age=" + age +
                ", teamId=" + getTeamId() +
                '}';
    }
}
