package com.heroes.heroes_api.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;

@Entity
@Table(name = "team", indexes = @Index(name = "ix_team_name", columnList = "name"))
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String headquarters;

    // Owning side is Hero.team; removing a team never removes its heroes.
    @OneToMany(mappedBy = "team")
    @OrderBy("id")
    private List<Hero> heroes = new ArrayList<>();

    // Constructors
    public Team() {}

    public Team(String name, String headquarters) {
        this.name = name;
        this.headquarters = headquarters;
    }

    // Getters
    public Long getId() { return id; }
    public String getName() { return name; }
    public String getHeadquarters() { return headquarters; }
    public List<Hero> getHeroes() { return heroes; }

    // Setters
    public void setId(Long id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setHeadquarters(String headquarters) { this.headquarters = headquarters; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Team team = (Team) o;
        // Unsaved teams are only equal to themselves
        if (id == null || team.id == null) {
            return false;
        }
        return Objects.equals(id, team.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
