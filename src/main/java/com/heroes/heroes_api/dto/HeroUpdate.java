package com.heroes.heroes_api.dto;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Partial update of a hero.
 *
 * <p>Absent properties are left untouched. {@code age} and {@code team_id} are
 * nullable columns, so an explicit JSON {@code null} for them clears the value;
 * the setters record which of the two were present in the request body.
 */
public class HeroUpdate {

    @Size(min = 1)
    private String name;

    @Size(min = 1)
    private String secretName;

    @Size(min = 1)
    private String password;

    @PositiveOrZero
    private Integer age;
    private boolean ageSet;

    private Long teamId;
    private boolean teamIdSet;

    public HeroUpdate() {}

    public String getName() { return name; }
    public String getSecretName() { return secretName; }
    public String getPassword() { return password; }
    public Integer getAge() { return age; }
    public Long getTeamId() { return teamId; }

    public boolean hasAge() { return ageSet; }
    public boolean hasTeamId() { return teamIdSet; }

    public void setName(String name) { this.name = name; }
    public void setSecretName(String secretName) { this.secretName = secretName; }
    public void setPassword(String password) { this.password = password; }

    public void setAge(Integer age) {
        this.age = age;
        this.ageSet = true;
    }

    public void setTeamId(Long teamId) {
        this.teamId = teamId;
        this.teamIdSet = true;
    }
}
