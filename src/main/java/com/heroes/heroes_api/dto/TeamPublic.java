package com.heroes.heroes_api.dto;

import com.heroes.heroes_api.model.Team;

public record TeamPublic(Long id, String name, String headquarters) {

    public static TeamPublic from(Team team) {
        return new TeamPublic(team.getId(), team.getName(), team.getHeadquarters());
    }
}
