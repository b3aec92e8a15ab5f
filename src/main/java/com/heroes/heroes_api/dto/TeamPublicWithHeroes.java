package com.heroes.heroes_api.dto;

import java.util.List;

import com.heroes.heroes_api.model.Team;

public record TeamPublicWithHeroes(Long id, String name, String headquarters, List<HeroPublic> heroes) {

    public static TeamPublicWithHeroes from(Team team) {
        List<HeroPublic> heroes = team.getHeroes().stream()
                .map(HeroPublic::from)
                .toList();
        return new TeamPublicWithHeroes(team.getId(), team.getName(), team.getHeadquarters(), heroes);
    }
}
