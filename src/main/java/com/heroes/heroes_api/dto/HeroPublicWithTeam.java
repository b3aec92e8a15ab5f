package com.heroes.heroes_api.dto;

import com.heroes.heroes_api.model.Hero;

public record HeroPublicWithTeam(Long id, String name, Integer age, Long teamId, TeamPublic team) {

    public static HeroPublicWithTeam from(Hero hero) {
        TeamPublic team = hero.getTeam() != null ? TeamPublic.from(hero.getTeam()) : null;
        return new HeroPublicWithTeam(hero.getId(), hero.getName(), hero.getAge(), hero.getTeamId(), team);
    }
}
