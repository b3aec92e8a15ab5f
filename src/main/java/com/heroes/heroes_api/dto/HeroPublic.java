package com.heroes.heroes_api.dto;

import com.heroes.heroes_api.model.Hero;

/**
 * Public view of a hero. The secret name and password hash are never exposed.
 */
public record HeroPublic(Long id, String name, Integer age, Long teamId) {

    public static HeroPublic from(Hero hero) {
        return new HeroPublic(hero.getId(), hero.getName(), hero.getAge(), hero.getTeamId());
    }
}
