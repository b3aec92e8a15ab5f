package com.heroes.heroes_api.controller;

import java.util.List;
import java.util.NoSuchElementException;

import com.fasterxml.jackson.databind.node.TextNode;

import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heroes.heroes_api.dto.HeroCreate;
import com.heroes.heroes_api.dto.HeroPublicWithTeam;
import com.heroes.heroes_api.dto.HeroUpdate;
import com.heroes.heroes_api.service.HeroService;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@Tag(name = "hero", description = "Heroes, their secret identities and team membership")
@RequestMapping("/heroes")
@RequiredArgsConstructor
public class HeroController {

    private final HeroService heroService;

    @PostMapping
    public HeroPublicWithTeam createHero(@Valid @RequestBody HeroCreate hero) {
        return heroService.createHero(hero);
    }

    @GetMapping
    public List<HeroPublicWithTeam> getAllHeroes() {
        return heroService.getAllHeroes();
    }

    @GetMapping("/{id}")
    public HeroPublicWithTeam getHeroById(@PathVariable Long id) {
        return heroService.getHeroById(id)
                .orElseThrow(() -> notFound(id));
    }

    @PatchMapping("/{id}")
    public HeroPublicWithTeam updateHero(@PathVariable Long id, @Valid @RequestBody HeroUpdate hero) {
        return heroService.updateHero(id, hero)
                .orElseThrow(() -> notFound(id));
    }

    // Confirmations go out as a bare JSON string, e.g. "hero X deleted"
    @DeleteMapping("/{id}")
    public TextNode deleteHero(@PathVariable Long id) {
        String name = heroService.deleteHero(id)
                .orElseThrow(() -> notFound(id));
        return TextNode.valueOf("hero " + name + " deleted");
    }

    @DeleteMapping
    public TextNode deleteAllHeroes() {
        heroService.deleteAllHeroes();
        return TextNode.valueOf("heroes deleted");
    }

    private static NoSuchElementException notFound(Long id) {
        return new NoSuchElementException("hero with id " + id + " not found");
    }
}
