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

import com.heroes.heroes_api.dto.TeamCreate;
import com.heroes.heroes_api.dto.TeamPublicWithHeroes;
import com.heroes.heroes_api.dto.TeamUpdate;
import com.heroes.heroes_api.service.TeamService;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@Tag(name = "team", description = "Teams and the heroes that belong to them")
@RequestMapping("/teams")
@RequiredArgsConstructor
public class TeamController {

    private final TeamService teamService;

    @PostMapping
    public TeamPublicWithHeroes createTeam(@Valid @RequestBody TeamCreate team) {
        return teamService.createTeam(team);
    }

    @GetMapping
    public List<TeamPublicWithHeroes> getAllTeams() {
        return teamService.getAllTeams();
    }

    @GetMapping("/{id}")
    public TeamPublicWithHeroes getTeamById(@PathVariable Long id) {
        return teamService.getTeamById(id)
                .orElseThrow(() -> notFound(id));
    }

    @PatchMapping("/{id}")
    public TeamPublicWithHeroes updateTeam(@PathVariable Long id, @Valid @RequestBody TeamUpdate team) {
        return teamService.updateTeam(id, team)
                .orElseThrow(() -> notFound(id));
    }

    // Confirmations go out as a bare JSON string, e.g. "team X deleted successfully"
    @DeleteMapping("/{id}")
    public TextNode deleteTeam(@PathVariable Long id) {
        String name = teamService.deleteTeam(id)
                .orElseThrow(() -> notFound(id));
        return TextNode.valueOf("team " + name + " deleted successfully");
    }

    @DeleteMapping
    public TextNode deleteAllTeams() {
        teamService.deleteAllTeams();
        return TextNode.valueOf("you have deleted all team");
    }

    private static NoSuchElementException notFound(Long id) {
        return new NoSuchElementException("team with team id " + id + " not found");
    }
}
