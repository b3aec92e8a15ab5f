package com.heroes.heroes_api.service;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heroes.heroes_api.dto.TeamCreate;
import com.heroes.heroes_api.dto.TeamPublicWithHeroes;
import com.heroes.heroes_api.dto.TeamUpdate;
import com.heroes.heroes_api.model.Hero;
import com.heroes.heroes_api.model.Team;
import com.heroes.heroes_api.repository.HeroRepository;
import com.heroes.heroes_api.repository.TeamRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class TeamService {

    private static final Logger logger = LoggerFactory.getLogger(TeamService.class);

    private final TeamRepository teamRepository;
    private final HeroRepository heroRepository;

    @Transactional
    public TeamPublicWithHeroes createTeam(TeamCreate request) {
        Team saved = teamRepository.save(new Team(request.name(), request.headquarters()));
        logger.info("Created team '{}' with ID: {}", saved.getName(), saved.getId());
        return TeamPublicWithHeroes.from(saved);
    }

    @Transactional(readOnly = true)
    public List<TeamPublicWithHeroes> getAllTeams() {
        return teamRepository.findAllByOrderByIdAsc().stream()
                .map(TeamPublicWithHeroes::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<TeamPublicWithHeroes> getTeamById(Long id) {
        return teamRepository.findById(id).map(TeamPublicWithHeroes::from);
    }

    @Transactional
    public Optional<TeamPublicWithHeroes> updateTeam(Long id, TeamUpdate update) {
        return teamRepository.findById(id).map(existingTeam -> {
            // Only the fields present in the request are applied
            if (update.name() != null) {
                existingTeam.setName(update.name());
            }
            if (update.headquarters() != null) {
                existingTeam.setHeadquarters(update.headquarters());
            }
            Team saved = teamRepository.save(existingTeam);
            logger.info("Updated team ID: {}", saved.getId());
            return TeamPublicWithHeroes.from(saved);
        });
    }

    /**
     * Deletes a team and leaves its heroes without a team.
     *
     * @return the name of the deleted team, or empty if no team has that id
     */
    @Transactional
    public Optional<String> deleteTeam(Long id) {
        Optional<Team> found = teamRepository.findById(id);
        if (found.isEmpty()) {
            logger.warn("Team with ID: {} not found for deletion", id);
            return Optional.empty();
        }
        Team team = found.get();

        List<Hero> heroes = heroRepository.findAllByTeam(team);
        for (Hero hero : heroes) {
            hero.assignTeam(null);
        }
        heroRepository.saveAll(heroes);

        teamRepository.delete(team);
        logger.info("Deleted team '{}' (ID: {}), {} hero(es) left without a team", team.getName(), id, heroes.size());
        return Optional.of(team.getName());
    }

    @Transactional
    public void deleteAllTeams() {
        int detached = heroRepository.clearAllTeams();
        teamRepository.deleteAll();
        logger.warn("Deleted all teams, {} hero(es) left without a team", detached);
    }
}
