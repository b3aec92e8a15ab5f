package com.heroes.heroes_api.service;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heroes.heroes_api.dto.HeroCreate;
import com.heroes.heroes_api.dto.HeroPublicWithTeam;
import com.heroes.heroes_api.dto.HeroUpdate;
import com.heroes.heroes_api.exception.ConflictException;
import com.heroes.heroes_api.model.Hero;
import com.heroes.heroes_api.model.Team;
import com.heroes.heroes_api.repository.HeroRepository;
import com.heroes.heroes_api.repository.TeamRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class HeroService {

    private static final Logger logger = LoggerFactory.getLogger(HeroService.class);

    public static final String PASSWORD_TAKEN = "password already taken";

    private final HeroRepository heroRepository;
    private final TeamRepository teamRepository;
    private final HeroPasswordHasher passwordHasher;

    @Transactional
    public HeroPublicWithTeam createHero(HeroCreate request) {
        String hashedPassword = passwordHasher.hash(request.password());
        if (heroRepository.existsByHashedPassword(hashedPassword)) {
            logger.warn("Rejected hero '{}': password already in use", request.name());
            throw new ConflictException(PASSWORD_TAKEN);
        }

        Hero hero = new Hero(request.name(), request.age(), request.secretName(), hashedPassword);
        if (request.teamId() != null) {
            hero.assignTeam(findTeam(request.teamId()));
        }

        Hero saved = heroRepository.save(hero);
        logger.info("Created hero '{}' with ID: {}", saved.getName(), saved.getId());
        return HeroPublicWithTeam.from(saved);
    }

    @Transactional(readOnly = true)
    public List<HeroPublicWithTeam> getAllHeroes() {
        return heroRepository.findAllByOrderByIdAsc().stream()
                .map(HeroPublicWithTeam::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<HeroPublicWithTeam> getHeroById(Long id) {
        return heroRepository.findById(id).map(HeroPublicWithTeam::from);
    }

    /**
     * Applies the fields present in {@code update}. A password in the update
     * replaces the current one unless another hero already uses it.
     */
    @Transactional
    public Optional<HeroPublicWithTeam> updateHero(Long id, HeroUpdate update) {
        return heroRepository.findById(id).map(existingHero -> {
            if (update.getPassword() != null) {
                String hashedPassword = passwordHasher.hash(update.getPassword());
                if (heroRepository.existsByHashedPasswordAndIdNot(hashedPassword, id)) {
                    logger.warn("Rejected password change for hero ID: {}: password already in use", id);
                    throw new ConflictException(PASSWORD_TAKEN);
                }
                existingHero.setHashedPassword(hashedPassword);
            }
            if (update.getName() != null) {
                existingHero.setName(update.getName());
            }
            if (update.getSecretName() != null) {
                existingHero.setSecretName(update.getSecretName());
            }
            if (update.hasAge()) {
                existingHero.setAge(update.getAge());
            }
            if (update.hasTeamId()) {
                existingHero.assignTeam(update.getTeamId() != null ? findTeam(update.getTeamId()) : null);
            }

            Hero saved = heroRepository.save(existingHero);
            logger.info("Updated hero ID: {}", saved.getId());
            return HeroPublicWithTeam.from(saved);
        });
    }

    /**
     * @return the name of the deleted hero, or empty if no hero has that id
     */
    @Transactional
    public Optional<String> deleteHero(Long id) {
        Optional<Hero> hero = heroRepository.findById(id);
        hero.ifPresentOrElse(
                existing -> {
                    existing.assignTeam(null);
                    heroRepository.delete(existing);
                    logger.info("Deleted hero '{}' (ID: {})", existing.getName(), id);
                },
                () -> logger.warn("Hero with ID: {} not found for deletion", id));
        return hero.map(Hero::getName);
    }

    @Transactional
    public void deleteAllHeroes() {
        long count = heroRepository.count();
        heroRepository.deleteAllInBatch();
        logger.warn("Deleted all heroes ({} row(s))", count);
    }

    private Team findTeam(Long teamId) {
        return teamRepository.findById(teamId)
                .orElseThrow(() -> new NoSuchElementException("team with team id " + teamId + " not found"));
    }
}
