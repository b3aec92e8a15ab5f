package com.heroes.heroes_api.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import com.heroes.heroes_api.model.Hero;
import com.heroes.heroes_api.model.Team;

@Repository
public interface HeroRepository extends JpaRepository<Hero, Long> {

    List<Hero> findAllByOrderByIdAsc();

    List<Hero> findAllByTeam(Team team);

    boolean existsByHashedPassword(String hashedPassword);

    boolean existsByHashedPasswordAndIdNot(String hashedPassword, Long id);

    /**
     * Detaches every hero from its team. Used before removing all teams so the
     * heroes survive with no team.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Hero h set h.team = null where h.team is not null")
    int clearAllTeams();
}
