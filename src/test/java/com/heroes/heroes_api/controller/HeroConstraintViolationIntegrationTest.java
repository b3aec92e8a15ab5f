package com.heroes.heroes_api.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.sql.SQLIntegrityConstraintViolationException;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import com.heroes.heroes_api.dto.HeroCreate;
import com.heroes.heroes_api.service.HeroService;

/**
 * Constraint violations raised below the service, as when two concurrent
 * creates both pass the password check.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class HeroConstraintViolationIntegrationTest {

    private static final String DEADPOND =
            "{\"name\": \"Deadpond\", \"secret_name\": \"Dive Wilson\", \"password\": \"chimichanga\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HeroService heroService;

    @Test
    void duplicatePasswordFromDatabaseIsConflict() throws Exception {
        when(heroService.createHero(any(HeroCreate.class))).thenThrow(new DataIntegrityViolationException(
                "could not execute statement",
                new SQLIntegrityConstraintViolationException(
                        "Unique index or primary key violation: \"PUBLIC.UK_HERO_PW ON PUBLIC.HERO(HASHED_PASSWORD NULLS FIRST)\"")));

        mockMvc.perform(post("/heroes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DEADPOND))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("password already taken"));
    }

    @Test
    void otherConstraintViolationIsGenericConflict() throws Exception {
        when(heroService.createHero(any(HeroCreate.class))).thenThrow(new DataIntegrityViolationException("dup"));

        mockMvc.perform(post("/heroes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DEADPOND))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("request conflicts with existing data"));
    }
}
