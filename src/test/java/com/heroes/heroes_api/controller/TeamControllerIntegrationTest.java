package com.heroes.heroes_api.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.heroes.heroes_api.repository.HeroRepository;
import com.heroes.heroes_api.repository.TeamRepository;
import com.jayway.jsonpath.JsonPath;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TeamControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TeamRepository teamRepository;

    @Autowired
    private HeroRepository heroRepository;

    @BeforeEach
    void cleanDatabase() {
        heroRepository.deleteAllInBatch();
        teamRepository.deleteAllInBatch();
    }

    private long createTeam(String name, String headquarters) throws Exception {
        MvcResult result = mockMvc.perform(post("/teams")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"" + name + "\", \"headquarters\": \"" + headquarters + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        return ((Number) JsonPath.read(result.getResponse().getContentAsString(), "$.id")).longValue();
    }

    private long createHero(String name, String password, Long teamId) throws Exception {
        String teamField = teamId != null ? ", \"team_id\": " + teamId : "";
        MvcResult result = mockMvc.perform(post("/heroes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"" + name + "\", \"secret_name\": \"secret " + name + "\", "
                                + "\"password\": \"" + password + "\"" + teamField + "}"))
                .andExpect(status().isOk())
                .andReturn();
        return ((Number) JsonPath.read(result.getResponse().getContentAsString(), "$.id")).longValue();
    }

    @Test
    void createdTeamCanBeFetchedById() throws Exception {
        long id = createTeam("Preventers", "Sharp Tower");

        mockMvc.perform(get("/teams/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id))
                .andExpect(jsonPath("$.name").value("Preventers"))
                .andExpect(jsonPath("$.headquarters").value("Sharp Tower"))
                .andExpect(jsonPath("$.heroes", hasSize(0)));
    }

    @Test
    void teamListsItsHeroes() throws Exception {
        long teamId = createTeam("Z-Force", "Sister Margaret's Bar");
        createHero("Deadpond", "chimichanga", teamId);

        mockMvc.perform(get("/teams"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].heroes", hasSize(1)))
                .andExpect(jsonPath("$[0].heroes[0].name").value("Deadpond"))
                .andExpect(jsonPath("$[0].heroes[0].team_id").value(teamId))
                .andExpect(jsonPath("$[0].heroes[0].secret_name").doesNotExist())
                .andExpect(jsonPath("$[0].heroes[0].hashed_password").doesNotExist());
    }

    @Test
    void emptyListIsNotAnError() throws Exception {
        mockMvc.perform(get("/teams"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void unknownTeamIsNotFound() throws Exception {
        mockMvc.perform(get("/teams/{id}", 999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("team with team id 999 not found"));
    }

    @Test
    void patchUpdatesOnlyProvidedFields() throws Exception {
        long id = createTeam("Preventers", "Sharp Tower");

        mockMvc.perform(patch("/teams/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"headquarters\": \"Tower of Sharpness\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Preventers"))
                .andExpect(jsonPath("$.headquarters").value("Tower of Sharpness"));
    }

    @Test
    void patchUnknownTeamIsNotFound() throws Exception {
        mockMvc.perform(patch("/teams/{id}", 999)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Nobody\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void createRequiresNameAndHeadquarters() throws Exception {
        mockMvc.perform(post("/teams")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Preventers\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.headquarters").exists());
    }

    @Test
    void deletingTeamKeepsItsHeroesWithoutTeam() throws Exception {
        long teamId = createTeam("Preventers", "Sharp Tower");
        long heroId = createHero("Rusty-Man", "rusty", teamId);

        mockMvc.perform(delete("/teams/{id}", teamId))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().string("\"team Preventers deleted successfully\""));

        mockMvc.perform(get("/heroes/{id}", heroId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Rusty-Man"))
                .andExpect(jsonPath("$.team_id").value(nullValue()))
                .andExpect(jsonPath("$.team").value(nullValue()));
    }

    @Test
    void deletingUnknownTeamIsNotFound() throws Exception {
        mockMvc.perform(delete("/teams/{id}", 999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("team with team id 999 not found"));
    }

    @Test
    void deletingAllTeamsKeepsHeroes() throws Exception {
        long first = createTeam("Preventers", "Sharp Tower");
        long second = createTeam("Z-Force", "Sister Margaret's Bar");
        createHero("Rusty-Man", "rusty", first);
        createHero("Deadpond", "chimichanga", second);

        mockMvc.perform(delete("/teams"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().string("\"you have deleted all team\""));

        mockMvc.perform(get("/teams"))
                .andExpect(jsonPath("$", hasSize(0)));
        mockMvc.perform(get("/heroes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].team_id").value(nullValue()))
                .andExpect(jsonPath("$[1].team_id").value(nullValue()));
    }
}
