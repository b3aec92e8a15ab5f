package com.heroes.heroes_api.controller;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heroes.heroes_api.config.DatabaseUrls;

/**
 * Health check endpoint to diagnose database connectivity
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    private final JdbcTemplate jdbcTemplate;

    @Value("${spring.datasource.url:not-set}")
    private String datasourceUrl;

    public HealthController(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("service", "heroes-api");

        Map<String, Object> database = new HashMap<>();
        boolean connected;
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            connected = true;
        } catch (Exception e) {
            connected = false;
            database.put("error", e.getMessage());
            logger.error("Database health check failed: {}", e.getMessage(), e);
        }
        database.put("connected", connected);
        database.put("url", DatabaseUrls.mask(datasourceUrl));
        health.put("database", database);
        health.put("status", connected ? "UP" : "DOWN");

        return ResponseEntity.status(connected ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}
