package com.heroes.heroes_api.config;

import java.sql.Connection;
import java.sql.DatabaseMetaData;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Logs database connection status on application startup
 */
@Component
public class DatabaseConnectionLogger implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConnectionLogger.class);

    private final DataSource dataSource;

    public DatabaseConnectionLogger(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void run(String... args) {
        logger.info("=== DATABASE CONNECTION CHECK ===");
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            logger.info("Database URL: {}", DatabaseUrls.mask(metaData.getURL()));
            logger.info("Connected to {} {}", metaData.getDatabaseProductName(), metaData.getDatabaseProductVersion());
            logger.info("=== DATABASE CONNECTION: OK ===");
        } catch (Exception e) {
            logger.error("Database connection failed: {}", e.getMessage(), e);
            logger.error("=== DATABASE CONNECTION: FAILED ===");
        }
    }
}
