package com.kmg.grading.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final GradingProperties properties;
    private final JdbcTemplate jdbcTemplate;

    public StartupInitializer(GradingProperties properties, JdbcTemplate jdbcTemplate) {
        this.properties = properties;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        initializeSchema();
        log.info("Grading service endpoint: {}", properties.getService().getBaseUrl());
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(Path.of(properties.getBaseDir()));
        Files.createDirectories(Path.of(properties.getOutput().getReportDir()));
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
        Path dbPath = Path.of(properties.getState().getDbPath());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
    }

    void initializeSchema() {
        configureSqlitePragmas();

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS evaluation_results (
              batch_id TEXT NOT NULL,
              job_index INTEGER NOT NULL,
              attempt INTEGER NOT NULL,
              source_document TEXT NOT NULL,
              external_job_id TEXT,
              scoring_mode TEXT NOT NULL,
              grand_total REAL NOT NULL,
              max_possible REAL NOT NULL,
              passed INTEGER NOT NULL,
              result_json TEXT NOT NULL,
              completed_at TEXT NOT NULL,
              PRIMARY KEY (batch_id, job_index, attempt)
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_evaluation_results_document
              ON evaluation_results(source_document)
            """);
    }

    private void configureSqlitePragmas() {
        try {
            jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
            jdbcTemplate.execute("PRAGMA synchronous=NORMAL");
            jdbcTemplate.execute("PRAGMA busy_timeout=30000");
        } catch (Exception e) {
            log.warn("Failed to configure SQLite pragmas: {}", e.getMessage());
        }
    }
}
