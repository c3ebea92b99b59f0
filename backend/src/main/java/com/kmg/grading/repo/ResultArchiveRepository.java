package com.kmg.grading.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Completed evaluations, one row per job attempt. Uploaded documents are never stored here.
 */
@Repository
public class ResultArchiveRepository {
    private final JdbcTemplate jdbcTemplate;

    public ResultArchiveRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<ArchivedResult> ROW_MAPPER = new RowMapper<>() {
        @Override
        public ArchivedResult mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ArchivedResult(
                    rs.getString("batch_id"),
                    rs.getInt("job_index"),
                    rs.getInt("attempt"),
                    rs.getString("source_document"),
                    rs.getString("external_job_id"),
                    rs.getString("scoring_mode"),
                    rs.getDouble("grand_total"),
                    rs.getDouble("max_possible"),
                    rs.getInt("passed") == 1,
                    rs.getString("result_json"),
                    OffsetDateTime.parse(rs.getString("completed_at"))
            );
        }
    };

    public void save(ArchivedResult result) {
        jdbcTemplate.update(
                """
                INSERT OR REPLACE INTO evaluation_results(batch_id, job_index, attempt, source_document,
                                                          external_job_id, scoring_mode, grand_total,
                                                          max_possible, passed, result_json, completed_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                result.batchId(),
                result.jobIndex(),
                result.attempt(),
                result.sourceDocument(),
                result.externalJobId(),
                result.scoringMode(),
                result.grandTotal(),
                result.maxPossible(),
                result.passed() ? 1 : 0,
                result.resultJson(),
                result.completedAt().toString()
        );
    }

    public List<ArchivedResult> findByBatchId(String batchId) {
        return jdbcTemplate.query(
                "SELECT * FROM evaluation_results WHERE batch_id = ? ORDER BY job_index ASC, attempt ASC",
                ROW_MAPPER,
                batchId
        );
    }

    public List<ArchivedResult> findBySourceDocument(String sourceDocument) {
        return jdbcTemplate.query(
                "SELECT * FROM evaluation_results WHERE source_document = ? ORDER BY completed_at DESC",
                ROW_MAPPER,
                sourceDocument
        );
    }
}
