package de.jwiegmann.scraper.control.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.scraper.control.exception.StoreAccessException;
import de.jwiegmann.scraper.entity.JobRecord;
import de.jwiegmann.scraper.entity.JobStatus;
import de.jwiegmann.scraper.entity.PayloadNumbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-Implementierung des Status-Stores (H2, Tabelle {@code job_status}).
 * Der Result-Payload wird als JSON-Text abgelegt; Zahlen folgen {@link PayloadNumbers}.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "scraper.store.type", havingValue = "jdbc")
public class JdbcJobStatusStore implements JobStatusStore {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private static final String SELECT_SQL = """
            SELECT job_id, status, requested_url, received_at, last_updated_at,
                   session_id, result_payload, error_message
              FROM job_status
             WHERE job_id = ?
            """;

    private static final String UPSERT_SQL = """
            MERGE INTO job_status (
              job_id, status, requested_url, received_at, last_updated_at,
              session_id, result_payload, error_message
            ) KEY (job_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public JdbcJobStatusStore(JdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
                .enable(DeserializationFeature.USE_LONG_FOR_INTS)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    @Override
    public Optional<JobRecord> find(String jobId) {
        try {
            List<JobRecord> rows = jdbc.query(SELECT_SQL, (rs, rowNum) -> mapRow(rs), jobId);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StoreAccessException("failed to read job " + jobId, e);
        }
    }

    @Override
    public JobRecord upsert(JobRecord record) {
        String payload = writePayload(record);
        try {
            jdbc.update(UPSERT_SQL,
                    record.getJobId(),
                    record.getStatus().name(),
                    record.getRequestedUrl(),
                    toUtc(record.getReceivedAt()),
                    toUtc(record.getLastUpdatedAt()),
                    record.getSessionId(),
                    payload,
                    record.getErrorMessage());
            return record;
        } catch (DataAccessException e) {
            throw new StoreAccessException("failed to write job " + record.getJobId(), e);
        }
    }

    private JobRecord mapRow(ResultSet rs) throws SQLException {
        return JobRecord.builder()
                .jobId(rs.getString("job_id"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .requestedUrl(rs.getString("requested_url"))
                .receivedAt(toInstant(rs.getObject("received_at", OffsetDateTime.class)))
                .lastUpdatedAt(toInstant(rs.getObject("last_updated_at", OffsetDateTime.class)))
                .sessionId(rs.getString("session_id"))
                .resultPayload(readPayload(rs.getString("result_payload")))
                .errorMessage(rs.getString("error_message"))
                .build();
    }

    private String writePayload(JobRecord record) {
        if (record.getResultPayload() == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(PayloadNumbers.normalize(record.getResultPayload()));
        } catch (JsonProcessingException e) {
            throw new StoreAccessException("result payload of job " + record.getJobId() + " is not serializable", e);
        }
    }

    private Map<String, Object> readPayload(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return PayloadNumbers.normalize(mapper.readValue(json, PAYLOAD_TYPE));
        } catch (JsonProcessingException e) {
            throw new StoreAccessException("stored result payload is not valid JSON", e);
        }
    }

    // mit Offset gespeichert, unabhängig von der Zeitzone der JVM
    private static OffsetDateTime toUtc(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }
}
