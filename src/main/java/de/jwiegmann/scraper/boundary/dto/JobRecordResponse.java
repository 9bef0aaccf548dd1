package de.jwiegmann.scraper.boundary.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import de.jwiegmann.scraper.entity.JobRecord;
import de.jwiegmann.scraper.entity.JobStatus;
import de.jwiegmann.scraper.entity.PayloadNumbers;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-Darstellung eines Job-Records. Die Felder des Result-Payloads
 * (z. B. {@code pageTitle}, {@code contentLength}) liegen flach auf oberster Ebene.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobRecordResponse {

    private String jobId;
    private String status;
    private String requestedUrl;
    private String receivedAt;
    private String lastUpdatedAt;
    private String sessionId;
    private String errorMessage;

    private Map<String, Object> resultFields;

    public static JobRecordResponse from(JobRecord record) {
        Map<String, Object> fields = record.getResultPayload() != null
                ? PayloadNumbers.normalize(record.getResultPayload())
                : new LinkedHashMap<>();
        return JobRecordResponse.builder()
                .jobId(record.getJobId())
                .status(record.getStatus().name())
                .requestedUrl(record.getRequestedUrl())
                .receivedAt(format(record.getReceivedAt()))
                .lastUpdatedAt(format(record.getLastUpdatedAt()))
                .sessionId(record.getSessionId())
                .errorMessage(record.getErrorMessage())
                .resultFields(fields)
                .build();
    }

    @JsonAnyGetter
    public Map<String, Object> getResultFields() {
        return resultFields != null ? resultFields : Map.of();
    }

    @JsonAnySetter
    public void putResultField(String name, Object value) {
        if (resultFields == null) {
            resultFields = new LinkedHashMap<>();
        }
        resultFields.put(name, PayloadNumbers.normalize(value));
    }

    /**
     * Rückrichtung für Clients.
     *
     * @throws IllegalArgumentException bei unbekanntem Status oder ungültigen Zeitstempeln
     */
    public JobRecord toRecord() {
        if (status == null) {
            throw new IllegalArgumentException("status is missing");
        }
        return JobRecord.builder()
                .jobId(jobId)
                .status(JobStatus.valueOf(status))
                .requestedUrl(requestedUrl)
                .receivedAt(parse(receivedAt))
                .lastUpdatedAt(parse(lastUpdatedAt))
                .sessionId(sessionId)
                .errorMessage(errorMessage)
                .resultPayload(resultFields == null || resultFields.isEmpty() ? null : new LinkedHashMap<>(resultFields))
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static Instant parse(String value) {
        try {
            return value != null ? Instant.parse(value) : null;
        } catch (java.time.format.DateTimeParseException e) {
            throw new IllegalArgumentException("invalid timestamp: " + value, e);
        }
    }
}
