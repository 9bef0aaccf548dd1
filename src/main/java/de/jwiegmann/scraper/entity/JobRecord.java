package de.jwiegmann.scraper.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persistenter Zustand eines Scrape-Jobs, eindeutig über {@code jobId}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobRecord {

    public static final String PAGE_TITLE = "pageTitle";
    public static final String CONTENT_LENGTH = "contentLength";

    private String jobId;
    private JobStatus status;

    private String requestedUrl;
    private Instant receivedAt;
    private Instant lastUpdatedAt;

    // erst nach erfolgreicher Session-Erstellung gesetzt
    private String sessionId;

    // nur bei SUCCESS
    private Map<String, Object> resultPayload;

    // nur bei FAILED
    private String errorMessage;

    /**
     * Liefert eine Kopie, deren Payload-Map vom Original entkoppelt ist.
     */
    public JobRecord copy() {
        return toBuilder()
                .resultPayload(resultPayload != null ? new LinkedHashMap<>(resultPayload) : null)
                .build();
    }
}
