package de.jwiegmann.scraper.control;

import de.jwiegmann.scraper.boundary.dto.error.ScrapeError;

import java.util.Map;

public final class ScrapeErrorFactory {

    private ScrapeErrorFactory() {
    }

    public static ScrapeError validationFailed(String code, String field, String details) {
        return ScrapeError.builder()
                .code(code)
                .message("Request validation failed: " + details)
                .details(Map.of("field", field))
                .build();
    }

    public static ScrapeError malformedRequest(String details) {
        return ScrapeError.builder()
                .code("MALFORMED_REQUEST")
                .message("Invalid JSON body")
                .details(Map.of("details", details))
                .build();
    }

    public static ScrapeError jobAlreadySubmitted(String jobId) {
        return ScrapeError.builder()
                .code("JOB_ALREADY_SUBMITTED")
                .message("job already submitted")
                .details(Map.of("jobId", jobId))
                .build();
    }

    public static ScrapeError jobRejected(String jobId) {
        return ScrapeError.builder()
                .code("JOB_REJECTED")
                .message("job executor is saturated, retry later")
                .details(Map.of("jobId", jobId))
                .build();
    }

    public static ScrapeError jobNotFound(String jobId) {
        return ScrapeError.builder()
                .code("JOB_NOT_FOUND")
                .message("Job not found")
                .details(Map.of("jobId", jobId))
                .build();
    }

    public static ScrapeError storeAccessFailed(String jobId) {
        return ScrapeError.builder()
                .code("STORE_ACCESS_FAILED")
                .message("Failed to retrieve job status due to database error")
                .details(Map.of("jobId", jobId))
                .build();
    }
}
