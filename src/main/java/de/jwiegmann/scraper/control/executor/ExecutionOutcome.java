package de.jwiegmann.scraper.control.executor;

import de.jwiegmann.scraper.entity.JobRecord;
import de.jwiegmann.scraper.entity.JobStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminales Ergebnis eines Job-Laufs: {@code SUCCESS} mit Payload oder {@code FAILED} mit Kategorie und Meldung.
 * Jeder Ausgang von Connect, Navigation und Extraktion erzeugt genau eine Instanz.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ExecutionOutcome {

    static final int MAX_ERROR_LENGTH = 2000;

    private final JobStatus status;
    private final Map<String, Object> resultPayload;
    private final FailureCategory failureCategory;
    private final String errorMessage;

    public static ExecutionOutcome succeeded(String pageTitle, long contentLength) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(JobRecord.PAGE_TITLE, pageTitle);
        payload.put(JobRecord.CONTENT_LENGTH, contentLength);
        return new ExecutionOutcome(JobStatus.SUCCESS, Collections.unmodifiableMap(payload), null, null);
    }

    public static ExecutionOutcome failed(Throwable failure) {
        FailureCategory category = FailureCategory.of(failure);
        return failed(category, category.describe(failure));
    }

    public static ExecutionOutcome failed(FailureCategory category, String message) {
        String bounded = message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
        return new ExecutionOutcome(JobStatus.FAILED, null, category, bounded);
    }

    public boolean isSuccess() {
        return status == JobStatus.SUCCESS;
    }
}
