package de.jwiegmann.scraper.control.executor;

import de.jwiegmann.scraper.control.exception.StoreAccessException;
import de.jwiegmann.scraper.control.repository.JobStatusStore;
import de.jwiegmann.scraper.entity.JobRecord;
import de.jwiegmann.scraper.entity.JobStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Schreibt die Zustände eines einzelnen Jobs in den Status-Store.
 * Erzwingt die Reihenfolge PENDING, RUNNING (optional), terminal; genau einen terminalen Write
 * und ein nicht fallendes {@code lastUpdatedAt}.
 * Eine Instanz gehört zu genau einem Job-Lauf und wird nicht geteilt.
 */
@Slf4j
class JobRecordWriter {

    private final JobStatusStore store;
    private final Clock clock;
    private final String jobId;

    private JobRecord current;

    JobRecordWriter(JobStatusStore store, Clock clock, String jobId) {
        this.store = store;
        this.clock = clock;
        this.jobId = jobId;
    }

    boolean pending(String requestedUrl) {
        if (current != null) {
            throw new IllegalStateException("job " + jobId + " already initialised");
        }
        Instant now = now();
        return write(JobRecord.builder()
                .jobId(jobId)
                .status(JobStatus.PENDING)
                .requestedUrl(requestedUrl)
                .receivedAt(now)
                .lastUpdatedAt(now)
                .build());
    }

    boolean running(String sessionId) {
        return write(requireCurrent().toBuilder()
                .status(JobStatus.RUNNING)
                .sessionId(sessionId)
                .build());
    }

    /**
     * Schreibt den terminalen Record genau einmal. Session-ID bleibt erhalten, sofern vorhanden.
     */
    boolean terminal(ExecutionOutcome outcome) {
        JobRecord.JobRecordBuilder next = requireCurrent().toBuilder()
                .status(outcome.getStatus());
        if (outcome.isSuccess()) {
            next.resultPayload(outcome.getResultPayload()).errorMessage(null);
        } else {
            next.resultPayload(null).errorMessage(outcome.getErrorMessage());
        }
        return write(next.build());
    }

    JobRecord current() {
        return current;
    }

    private boolean write(JobRecord next) {
        if (current != null && !current.getStatus().canAdvanceTo(next.getStatus())) {
            throw new IllegalStateException("illegal transition for job " + jobId + ": "
                    + current.getStatus() + " -> " + next.getStatus());
        }
        Instant now = now();
        if (current != null && now.isBefore(current.getLastUpdatedAt())) {
            now = current.getLastUpdatedAt();
        }
        next.setLastUpdatedAt(now);
        // auch bei Store-Fehlern übernehmen, der nächste Write enthält dann alle Felder
        current = next;
        try {
            store.upsert(next);
            log.info("Job {} -> {}", jobId, next.getStatus());
            return true;
        } catch (StoreAccessException e) {
            log.error("Failed to persist status {} for job {}: {}", next.getStatus(), jobId, e.getMessage(), e);
            return false;
        }
    }

    private JobRecord requireCurrent() {
        if (current == null) {
            throw new IllegalStateException("job " + jobId + " not initialised");
        }
        return current;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
