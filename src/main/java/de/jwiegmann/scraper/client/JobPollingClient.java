package de.jwiegmann.scraper.client;

import de.jwiegmann.scraper.control.dto.StatusLookup;
import de.jwiegmann.scraper.entity.JobRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;

/**
 * Fragt den Status eines Jobs in festem Intervall ab, bis ein terminaler Status
 * (oder ERROR_CHECKING) beobachtet wird oder das Versuchsbudget aufgebraucht ist.
 * "Nicht gefunden" und nicht-terminale Status führen zu weiterem Polling.
 */
@Slf4j
public class JobPollingClient {

    /**
     * Unterbrechbare Pause zwischen zwei Versuchen.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final JobStatusSource source;
    private final PollingPolicy policy;
    private final Sleeper sleeper;

    public JobPollingClient(JobStatusSource source, PollingPolicy policy) {
        this(source, policy, duration -> Thread.sleep(duration.toMillis()));
    }

    public JobPollingClient(JobStatusSource source, PollingPolicy policy, Sleeper sleeper) {
        this.source = Objects.requireNonNull(source, "source");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public PollingResult poll(String jobId) {
        int maxAttempts = policy.getMaxAttempts();
        JobRecord last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                try {
                    sleeper.sleep(policy.getInterval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Polling for job {} interrupted after {} attempts", jobId, attempt - 1);
                    return PollingResult.interrupted(jobId, attempt - 1, last);
                }
            }

            StatusLookup lookup = source.check(jobId);
            switch (lookup.getKind()) {
                case FOUND -> {
                    last = lookup.getRecord();
                    log.info("Polling attempt {}/{} for job {}: status = {}", attempt, maxAttempts, jobId, last.getStatus());
                    if (last.getStatus().isTerminal()) {
                        return PollingResult.completed(jobId, attempt, last);
                    }
                }
                case NOT_FOUND -> log.info("Polling attempt {}/{} for job {}: no status yet", attempt, maxAttempts, jobId);
                case ERROR -> {
                    log.warn("Polling attempt {}/{} for job {}: {} ({})", attempt, maxAttempts, jobId,
                            StatusLookup.ERROR_CHECKING, lookup.getErrorMessage());
                    return PollingResult.checkError(jobId, attempt, last, lookup.getErrorMessage());
                }
            }
        }

        log.info("Job {} did not reach a final state within {} attempts; it may still be running", jobId, maxAttempts);
        return PollingResult.budgetExhausted(jobId, maxAttempts, last);
    }
}
