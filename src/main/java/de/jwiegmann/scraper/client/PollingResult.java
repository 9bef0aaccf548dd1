package de.jwiegmann.scraper.client;

import de.jwiegmann.scraper.entity.JobRecord;
import de.jwiegmann.scraper.entity.JobStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Ergebnis eines Polling-Laufs. {@link Outcome#BUDGET_EXHAUSTED} ist ausdrücklich kein Fehlschlag:
 * der Job kann später noch fertig werden und mit derselben jobId erneut abgefragt werden.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PollingResult {

    public enum Outcome {
        /** terminaler Status (SUCCESS oder FAILED) beobachtet */
        COMPLETED,
        /** die Statusabfrage selbst ist fehlgeschlagen (ERROR_CHECKING) */
        CHECK_ERROR,
        /** kein terminaler Status innerhalb des Budgets */
        BUDGET_EXHAUSTED,
        /** Warten wurde unterbrochen */
        INTERRUPTED
    }

    private final Outcome outcome;
    private final String jobId;
    private final int attempts;
    // letzter beobachteter Record, kann fehlen
    private final JobRecord lastRecord;
    private final String errorMessage;

    static PollingResult completed(String jobId, int attempts, JobRecord record) {
        return new PollingResult(Outcome.COMPLETED, jobId, attempts, record, null);
    }

    static PollingResult checkError(String jobId, int attempts, JobRecord lastRecord, String errorMessage) {
        return new PollingResult(Outcome.CHECK_ERROR, jobId, attempts, lastRecord, errorMessage);
    }

    static PollingResult budgetExhausted(String jobId, int attempts, JobRecord lastRecord) {
        return new PollingResult(Outcome.BUDGET_EXHAUSTED, jobId, attempts, lastRecord, null);
    }

    static PollingResult interrupted(String jobId, int attempts, JobRecord lastRecord) {
        return new PollingResult(Outcome.INTERRUPTED, jobId, attempts, lastRecord, null);
    }

    public boolean isSucceeded() {
        return outcome == Outcome.COMPLETED && lastRecord.getStatus() == JobStatus.SUCCESS;
    }

    public boolean isFailed() {
        return outcome == Outcome.COMPLETED && lastRecord.getStatus() == JobStatus.FAILED;
    }
}
