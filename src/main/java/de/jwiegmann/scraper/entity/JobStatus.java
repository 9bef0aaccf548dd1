package de.jwiegmann.scraper.entity;

/**
 * Lebenszyklus eines Scrape-Jobs. Der Status schreitet nur vorwärts:
 * PENDING -> RUNNING -> SUCCESS | FAILED.
 */
public enum JobStatus {

    PENDING(0),
    RUNNING(1),
    SUCCESS(2),
    FAILED(2);

    private final int phase;

    JobStatus(int phase) {
        this.phase = phase;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    /**
     * Prüft, ob ein Übergang in den angegebenen Status erlaubt ist.
     * Terminale Status ändern sich nie mehr, alle anderen nur in eine spätere Phase.
     */
    public boolean canAdvanceTo(JobStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return next.phase > phase;
    }
}
