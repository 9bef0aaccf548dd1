package de.jwiegmann.scraper.control.executor;

/**
 * Interne Phasen eines Job-Laufs (nur für Logging und Diagnose).
 */
enum ExecutionPhase {
    INIT,
    SESSION_ACQUIRED,
    NAVIGATED,
    SUCCESS,
    FAILED
}
