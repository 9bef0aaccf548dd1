package de.jwiegmann.scraper.client;

import de.jwiegmann.scraper.control.dto.StatusLookup;

/**
 * Fähigkeit, den aktuellen Zustand eines Jobs abzufragen (HTTP, direkt am Service, Testdoubles).
 */
@FunctionalInterface
public interface JobStatusSource {

    StatusLookup check(String jobId);
}
