package de.jwiegmann.scraper.control.repository;

import de.jwiegmann.scraper.entity.JobRecord;

import java.util.Optional;

/**
 * Dauerhafter Speicher der Job-Records, Schlüssel ist die jobId.
 * Beide Operationen sind einzeln atomar und wirken auf genau einen Record.
 *
 * @throws de.jwiegmann.scraper.control.exception.StoreAccessException bei Zugriffsfehlern
 */
public interface JobStatusStore {

    Optional<JobRecord> find(String jobId);

    /**
     * Schreibt den Record vollständig (ersetzt einen vorhandenen Record mit gleicher jobId).
     */
    JobRecord upsert(JobRecord record);
}
