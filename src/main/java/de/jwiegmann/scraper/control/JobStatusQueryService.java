package de.jwiegmann.scraper.control;

import de.jwiegmann.scraper.control.dto.StatusLookup;
import de.jwiegmann.scraper.control.exception.StoreAccessException;
import de.jwiegmann.scraper.control.repository.JobStatusStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Liest den aktuellen Zustand eines Jobs aus dem Status-Store (nur lesend).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStatusQueryService {

    private final JobStatusStore store;

    /**
     * @param jobId ID des Jobs
     * @return FOUND mit Record, NOT_FOUND wenn noch kein Record existiert, ERROR bei Store-Fehlern
     */
    public StatusLookup get(String jobId) {
        try {
            return store.find(jobId)
                    .map(record -> {
                        log.debug("Found job {} with status {}", jobId, record.getStatus());
                        return StatusLookup.found(record);
                    })
                    .orElseGet(() -> {
                        log.debug("No record for job {} yet", jobId);
                        return StatusLookup.notFound(jobId);
                    });
        } catch (StoreAccessException e) {
            log.error("Status store access failed for job {}", jobId, e);
            return StatusLookup.error(jobId, e.getMessage());
        }
    }
}
