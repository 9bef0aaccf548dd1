package de.jwiegmann.scraper.control.exception;

import lombok.Getter;

/**
 * Der Job konnte nicht an den Executor übergeben werden (Pool ausgelastet).
 */
@Getter
public class JobRejectedException extends RuntimeException {

    private final String jobId;

    public JobRejectedException(String jobId, Throwable cause) {
        super("job executor rejected job " + jobId, cause);
        this.jobId = jobId;
    }
}
