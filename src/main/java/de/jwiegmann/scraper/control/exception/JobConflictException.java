package de.jwiegmann.scraper.control.exception;

import lombok.Getter;

/**
 * Für die jobId wurde bereits ein Job angenommen.
 */
@Getter
public class JobConflictException extends RuntimeException {

    private final String jobId;

    public JobConflictException(String jobId) {
        super("job already submitted: " + jobId);
        this.jobId = jobId;
    }
}
