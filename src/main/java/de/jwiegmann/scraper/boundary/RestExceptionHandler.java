package de.jwiegmann.scraper.boundary;

import de.jwiegmann.scraper.boundary.dto.error.ScrapeError;
import de.jwiegmann.scraper.control.ScrapeErrorFactory;
import de.jwiegmann.scraper.control.exception.JobConflictException;
import de.jwiegmann.scraper.control.exception.JobRejectedException;
import de.jwiegmann.scraper.control.exception.JobValidationException;
import de.jwiegmann.scraper.control.exception.StoreAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Übersetzt Fehler der Job-Annahme in HTTP-Antworten mit {@link ScrapeError}-Body.
 */
@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(JobValidationException.class)
    public ResponseEntity<ScrapeError> handleValidation(JobValidationException e) {
        return ResponseEntity.badRequest()
                .body(ScrapeErrorFactory.validationFailed(e.getErrorCode(), e.getField(), e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ScrapeError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Failed to parse request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(ScrapeErrorFactory.malformedRequest(e.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(JobConflictException.class)
    public ResponseEntity<ScrapeError> handleConflict(JobConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ScrapeErrorFactory.jobAlreadySubmitted(e.getJobId()));
    }

    @ExceptionHandler(JobRejectedException.class)
    public ResponseEntity<ScrapeError> handleRejected(JobRejectedException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ScrapeErrorFactory.jobRejected(e.getJobId()));
    }

    @ExceptionHandler(StoreAccessException.class)
    public ResponseEntity<ScrapeError> handleStoreAccess(StoreAccessException e) {
        log.error("Status store access failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ScrapeError.builder()
                        .code("STORE_ACCESS_FAILED")
                        .message("An internal server error occurred")
                        .build());
    }
}
