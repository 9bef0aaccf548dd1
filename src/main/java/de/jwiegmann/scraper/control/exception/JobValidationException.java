package de.jwiegmann.scraper.control.exception;

import lombok.Getter;

@Getter
public class JobValidationException extends RuntimeException {

    private final String errorCode;
    private final String field;

    public JobValidationException(String errorCode, String field, String message) {
        super(message);
        this.errorCode = errorCode;
        this.field = field;
    }
}
