package de.jwiegmann.scraper.control.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubmissionValidationResult {

    private boolean valid;
    private String errorCode;
    private String field;
    private String errorMessage;

    public static SubmissionValidationResult valid() {
        return new SubmissionValidationResult(true, null, null, null);
    }

    public static SubmissionValidationResult invalid(String errorCode, String field, String message) {
        return new SubmissionValidationResult(false, errorCode, field, message);
    }
}
