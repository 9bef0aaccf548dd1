package de.jwiegmann.scraper.control.executor;

import de.jwiegmann.scraper.control.exception.AutomationTimeoutException;
import de.jwiegmann.scraper.control.exception.ConfigurationException;
import de.jwiegmann.scraper.control.exception.ProviderException;
import lombok.Getter;

import java.util.concurrent.TimeoutException;

/**
 * Fehlerkategorie eines gescheiterten Jobs. Der Präfix landet in der errorMessage,
 * damit Clients Konfigurationsfehler von Anbieter- und Timeout-Problemen unterscheiden können.
 */
public enum FailureCategory {

    CONFIGURATION("Configuration error"),
    PROVIDER("Provider error"),
    TIMEOUT("Timeout"),
    UNEXPECTED("Unexpected error");

    @Getter
    private final String label;

    FailureCategory(String label) {
        this.label = label;
    }

    public static FailureCategory of(Throwable failure) {
        if (failure instanceof ConfigurationException) {
            return CONFIGURATION;
        }
        if (failure instanceof AutomationTimeoutException || failure instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (failure instanceof ProviderException) {
            return PROVIDER;
        }
        return UNEXPECTED;
    }

    public String describe(Throwable failure) {
        return label + ": " + rootMessage(failure);
    }

    private static String rootMessage(Throwable t) {
        String msg = t.getMessage();
        if (msg != null && !msg.isBlank()) {
            return msg;
        }
        Throwable cur = t;
        while (cur.getCause() != null) cur = cur.getCause();
        msg = cur.getMessage();
        return (msg == null || msg.isBlank()) ? cur.getClass().getSimpleName() : msg;
    }
}
