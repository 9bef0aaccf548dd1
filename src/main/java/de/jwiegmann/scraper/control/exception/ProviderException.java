package de.jwiegmann.scraper.control.exception;

/**
 * Der Remote-Browser-Anbieter hat eine Operation abgelehnt oder war nicht erreichbar.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
