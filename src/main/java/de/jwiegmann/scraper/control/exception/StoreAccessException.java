package de.jwiegmann.scraper.control.exception;

/**
 * Der Status-Store ist nicht erreichbar oder lieferte einen Fehler.
 * Nicht zu verwechseln mit "kein Eintrag".
 */
public class StoreAccessException extends RuntimeException {

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
