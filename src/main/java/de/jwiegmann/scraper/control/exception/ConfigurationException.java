package de.jwiegmann.scraper.control.exception;

/**
 * Fehlende oder ungültige Zugangsdaten bzw. Kennungen. Nicht wiederholbar.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
