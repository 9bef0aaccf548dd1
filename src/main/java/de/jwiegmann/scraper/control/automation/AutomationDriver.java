package de.jwiegmann.scraper.control.automation;

import java.time.Duration;

/**
 * Baut eine Automatisierungsverbindung zu einer Remote-Browser-Session auf.
 */
public interface AutomationDriver {

    /**
     * @throws de.jwiegmann.scraper.control.exception.AutomationTimeoutException wenn der Connect das Limit überschreitet
     * @throws de.jwiegmann.scraper.control.exception.ProviderException          wenn die Session die Verbindung ablehnt
     */
    AutomationConnection connect(String endpoint, Duration timeout);
}
