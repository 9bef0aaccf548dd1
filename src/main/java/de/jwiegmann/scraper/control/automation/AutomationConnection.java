package de.jwiegmann.scraper.control.automation;

import java.time.Duration;

/**
 * Verbindung zu einer Browser-Seite innerhalb einer Remote-Session.
 * {@link #close()} muss auch bei bereits abgebrochener Verbindung aufrufbar sein.
 */
public interface AutomationConnection extends AutoCloseable {

    void navigate(String url, Duration timeout);

    String title();

    long contentLength();

    @Override
    void close();
}
