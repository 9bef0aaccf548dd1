package de.jwiegmann.scraper.control.exception;

import java.time.Duration;

/**
 * Eine zeitlich begrenzte externe Operation (Session, Connect, Navigation) hat ihr Limit überschritten.
 */
public class AutomationTimeoutException extends RuntimeException {

    public AutomationTimeoutException(String operation, Duration limit, Throwable cause) {
        super(operation + " exceeded " + limit.toMillis() + " ms", cause);
    }
}
