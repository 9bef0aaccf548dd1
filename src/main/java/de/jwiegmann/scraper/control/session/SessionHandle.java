package de.jwiegmann.scraper.control.session;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle auf eine erworbene Remote-Session: Connect-Endpunkt und Session-ID.
 * Wird genau einmal über {@link RemoteSessionManager#release(SessionHandle)} freigegeben.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class SessionHandle {

    @ToString.Include
    private final String sessionId;
    private final String connectUrl;

    @Getter(AccessLevel.PACKAGE)
    private final ProviderCredentials credentials;

    private final AtomicBoolean released = new AtomicBoolean(false);

    SessionHandle(String sessionId, String connectUrl, ProviderCredentials credentials) {
        this.sessionId = sessionId;
        this.connectUrl = connectUrl;
        this.credentials = credentials;
    }

    public boolean isReleased() {
        return released.get();
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }
}
