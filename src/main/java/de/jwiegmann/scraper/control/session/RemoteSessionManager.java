package de.jwiegmann.scraper.control.session;

import de.jwiegmann.scraper.control.exception.AutomationTimeoutException;
import de.jwiegmann.scraper.control.exception.ConfigurationException;
import de.jwiegmann.scraper.control.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Verwaltet Remote-Browser-Sessions: Zugangsdaten auflösen, Session erzeugen, Session freigeben.
 * Übersetzt Anbieterfehler in {@link ConfigurationException}, {@link ProviderException}
 * und {@link AutomationTimeoutException}.
 */
@Slf4j
@Component
public class RemoteSessionManager {

    static final String API_KEY = "BROWSERBASE_API_KEY";
    static final String PROJECT_ID = "BROWSERBASE_PROJECT_ID";

    private final SecretResolver secretResolver;
    private final RemoteSessionProvider provider;
    private final String apiKeyRef;
    private final String projectIdRef;

    public RemoteSessionManager(SecretResolver secretResolver,
                                RemoteSessionProvider provider,
                                @Value("${scraper.browserbase.api-key-ref:BROWSERBASE_API_KEY}") String apiKeyRef,
                                @Value("${scraper.browserbase.project-id-ref:BROWSERBASE_PROJECT_ID}") String projectIdRef) {
        this.secretResolver = secretResolver;
        this.provider = provider;
        this.apiKeyRef = apiKeyRef;
        this.projectIdRef = projectIdRef;
    }

    /**
     * Erzeugt eine neue Remote-Session. Es gibt keine automatischen Wiederholungen.
     *
     * @return Handle mit Session-ID und Connect-Endpunkt
     * @throws ConfigurationException      wenn Zugangsdaten fehlen
     * @throws ProviderException           wenn der Anbieter ablehnt oder unvollständig antwortet
     * @throws AutomationTimeoutException  wenn der Anbieter nicht rechtzeitig antwortet
     */
    public SessionHandle acquire() {
        ProviderCredentials credentials = resolveCredentials();
        log.info("Requesting remote browser session for project {}", credentials.getProjectId());

        ProviderSession session;
        try {
            session = provider.create(credentials);
        } catch (ProviderException | AutomationTimeoutException | ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderException("session creation failed: " + e.getMessage(), e);
        }

        if (session == null || isBlank(session.getId()) || isBlank(session.getConnectUrl())) {
            throw new ProviderException("provider returned an incomplete session: " + session);
        }
        log.info("Remote browser session {} created", session.getId());
        return new SessionHandle(session.getId(), session.getConnectUrl(), credentials);
    }

    /**
     * Gibt die Session frei. Sicher für {@code null}, bereits freigegebene oder defekte Handles;
     * wirft nie eine Exception.
     */
    public void release(SessionHandle handle) {
        if (handle == null) {
            return;
        }
        if (!handle.markReleased()) {
            log.debug("Session {} already released", handle.getSessionId());
            return;
        }
        try {
            provider.release(handle.getCredentials(), handle.getSessionId());
            log.info("Remote browser session {} released", handle.getSessionId());
        } catch (RuntimeException e) {
            log.warn("Failed to release remote browser session {}: {}", handle.getSessionId(), e.toString());
        }
    }

    private ProviderCredentials resolveCredentials() {
        String apiKey = secretResolver.resolve(apiKeyRef, API_KEY)
                .orElseThrow(() -> new ConfigurationException("remote browser API key could not be resolved (" + apiKeyRef + ")"));
        String projectId = secretResolver.resolve(projectIdRef, PROJECT_ID)
                .orElseThrow(() -> new ConfigurationException("remote browser project id could not be resolved (" + projectIdRef + ")"));
        return new ProviderCredentials(apiKey, projectId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
