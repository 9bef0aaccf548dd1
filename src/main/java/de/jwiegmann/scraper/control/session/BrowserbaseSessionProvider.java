package de.jwiegmann.scraper.control.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import de.jwiegmann.scraper.control.exception.AutomationTimeoutException;
import de.jwiegmann.scraper.control.exception.ProviderException;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * Browserbase-REST-Anbindung: {@code POST /v1/sessions} zum Erzeugen,
 * {@code POST /v1/sessions/{id}} mit {@code REQUEST_RELEASE} zum Freigeben.
 */
@Slf4j
@Component
public class BrowserbaseSessionProvider implements RemoteSessionProvider {

    private static final String API_KEY_HEADER = "X-BB-API-Key";

    private final RestClient restClient;
    private final Duration timeout;

    public BrowserbaseSessionProvider(@Qualifier("browserbaseRestClient") RestClient restClient,
                                      @Value("${scraper.browserbase.timeout:PT30S}") Duration timeout) {
        this.restClient = restClient;
        this.timeout = timeout;
    }

    @Override
    public ProviderSession create(ProviderCredentials credentials) {
        try {
            BrowserbaseSession created = restClient.post()
                    .uri("/v1/sessions")
                    .header(API_KEY_HEADER, credentials.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(Map.of("projectId", credentials.getProjectId()))
                    .retrieve()
                    .body(BrowserbaseSession.class);
            if (created == null) {
                throw new ProviderException("Browserbase returned an empty session response");
            }
            log.debug("Browserbase session {} (https://browserbase.com/sessions/{})", created.getId(), created.getId());
            return new ProviderSession(created.getId(), created.getConnectUrl());
        } catch (RestClientResponseException e) {
            throw new ProviderException("Browserbase rejected session creation (HTTP "
                    + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw translateAccessFailure("session creation", e);
        } catch (RestClientException e) {
            throw new ProviderException("Browserbase session creation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void release(ProviderCredentials credentials, String sessionId) {
        try {
            restClient.post()
                    .uri("/v1/sessions/{id}", sessionId)
                    .header(API_KEY_HEADER, credentials.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("projectId", credentials.getProjectId(), "status", "REQUEST_RELEASE"))
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientResponseException e) {
            throw new ProviderException("Browserbase rejected release of session " + sessionId
                    + " (HTTP " + e.getStatusCode().value() + ")", e);
        } catch (ResourceAccessException e) {
            throw translateAccessFailure("session release", e);
        } catch (RestClientException e) {
            throw new ProviderException("Browserbase session release failed: " + e.getMessage(), e);
        }
    }

    private RuntimeException translateAccessFailure(String operation, ResourceAccessException e) {
        if (e.getCause() instanceof SocketTimeoutException) {
            return new AutomationTimeoutException("Browserbase " + operation, timeout, e);
        }
        return new ProviderException("Browserbase " + operation + " failed: " + e.getMessage(), e);
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BrowserbaseSession {
        private String id;
        private String connectUrl;
    }
}
