package de.jwiegmann.scraper.client;

import de.jwiegmann.scraper.boundary.dto.JobRecordResponse;
import de.jwiegmann.scraper.control.dto.StatusLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;

/**
 * Statusabfrage über die HTTP-API ({@code GET {base}/{jobId}}).
 * 404 und Timeouts gelten als "noch nicht verfügbar", alle anderen Fehler als ERROR_CHECKING.
 */
@Slf4j
public class HttpJobStatusSource implements JobStatusSource {

    private final RestClient restClient;

    /**
     * @param restClient Client mit der Job-Collection als Basis-URL, z. B. {@code https://host/scraper-api/v1/jobs}
     */
    public HttpJobStatusSource(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public StatusLookup check(String jobId) {
        try {
            JobRecordResponse body = restClient.get()
                    .uri("/{jobId}", jobId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JobRecordResponse.class);
            if (body == null) {
                return StatusLookup.error(jobId, "empty status response");
            }
            return StatusLookup.found(body.toRecord());
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Job {} not found yet (404)", jobId);
            return StatusLookup.notFound(jobId);
        } catch (RestClientResponseException e) {
            log.warn("HTTP error getting status for job {}: {}", jobId, e.getStatusCode());
            return StatusLookup.error(jobId, "HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                log.info("Timeout waiting for status response for job {}", jobId);
                return StatusLookup.notFound(jobId);
            }
            log.warn("Network error getting status for job {}: {}", jobId, e.getMessage());
            return StatusLookup.error(jobId, e.getMessage());
        } catch (RestClientException e) {
            log.warn("Unreadable status response for job {}: {}", jobId, e.getMessage());
            return StatusLookup.error(jobId, "Invalid JSON response: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid status record for job {}: {}", jobId, e.getMessage());
            return StatusLookup.error(jobId, "Invalid JSON response: " + e.getMessage());
        }
    }
}
