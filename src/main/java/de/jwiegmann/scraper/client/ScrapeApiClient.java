package de.jwiegmann.scraper.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.scraper.boundary.dto.ScrapeJobRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Client für die Scrape-API: Job einreichen und bis zum Ende pollen.
 */
@Slf4j
public class ScrapeApiClient {

    static final String API_KEY_HEADER = "x-api-key";

    private final RestClient restClient;
    private final JobPollingClient pollingClient;

    public ScrapeApiClient(RestClient restClient, JobPollingClient pollingClient) {
        this.restClient = restClient;
        this.pollingClient = pollingClient;
    }

    /**
     * Baut einen Client gegen {@code endpoint} (Job-Collection-URL).
     *
     * @param apiKey optional, wird als {@code x-api-key} mitgesendet
     */
    public static ScrapeApiClient create(String endpoint, String apiKey, PollingPolicy policy, Duration requestTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) requestTimeout.toMillis());
        requestFactory.setReadTimeout((int) requestTimeout.toMillis());

        ObjectMapper mapper = new ObjectMapper()
                .findAndRegisterModules()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.USE_LONG_FOR_INTS);

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(endpoint)
                .requestFactory(requestFactory)
                .messageConverters(converters -> converters.add(0, new MappingJackson2HttpMessageConverter(mapper)));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(API_KEY_HEADER, apiKey);
        }
        RestClient restClient = builder.build();
        return new ScrapeApiClient(restClient, new JobPollingClient(new HttpJobStatusSource(restClient), policy));
    }

    /**
     * @return {@code true} nur wenn der Server den Job mit 202 angenommen hat
     */
    public boolean submit(String jobId, String url) {
        log.info("Submitting job {} for URL: {}", jobId, url);
        try {
            ResponseEntity<Void> response = restClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new ScrapeJobRequest(jobId, url))
                    .retrieve()
                    .toBodilessEntity();
            if (response.getStatusCode().isSameCodeAs(HttpStatus.ACCEPTED)) {
                log.info("Job {} accepted", jobId);
                return true;
            }
            log.warn("Unexpected success status code for job {}: {}", jobId, response.getStatusCode());
            return false;
        } catch (RestClientResponseException e) {
            log.warn("Job {} rejected with HTTP {}: {}", jobId, e.getStatusCode().value(), e.getResponseBodyAsString());
            return false;
        } catch (RestClientException e) {
            log.warn("Error submitting job {}: {}", jobId, e.getMessage());
            return false;
        }
    }

    public PollingResult await(String jobId) {
        return pollingClient.poll(jobId);
    }

    /**
     * Reicht einen Job mit neu erzeugter jobId ein und pollt bis zum Ende oder Budget.
     *
     * @return leer, wenn der Job nicht angenommen wurde
     */
    public Optional<PollingResult> submitAndAwait(String url) {
        String jobId = UUID.randomUUID().toString();
        if (!submit(jobId, url)) {
            return Optional.empty();
        }
        return Optional.of(await(jobId));
    }
}
