package de.jwiegmann.scraper.control.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Liest Geheimnisse aus dem Spring-{@link Environment}. Der Wert darf ein einfacher String
 * oder ein JSON-Objekt sein, das den erwarteten Schlüssel enthält.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnvironmentSecretResolver implements SecretResolver {

    private final Environment environment;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<String> resolve(String reference, String expectedKey) {
        if (reference == null || reference.isBlank()) {
            log.error("Secret reference for key '{}' is not provided", expectedKey);
            return Optional.empty();
        }
        String raw = environment.getProperty(reference);
        if (raw == null || raw.isBlank()) {
            log.error("No secret value found for reference '{}'", reference);
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (!trimmed.startsWith("{")) {
            return Optional.of(trimmed);
        }
        try {
            JsonNode value = objectMapper.readTree(trimmed).get(expectedKey);
            if (value == null || value.isNull() || value.asText().isBlank()) {
                log.error("Key '{}' not found in secret JSON for reference '{}'", expectedKey, reference);
                return Optional.empty();
            }
            return Optional.of(value.asText());
        } catch (JsonProcessingException e) {
            log.error("Secret '{}' is not valid JSON: {}", reference, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
