package de.jwiegmann.scraper.control.session;

import java.util.Optional;

/**
 * Löst benannte Geheimnisse über eine Referenz auf (z. B. Secret-Store-Name oder Umgebungsvariable).
 */
public interface SecretResolver {

    Optional<String> resolve(String reference, String expectedKey);
}
