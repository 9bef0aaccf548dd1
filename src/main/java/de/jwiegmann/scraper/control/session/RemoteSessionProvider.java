package de.jwiegmann.scraper.control.session;

/**
 * Schnittstelle zum externen Remote-Browser-Anbieter.
 */
public interface RemoteSessionProvider {

    /**
     * Erzeugt eine neue Session im angegebenen Projekt.
     *
     * @throws de.jwiegmann.scraper.control.exception.ProviderException          bei Ablehnung oder Netzwerkfehlern
     * @throws de.jwiegmann.scraper.control.exception.AutomationTimeoutException wenn der Anbieter nicht rechtzeitig antwortet
     */
    ProviderSession create(ProviderCredentials credentials);

    /**
     * Gibt die Session beim Anbieter frei.
     */
    void release(ProviderCredentials credentials, String sessionId);
}
