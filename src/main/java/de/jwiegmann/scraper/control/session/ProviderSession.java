package de.jwiegmann.scraper.control.session;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Vom Anbieter erzeugte Remote-Browser-Session.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class ProviderSession {

    private final String id;

    @ToString.Exclude
    private final String connectUrl;
}
