package de.jwiegmann.scraper.control.session;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor
public class ProviderCredentials {

    @ToString.Exclude
    private final String apiKey;
    private final String projectId;
}
