package de.jwiegmann.scraper.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class BrowserbaseClientConfig {

    @Bean(name = "browserbaseRestClient")
    public RestClient browserbaseRestClient(
            @Value("${scraper.browserbase.base-url:https://api.browserbase.com}") String baseUrl,
            @Value("${scraper.browserbase.timeout:PT30S}") Duration timeout) {

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
