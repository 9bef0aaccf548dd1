package de.jwiegmann.scraper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ScraperConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
