package de.jwiegmann.scraper.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    @Value("${scraper.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${scraper.executor.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${scraper.executor.queue-capacity:100}")
    private int queueCapacity;

    /**
     * Pool für Scrape-Jobs. Volle Queue führt zu {@code TaskRejectedException}
     * (AbortPolicy), die der Submission-Gate in eine 503 übersetzt.
     */
    @Bean(name = "scrapeJobTaskExecutor")
    public ThreadPoolTaskExecutor scrapeJobTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("scrape-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(180); // Connect + Navigation + Schreibzugriffe
        executor.initialize();
        return executor;
    }
}
