package de.jwiegmann.scraper.control.repository;

import de.jwiegmann.scraper.entity.JobRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "scraper.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryJobStatusStore implements JobStatusStore {

    private final Map<String, JobRecord> store = new ConcurrentHashMap<>();

    @Override
    public Optional<JobRecord> find(String jobId) {
        JobRecord record = store.get(jobId);
        return record == null ? Optional.empty() : Optional.of(record.copy());
    }

    @Override
    public JobRecord upsert(JobRecord record) {
        store.put(record.getJobId(), record.copy());
        return record;
    }
}
