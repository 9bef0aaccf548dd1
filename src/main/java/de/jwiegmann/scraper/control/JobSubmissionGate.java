package de.jwiegmann.scraper.control;

import de.jwiegmann.scraper.boundary.dto.ScrapeJobRequest;
import de.jwiegmann.scraper.control.dto.SubmissionValidationResult;
import de.jwiegmann.scraper.control.exception.JobConflictException;
import de.jwiegmann.scraper.control.exception.JobRejectedException;
import de.jwiegmann.scraper.control.exception.JobValidationException;
import de.jwiegmann.scraper.control.executor.ScrapeJobExecutor;
import de.jwiegmann.scraper.control.repository.JobStatusStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Nimmt neue Scrape-Jobs an, validiert sie und übergibt sie asynchron an den {@link ScrapeJobExecutor}.
 * Der Aufrufer wartet nicht auf den Job; der erste Record entsteht erst im Executor.
 */
@Slf4j
@Service
public class JobSubmissionGate {

    static final int MAX_JOB_ID_LENGTH = 128;
    // entspricht job_status.requested_url
    static final int MAX_URL_LENGTH = 4096;
    private static final Pattern JOB_ID_PATTERN = Pattern.compile("[A-Za-z0-9._:-]+");

    private final JobStatusStore store;
    private final ScrapeJobExecutor executor;
    private final TaskExecutor taskExecutor;

    // jobIds, deren Executor-Lauf angenommen, aber noch nicht beendet ist
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public JobSubmissionGate(JobStatusStore store,
                             ScrapeJobExecutor executor,
                             @Qualifier("scrapeJobTaskExecutor") TaskExecutor taskExecutor) {
        this.store = store;
        this.executor = executor;
        this.taskExecutor = taskExecutor;
    }

    /**
     * Validiert den Request und übergibt den Job an den Executor-Pool.
     *
     * @param req Request mit jobId und URL
     * @return die angenommene jobId
     * @throws JobValidationException bei ungültiger jobId oder URL, auch bei zu langer URL (vor jedem Schreibzugriff)
     * @throws JobConflictException   wenn die jobId bereits angenommen wurde
     * @throws JobRejectedException   wenn der Executor-Pool ausgelastet ist
     */
    public String submit(ScrapeJobRequest req) {

        // 1. Request prüfen
        SubmissionValidationResult validation = validate(req);
        if (!validation.isValid()) {
            log.warn("Rejected submission: {}", validation.getErrorMessage());
            throw new JobValidationException(validation.getErrorCode(), validation.getField(), validation.getErrorMessage());
        }
        String jobId = req.getJobId();
        String url = req.getUrl().trim();

        // 2. jobId beanspruchen, damit pro jobId genau ein Executor läuft
        if (!inFlight.add(jobId)) {
            throw new JobConflictException(jobId);
        }
        boolean exists;
        try {
            exists = store.find(jobId).isPresent();
        } catch (RuntimeException e) {
            inFlight.remove(jobId);
            throw e;
        }
        if (exists) {
            inFlight.remove(jobId);
            throw new JobConflictException(jobId);
        }

        // 3. Übergabe an den Pool, ohne auf das Ergebnis zu warten
        try {
            taskExecutor.execute(() -> {
                try {
                    executor.execute(jobId, url);
                } finally {
                    inFlight.remove(jobId);
                }
            });
        } catch (TaskRejectedException e) {
            inFlight.remove(jobId);
            log.warn("Job {} rejected by executor pool", jobId);
            throw new JobRejectedException(jobId, e);
        }

        log.info("Accepted scrape job {} for {}", jobId, url);
        return jobId;
    }

    SubmissionValidationResult validate(ScrapeJobRequest req) {
        if (req == null) {
            return SubmissionValidationResult.invalid("MISSING_BODY", "body", "missing request body");
        }

        String jobId = req.getJobId();
        if (jobId == null || jobId.isBlank()) {
            return SubmissionValidationResult.invalid("INVALID_JOB_ID", "jobId", "jobId is required");
        }
        if (jobId.length() > MAX_JOB_ID_LENGTH || !JOB_ID_PATTERN.matcher(jobId).matches()) {
            return SubmissionValidationResult.invalid("INVALID_JOB_ID", "jobId",
                    "jobId must match " + JOB_ID_PATTERN.pattern() + " (max " + MAX_JOB_ID_LENGTH + ")");
        }

        String url = req.getUrl();
        if (url == null || url.isBlank()) {
            return SubmissionValidationResult.invalid("INVALID_URL", "url", "url is required");
        }
        if (url.trim().length() > MAX_URL_LENGTH) {
            return SubmissionValidationResult.invalid("INVALID_URL", "url", "url must not exceed " + MAX_URL_LENGTH + " characters");
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                return SubmissionValidationResult.invalid("INVALID_URL", "url", "url must be an absolute http(s) URI");
            }
        } catch (URISyntaxException e) {
            return SubmissionValidationResult.invalid("INVALID_URL", "url", "url is not a valid URI: " + e.getReason());
        }

        return SubmissionValidationResult.valid();
    }
}
