package de.jwiegmann.scraper.control.executor;

import de.jwiegmann.scraper.control.automation.AutomationConnection;
import de.jwiegmann.scraper.control.automation.AutomationDriver;
import de.jwiegmann.scraper.control.repository.JobStatusStore;
import de.jwiegmann.scraper.control.session.RemoteSessionManager;
import de.jwiegmann.scraper.control.session.SessionHandle;
import de.jwiegmann.scraper.entity.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Führt einen Scrape-Job vollständig aus:
 * INIT -> SESSION_ACQUIRED -> NAVIGATED -> SUCCESS | FAILED.
 * <p>
 * Der terminale Record wird vor dem Aufräumen geschrieben. Session-Freigabe und
 * Verbindungsabbau laufen auf jedem Ausgang; deren Fehler werden nur geloggt.
 * Außer {@link VirtualMachineError} verlässt kein Fehler {@link #execute(String, String)}, und auch
 * dieser erst nach dem terminalen Write.
 */
@Slf4j
@Component
public class ScrapeJobExecutor {

    private final JobStatusStore store;
    private final RemoteSessionManager sessionManager;
    private final AutomationDriver automationDriver;
    private final Clock clock;
    private final Duration connectTimeout;
    private final Duration navigationTimeout;

    public ScrapeJobExecutor(JobStatusStore store,
                             RemoteSessionManager sessionManager,
                             AutomationDriver automationDriver,
                             Clock clock,
                             @Value("${scraper.automation.connect-timeout:PT60S}") Duration connectTimeout,
                             @Value("${scraper.automation.navigation-timeout:PT60S}") Duration navigationTimeout) {
        this.store = store;
        this.sessionManager = sessionManager;
        this.automationDriver = automationDriver;
        this.clock = clock;
        this.connectTimeout = connectTimeout;
        this.navigationTimeout = navigationTimeout;
    }

    /**
     * Führt den Job für {@code jobId} aus. Pro jobId darf es genau einen Aufruf geben.
     *
     * @return der terminale Status, der in den Store geschrieben wurde
     */
    public JobStatus execute(String jobId, String url) {
        log.info("Starting scrape job {} for {}", jobId, url);
        JobRecordWriter writer = new JobRecordWriter(store, clock, jobId);
        ExecutionOutcome outcome;
        VirtualMachineError fatal = null;

        try (JobResources resources = new JobResources(jobId)) {
            try {
                writer.pending(url);
                outcome = drive(url, writer, resources);
            } catch (RuntimeException | Error e) {
                log.error("Scrape job {} aborted in phase {}", jobId, resources.phase, e);
                outcome = ExecutionOutcome.failed(e);
                if (e instanceof VirtualMachineError) {
                    fatal = (VirtualMachineError) e;
                }
            }
            resources.phase = outcome.isSuccess() ? ExecutionPhase.SUCCESS : ExecutionPhase.FAILED;
            writeTerminal(jobId, writer, outcome);
        }

        // OOM und Co. erst nach terminalem Write und Aufräumen weiterreichen
        if (fatal != null) {
            throw fatal;
        }
        log.info("Scrape job {} finished with status {}", jobId, outcome.getStatus());
        return outcome.getStatus();
    }

    private ExecutionOutcome drive(String url, JobRecordWriter writer, JobResources resources) {
        try {
            resources.session = sessionManager.acquire();
        } catch (RuntimeException e) {
            return failed(resources, e);
        }
        resources.phase = ExecutionPhase.SESSION_ACQUIRED;
        writer.running(resources.session.getSessionId());

        try {
            resources.connection = automationDriver.connect(resources.session.getConnectUrl(), connectTimeout);
        } catch (RuntimeException e) {
            return failed(resources, e);
        }

        try {
            log.info("Job {}: navigating to {}", resources.jobId, url);
            resources.connection.navigate(url, navigationTimeout);
            resources.phase = ExecutionPhase.NAVIGATED;
            String title = resources.connection.title();
            long contentLength = resources.connection.contentLength();
            log.info("Job {}: page title '{}', content length {}", resources.jobId, title, contentLength);
            return ExecutionOutcome.succeeded(title, contentLength);
        } catch (RuntimeException e) {
            return failed(resources, e);
        }
    }

    private ExecutionOutcome failed(JobResources resources, RuntimeException e) {
        ExecutionOutcome outcome = ExecutionOutcome.failed(e);
        log.error("Job {} failed in phase {}: {}", resources.jobId, resources.phase, outcome.getErrorMessage(), e);
        return outcome;
    }

    private void writeTerminal(String jobId, JobRecordWriter writer, ExecutionOutcome outcome) {
        try {
            if (!writer.terminal(outcome)) {
                log.error("Terminal status {} for job {} could not be persisted", outcome.getStatus(), jobId);
            }
        } catch (RuntimeException e) {
            log.error("Terminal write for job {} failed", jobId, e);
        }
    }

    /**
     * Bündelt die während eines Laufs erworbenen Ressourcen; {@link #close()} gibt sie in
     * umgekehrter Reihenfolge frei und wirft nie.
     */
    private final class JobResources implements AutoCloseable {

        private final String jobId;
        private ExecutionPhase phase = ExecutionPhase.INIT;
        private SessionHandle session;
        private AutomationConnection connection;

        private JobResources(String jobId) {
            this.jobId = jobId;
        }

        @Override
        public void close() {
            if (connection != null) {
                try {
                    connection.close();
                } catch (RuntimeException e) {
                    log.warn("Job {}: closing automation connection failed: {}", jobId, e.toString());
                }
            }
            try {
                sessionManager.release(session);
            } catch (RuntimeException e) {
                log.warn("Job {}: releasing session failed: {}", jobId, e.toString());
            }
        }
    }
}
