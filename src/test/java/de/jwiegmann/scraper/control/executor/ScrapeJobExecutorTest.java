package de.jwiegmann.scraper.control.executor;

import de.jwiegmann.scraper.control.automation.AutomationConnection;
import de.jwiegmann.scraper.control.automation.AutomationDriver;
import de.jwiegmann.scraper.control.exception.AutomationTimeoutException;
import de.jwiegmann.scraper.control.exception.ProviderException;
import de.jwiegmann.scraper.control.session.ProviderSession;
import de.jwiegmann.scraper.control.session.RemoteSessionManager;
import de.jwiegmann.scraper.control.session.RemoteSessionProvider;
import de.jwiegmann.scraper.entity.JobRecord;
import de.jwiegmann.scraper.entity.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScrapeJobExecutorTest {

    private static final String URL = "https://example.com/";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(60);
    private static final Duration NAVIGATION_TIMEOUT = Duration.ofSeconds(60);

    @Mock
    private RemoteSessionProvider provider;

    @Mock
    private AutomationDriver driver;

    @Mock
    private AutomationConnection connection;

    private final Map<String, String> secrets = new HashMap<>();
    private RecordingJobStatusStore store;
    private ScrapeJobExecutor executor;

    @BeforeEach
    void setUp() {
        secrets.put("BROWSERBASE_API_KEY", "test-key");
        secrets.put("BROWSERBASE_PROJECT_ID", "test-project");
        RemoteSessionManager sessionManager = new RemoteSessionManager(
                (reference, key) -> Optional.ofNullable(secrets.get(reference)),
                provider, "BROWSERBASE_API_KEY", "BROWSERBASE_PROJECT_ID");
        store = new RecordingJobStatusStore();
        executor = new ScrapeJobExecutor(store, sessionManager, driver, Clock.systemUTC(), CONNECT_TIMEOUT, NAVIGATION_TIMEOUT);
    }

    private void sessionAndConnectionSucceed() {
        when(provider.create(any())).thenReturn(new ProviderSession("session-1", "wss://connect.test/1"));
        when(driver.connect("wss://connect.test/1", CONNECT_TIMEOUT)).thenReturn(connection);
    }

    private JobRecord stored(String jobId) {
        return store.find(jobId).orElseThrow();
    }

    @Test
    void successfulRun_writesPendingRunningSuccess_andCleansUpOnce() {
        sessionAndConnectionSucceed();
        when(connection.title()).thenReturn("Example Domain");
        when(connection.contentLength()).thenReturn(1256L);

        JobStatus status = executor.execute("job-1", URL);

        assertThat(status).isEqualTo(JobStatus.SUCCESS);
        assertThat(store.writtenStatuses()).containsExactly(JobStatus.PENDING, JobStatus.RUNNING, JobStatus.SUCCESS);
        assertThat(store.writes.get(0).getSessionId()).isNull();
        assertThat(store.writes.get(1).getSessionId()).isEqualTo("session-1");

        JobRecord record = stored("job-1");
        assertThat(record.getRequestedUrl()).isEqualTo(URL);
        assertThat(record.getSessionId()).isEqualTo("session-1");
        assertThat(record.getResultPayload())
                .containsEntry(JobRecord.PAGE_TITLE, "Example Domain")
                .containsEntry(JobRecord.CONTENT_LENGTH, 1256L);
        assertThat(record.getErrorMessage()).isNull();
        assertThat(record.getReceivedAt()).isEqualTo(store.writes.get(0).getReceivedAt());
        assertThat(record.getLastUpdatedAt()).isAfterOrEqualTo(record.getReceivedAt());

        verify(connection).navigate(URL, NAVIGATION_TIMEOUT);
        verify(connection, times(1)).close();
        verify(provider, times(1)).release(any(), eq("session-1"));
    }

    @Test
    void missingCredentials_failWithConfigurationError_withoutSession() {
        secrets.remove("BROWSERBASE_API_KEY");

        JobStatus status = executor.execute("job-2", URL);

        assertThat(status).isEqualTo(JobStatus.FAILED);
        assertThat(store.writtenStatuses()).containsExactly(JobStatus.PENDING, JobStatus.FAILED);
        JobRecord record = stored("job-2");
        assertThat(record.getSessionId()).isNull();
        assertThat(record.getResultPayload()).isNull();
        assertThat(record.getErrorMessage()).startsWith("Configuration error");
        verifyNoInteractions(provider, driver);
    }

    @Test
    void providerRejection_failsWithProviderError_andReleasesNothing() {
        when(provider.create(any())).thenThrow(new ProviderException("HTTP 401 invalid api key"));

        executor.execute("job-3", URL);

        JobRecord record = stored("job-3");
        assertThat(record.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(record.getSessionId()).isNull();
        assertThat(record.getErrorMessage()).isEqualTo("Provider error: HTTP 401 invalid api key");
        verify(provider, never()).release(any(), any());
        verifyNoInteractions(driver);
    }

    @Test
    void connectTimeout_failsWithTimeout_andReleasesSession() {
        when(provider.create(any())).thenReturn(new ProviderSession("session-4", "wss://connect.test/4"));
        when(driver.connect(anyString(), any()))
                .thenThrow(new AutomationTimeoutException("CDP connect", CONNECT_TIMEOUT, null));

        executor.execute("job-4", URL);

        JobRecord record = stored("job-4");
        assertThat(store.writtenStatuses()).containsExactly(JobStatus.PENDING, JobStatus.RUNNING, JobStatus.FAILED);
        assertThat(record.getSessionId()).isEqualTo("session-4");
        assertThat(record.getErrorMessage()).startsWith("Timeout").contains("60000 ms");
        verify(provider, times(1)).release(any(), eq("session-4"));
    }

    @Test
    void navigationTimeout_keepsSessionId_andMentionsTimeout() {
        sessionAndConnectionSucceed();
        doThrow(new AutomationTimeoutException("Navigation to " + URL, NAVIGATION_TIMEOUT, null))
                .when(connection).navigate(URL, NAVIGATION_TIMEOUT);

        JobStatus status = executor.execute("job-5", URL);

        assertThat(status).isEqualTo(JobStatus.FAILED);
        JobRecord record = stored("job-5");
        assertThat(record.getSessionId()).isEqualTo("session-1");
        assertThat(record.getErrorMessage()).containsIgnoringCase("timeout");
        assertThat(record.getResultPayload()).isNull();
        verify(connection, times(1)).close();
        verify(provider, times(1)).release(any(), eq("session-1"));
    }

    @Test
    void crashDuringNavigation_failsUnexpected_andStillCleansUpOnce() {
        sessionAndConnectionSucceed();
        doThrow(new IllegalStateException("renderer crashed")).when(connection).navigate(anyString(), any());

        executor.execute("job-6", URL);

        JobRecord record = stored("job-6");
        assertThat(record.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(record.getErrorMessage()).isEqualTo("Unexpected error: renderer crashed");
        verify(connection, times(1)).close();
        verify(provider, times(1)).release(any(), eq("session-1"));
    }

    @Test
    void linkageErrorDuringNavigation_stillWritesTerminalRecord() {
        sessionAndConnectionSucceed();
        doThrow(new NoClassDefFoundError("com/microsoft/playwright/impl/Driver"))
                .when(connection).navigate(anyString(), any());

        JobStatus status = executor.execute("job-11", URL);

        assertThat(status).isEqualTo(JobStatus.FAILED);
        assertThat(store.writtenStatuses()).containsExactly(JobStatus.PENDING, JobStatus.RUNNING, JobStatus.FAILED);
        JobRecord record = stored("job-11");
        assertThat(record.getStatus().isTerminal()).isTrue();
        assertThat(record.getSessionId()).isEqualTo("session-1");
        assertThat(record.getErrorMessage()).startsWith("Unexpected error").contains("playwright");
        verify(connection, times(1)).close();
        verify(provider, times(1)).release(any(), eq("session-1"));
    }

    @Test
    void virtualMachineError_isRethrownOnlyAfterTerminalWriteAndCleanup() {
        sessionAndConnectionSucceed();
        when(connection.title()).thenThrow(new StackOverflowError());

        assertThatThrownBy(() -> executor.execute("job-12", URL)).isInstanceOf(StackOverflowError.class);

        JobRecord record = stored("job-12");
        assertThat(record.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(record.getErrorMessage()).isEqualTo("Unexpected error: StackOverflowError");
        verify(connection, times(1)).close();
        verify(provider, times(1)).release(any(), eq("session-1"));
    }

    @Test
    void failureDuringExtraction_leavesNoPartialPayload() {
        sessionAndConnectionSucceed();
        when(connection.title()).thenThrow(new ProviderException("Target page, context or browser has been closed"));

        executor.execute("job-7", URL);

        JobRecord record = stored("job-7");
        assertThat(record.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(record.getResultPayload()).isNull();
        assertThat(record.getErrorMessage()).startsWith("Provider error");
    }

    @Test
    void cleanupFailures_doNotOverrideCommittedStatus() {
        sessionAndConnectionSucceed();
        when(connection.title()).thenReturn("Title");
        when(connection.contentLength()).thenReturn(10L);
        doThrow(new IllegalStateException("already closed")).when(connection).close();
        doThrow(new ProviderException("release refused")).when(provider).release(any(), anyString());

        JobStatus status = executor.execute("job-8", URL);

        assertThat(status).isEqualTo(JobStatus.SUCCESS);
        assertThat(stored("job-8").getStatus()).isEqualTo(JobStatus.SUCCESS);
        assertThat(store.writtenStatuses()).containsExactly(JobStatus.PENDING, JobStatus.RUNNING, JobStatus.SUCCESS);
    }

    @Test
    void failedTerminalWrite_neverEscapes_andSessionIsReleased() {
        sessionAndConnectionSucceed();
        when(connection.title()).thenReturn("Title");
        when(connection.contentLength()).thenReturn(10L);
        store.failingStatuses.add(JobStatus.SUCCESS);

        executor.execute("job-9", URL);

        assertThat(store.writtenStatuses()).containsExactly(JobStatus.PENDING, JobStatus.RUNNING, JobStatus.SUCCESS);
        assertThat(stored("job-9").getStatus()).isEqualTo(JobStatus.RUNNING);
        verify(provider, times(1)).release(any(), eq("session-1"));
    }

    @Test
    void failedPendingWrite_isFollowedByCompleteRecords() {
        sessionAndConnectionSucceed();
        when(connection.title()).thenReturn("Title");
        when(connection.contentLength()).thenReturn(10L);
        store.failingStatuses.add(JobStatus.PENDING);

        JobStatus status = executor.execute("job-10", URL);

        assertThat(status).isEqualTo(JobStatus.SUCCESS);
        JobRecord record = stored("job-10");
        assertThat(record.getRequestedUrl()).isEqualTo(URL);
        assertThat(record.getReceivedAt()).isNotNull();
    }
}
