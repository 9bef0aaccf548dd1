package de.jwiegmann.scraper.control.executor;

import de.jwiegmann.scraper.control.exception.ProviderException;
import de.jwiegmann.scraper.entity.JobRecord;
import de.jwiegmann.scraper.entity.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobRecordWriterTest {

    private final RecordingJobStatusStore store = new RecordingJobStatusStore();

    @Test
    void terminalStatus_cannotBeWrittenTwice() {
        JobRecordWriter writer = new JobRecordWriter(store, Clock.systemUTC(), "w-1");
        writer.pending("https://example.com/");
        writer.terminal(ExecutionOutcome.succeeded("Title", 5));

        assertThatThrownBy(() -> writer.terminal(ExecutionOutcome.failed(new ProviderException("late"))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> writer.running("session-late"))
                .isInstanceOf(IllegalStateException.class);

        assertThat(store.find("w-1").orElseThrow().getStatus()).isEqualTo(JobStatus.SUCCESS);
        assertThat(store.writtenStatuses()).containsExactly(JobStatus.PENDING, JobStatus.SUCCESS);
    }

    @Test
    void lastUpdatedAt_neverMovesBackwards() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:05Z"));
        JobRecordWriter writer = new JobRecordWriter(store, clock, "w-2");

        writer.pending("https://example.com/");
        clock.now = Instant.parse("2026-03-01T10:00:01Z"); // Uhr springt zurück
        writer.running("session-1");

        JobRecord record = store.find("w-2").orElseThrow();
        assertThat(record.getReceivedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:05Z"));
        assertThat(record.getLastUpdatedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:05Z"));
    }

    @Test
    void failedOutcome_carriesErrorButNoPayload() {
        JobRecordWriter writer = new JobRecordWriter(store, Clock.systemUTC(), "w-3");
        writer.pending("https://example.com/");
        writer.running("session-3");
        writer.terminal(ExecutionOutcome.failed(new ProviderException("gone")));

        JobRecord record = store.find("w-3").orElseThrow();
        assertThat(record.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(record.getSessionId()).isEqualTo("session-3");
        assertThat(record.getResultPayload()).isNull();
        assertThat(record.getErrorMessage()).isEqualTo("Provider error: gone");
    }

    @Test
    void overlongErrorMessages_areTruncated() {
        String detail = "x".repeat(ExecutionOutcome.MAX_ERROR_LENGTH * 2);
        ExecutionOutcome outcome = ExecutionOutcome.failed(new ProviderException(detail));

        assertThat(outcome.getErrorMessage()).hasSize(ExecutionOutcome.MAX_ERROR_LENGTH);
        assertThat(outcome.getFailureCategory()).isEqualTo(FailureCategory.PROVIDER);
    }

    static final class MutableClock extends Clock {

        Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
