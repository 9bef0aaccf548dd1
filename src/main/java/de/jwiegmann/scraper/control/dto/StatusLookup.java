package de.jwiegmann.scraper.control.dto;

import de.jwiegmann.scraper.entity.JobRecord;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Ergebnis einer Statusabfrage: Record gefunden, (noch) kein Record, oder Store-Fehler.
 * "Nicht gefunden" ist kein Fehler, sondern der erwartete Zustand kurz nach der Annahme.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StatusLookup {

    public static final String ERROR_CHECKING = "ERROR_CHECKING";

    public enum Kind {FOUND, NOT_FOUND, ERROR}

    private final Kind kind;
    private final String jobId;
    private final JobRecord record;
    private final String errorMessage;

    public static StatusLookup found(JobRecord record) {
        return new StatusLookup(Kind.FOUND, record.getJobId(), record, null);
    }

    public static StatusLookup notFound(String jobId) {
        return new StatusLookup(Kind.NOT_FOUND, jobId, null, null);
    }

    public static StatusLookup error(String jobId, String errorMessage) {
        return new StatusLookup(Kind.ERROR, jobId, null, errorMessage);
    }

    /**
     * Einheitliche Sicht für Aufrufer: Status des Records, {@code ERROR_CHECKING} bei
     * Store-Fehlern, {@code null} wenn noch kein Record existiert.
     */
    public String status() {
        return switch (kind) {
            case FOUND -> record.getStatus().name();
            case ERROR -> ERROR_CHECKING;
            case NOT_FOUND -> null;
        };
    }
}
