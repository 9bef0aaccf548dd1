package de.jwiegmann.scraper.boundary.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sofortige Antwort (202 Accepted) auf eine Job-Annahme.
 * Der Job-Record kann zu diesem Zeitpunkt noch fehlen.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeJobAccepted {
    private String jobId;
    private String status;
    private String statusUrl;
}
