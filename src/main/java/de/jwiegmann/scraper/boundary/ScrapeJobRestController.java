package de.jwiegmann.scraper.boundary;

import de.jwiegmann.scraper.boundary.dto.JobRecordResponse;
import de.jwiegmann.scraper.boundary.dto.ScrapeJobAccepted;
import de.jwiegmann.scraper.boundary.dto.ScrapeJobRequest;
import de.jwiegmann.scraper.control.JobStatusQueryService;
import de.jwiegmann.scraper.control.JobSubmissionGate;
import de.jwiegmann.scraper.control.ScrapeErrorFactory;
import de.jwiegmann.scraper.control.dto.StatusLookup;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

@RestController
@RequestMapping(ScrapeJobRestController.BASE_PATH)
public class ScrapeJobRestController {

    static final String BASE_PATH = "/scraper-api/v1/jobs";

    private final JobSubmissionGate submissionGate;
    private final JobStatusQueryService queryService;

    public ScrapeJobRestController(JobSubmissionGate submissionGate, JobStatusQueryService queryService) {
        this.submissionGate = submissionGate;
        this.queryService = queryService;
    }

    /**
     * POST /scraper-api/v1/jobs: Job annehmen, Ausführung läuft asynchron
     */
    @PostMapping
    public ResponseEntity<ScrapeJobAccepted> submit(@RequestBody ScrapeJobRequest req) {

        String jobId = submissionGate.submit(req);
        URI statusUri = URI.create(BASE_PATH + "/" + jobId);

        return ResponseEntity
                .accepted()
                .location(statusUri)
                .body(ScrapeJobAccepted.builder()
                        .jobId(jobId)
                        .status("ACCEPTED")
                        .statusUrl(statusUri.toString())
                        .build());
    }

    /**
     * GET /scraper-api/v1/jobs/{jobId}: aktueller Job-Record
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {

        StatusLookup lookup = queryService.get(jobId);

        return switch (lookup.getKind()) {
            case FOUND -> ResponseEntity.ok(JobRecordResponse.from(lookup.getRecord()));
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ScrapeErrorFactory.jobNotFound(jobId));
            case ERROR -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ScrapeErrorFactory.storeAccessFailed(jobId));
        };
    }
}
