package com.paxkun.binder.controller;

import com.paxkun.binder.service.LoggerService;
import com.paxkun.binder.service.MergeService;
import com.paxkun.binder.service.job.ExtractionRequest;
import com.paxkun.binder.service.job.InspectionRequest;
import com.paxkun.binder.service.job.MergeJob;
import com.paxkun.binder.service.job.MergeRequest;
import com.paxkun.binder.service.merge.SourceInspection;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * MergeController exposes queueing, status and validation endpoints for merge jobs.
 */
@RestController
@RequestMapping("/v1/merge")
@RequiredArgsConstructor
public class MergeController {

    private final MergeService mergeService;
    private final LoggerService logger;

    /**
     * Health check endpoint for Binder's merge module.
     *
     * @return Status message
     */
    @GetMapping("/health")
    public ResponseEntity<String> healthCheck() {
        return ResponseEntity.ok("Binder Merge API is up and running!");
    }

    /**
     * Queues a merge of the given sources into one CBZ.
     *
     * @param request sources in chapter order plus optional output and format overrides
     * @return the queued job with status 202, or 409 when another job is active
     */
    @PostMapping
    public ResponseEntity<MergeJob> queueMerge(@RequestBody MergeRequest request) {
        int sourceCount = request.getSources() != null ? request.getSources().size() : 0;
        logger.debug("MERGE_CONTROLLER", "Merge request received | sources=" + sourceCount);
        MergeJob job = mergeService.queueMerge(request);
        logger.debug("MERGE_CONTROLLER", "Merge queued | jobId=" + job.getJobId() + " | label=" + sanitizeForLog(job.getLabel()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    /**
     * Queues extraction of a single archive into renamed page files.
     */
    @PostMapping("/extract")
    public ResponseEntity<MergeJob> queueExtraction(@RequestBody ExtractionRequest request) {
        logger.debug("MERGE_CONTROLLER", "Extraction request received | source=" + sanitizeForLog(request.getSource()));
        MergeJob job = mergeService.queueExtraction(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    /**
     * Retrieves the active job and recently finished jobs.
     */
    @GetMapping("/status")
    public ResponseEntity<List<MergeJob>> getStatus() {
        List<MergeJob> statuses = mergeService.getStatuses();
        logger.debug("MERGE_CONTROLLER", "Returning " + statuses.size() + " job entries");
        return ResponseEntity.ok(statuses);
    }

    @GetMapping("/status/{jobId}")
    public ResponseEntity<MergeJob> getJob(@PathVariable String jobId) {
        return mergeService.getStatus(jobId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Clears a finished job from the history.
     *
     * @param jobId Job whose entry should be removed.
     * @return Empty response with 204 status.
     */
    @DeleteMapping("/status/{jobId}")
    public ResponseEntity<Void> clearStatus(@PathVariable String jobId) {
        logger.debug("MERGE_CONTROLLER", "Clearing status for jobId=" + sanitizeForLog(jobId));
        mergeService.clearStatus(jobId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Requests cancellation of the active job.
     */
    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = mergeService.cancel();
        logger.debug("MERGE_CONTROLLER", "Cancel request | activeJob=" + cancelled);
        return ResponseEntity.ok(Map.of(
                "cancelled", cancelled,
                "message", cancelled ? "Cancellation requested" : "No active job to cancel"));
    }

    /**
     * Checks sources without merging them.
     */
    @PostMapping("/validate")
    public ResponseEntity<List<SourceInspection>> validate(@RequestBody InspectionRequest request) {
        List<SourceInspection> inspections = mergeService.inspectSources(request);
        logger.debug("MERGE_CONTROLLER", "Validated " + inspections.size() + " sources");
        return ResponseEntity.ok(inspections);
    }

    @GetMapping("/formats")
    public ResponseEntity<List<String>> formats() {
        return ResponseEntity.ok(mergeService.supportedFormats());
    }

    private String sanitizeForLog(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("[\\r\\n]", "").replaceAll("[^\\p{Alnum}\\s_./-]", "").trim();
    }
}
