package github.sarthakdev143.hdr_merge.controller;

import github.sarthakdev143.hdr_merge.dto.MergeJobSubmissionResponse;
import github.sarthakdev143.hdr_merge.dto.MergeRequest;
import github.sarthakdev143.hdr_merge.model.MergeJobState;
import github.sarthakdev143.hdr_merge.model.MergePlan;
import github.sarthakdev143.hdr_merge.service.MergeProcessingService;
import github.sarthakdev143.hdr_merge.service.impl.MergeOptionsValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/merge")
public class MergeController {

    private static final Logger logger = LoggerFactory.getLogger(MergeController.class);

    private final MergeProcessingService mergeProcessingService;
    private final MergeOptionsValidator mergeOptionsValidator;

    public MergeController(MergeProcessingService mergeProcessingService, MergeOptionsValidator mergeOptionsValidator) {
        this.mergeProcessingService = mergeProcessingService;
        this.mergeOptionsValidator = mergeOptionsValidator;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> submitMerge(@RequestBody MergeRequest request) {
        try {
            MergePlan plan = mergeOptionsValidator.normalizeAndValidate(request);
            String jobId = mergeProcessingService.submitJob(plan);
            return ResponseEntity.accepted()
                    .body(new MergeJobSubmissionResponse(
                            jobId,
                            MergeJobState.QUEUED,
                            "Merge job accepted. Poll /api/merge/status/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Merge submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to submit merge job. Please try again.");
        }
    }

    @GetMapping("/status/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        return mergeProcessingService.getJobStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }
}
