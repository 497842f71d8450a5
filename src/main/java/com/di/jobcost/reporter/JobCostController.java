package com.di.jobcost.reporter;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for job cost reporting. The caller classifies the job; this service never inspects
 * the host environment.
 */
@RestController
@RequestMapping("/api/job-costs")
@RequiredArgsConstructor
public class JobCostController {

    static final String API_KEY_HEADER = "X-Metrics-Api-Key";

    private final CostReporter costReporter;

    /**
     * Computes the job cost and emits cost and duration metrics.
     * The optional {@value #API_KEY_HEADER} header overrides the configured metrics credential.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CostResult> report(@Valid @RequestBody JobCostRequest request,
                                             @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        CostResult result = costReporter.reportJobCost(request.getCustomerId(), request.toUsageRecord(),
                request.getDurationSeconds(), request.isSuccess(), apiKey);
        return ResponseEntity.ok(result);
    }

    /** Computes the job cost only; nothing is emitted. */
    @PostMapping(value = "/estimate", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CostResult> estimate(@Valid @RequestBody JobCostRequest request) {
        return ResponseEntity.ok(costReporter.estimateJobCost(request.toUsageRecord(), request.getDurationSeconds()));
    }
}
