package com.flagship.order_ledger.allocation;

import com.flagship.order_ledger.allocation.dto.AllocationResponse;
import com.flagship.order_ledger.allocation.dto.SubmissionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for splitting a payment across invoices.
 *
 * Submission is idempotent per invoice: resending the same request with the
 * same Idempotency-Key posts only the payments that are still missing.
 * 201 means every payment is stored; 207 means the report has failed or
 * skipped items.
 */
@RestController
@RequestMapping("/api/allocations")
@RequiredArgsConstructor
@Slf4j
public class AllocationController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final String TENANT_HEADER = "X-Tenant-ID";

    private final AllocationService allocationService;

    @PostMapping("/preview")
    public ResponseEntity<AllocationResponse> preview(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @Valid @RequestBody AllocationRequest request) {
        return ResponseEntity.ok(AllocationResponse.from(allocationService.preview(tenantId, request)));
    }

    @PostMapping
    public ResponseEntity<SubmissionResponse> submit(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody AllocationRequest request) {

        log.info("Received allocation request: idempotencyKey={}, {} {}, {} invoices",
            idempotencyKey, request.getEntityRole(), request.getEntityId(), request.getSelections().size());

        AllocationService.Submission submission = allocationService.submit(tenantId, request, idempotencyKey);
        HttpStatus status = submission.getReport().isComplete() ? HttpStatus.CREATED : HttpStatus.MULTI_STATUS;
        return ResponseEntity.status(status).body(SubmissionResponse.from(submission));
    }
}
