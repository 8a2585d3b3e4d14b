package com.flagship.order_ledger.allocation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.allocation.AllocationService;
import com.flagship.order_ledger.payment.SubmissionReport;
import lombok.Value;

@Value
public class SubmissionResponse {

    @JsonProperty("allocation")
    AllocationResponse allocation;

    @JsonProperty("report")
    SubmissionReport report;

    public static SubmissionResponse from(AllocationService.Submission submission) {
        return new SubmissionResponse(AllocationResponse.from(submission.getAllocation()), submission.getReport());
    }
}
