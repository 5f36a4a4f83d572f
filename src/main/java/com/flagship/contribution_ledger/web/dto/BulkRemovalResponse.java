package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contribution_ledger.ledger.BulkRemovalResult;
import lombok.Value;

import java.util.List;

@Value
public class BulkRemovalResponse {

    @JsonProperty("contributions_removed")
    int contributionsRemoved;

    @JsonProperty("quantity_changes_removed")
    int quantityChangesRemoved;

    @JsonProperty("failures")
    List<String> failures;

    public static BulkRemovalResponse from(BulkRemovalResult result) {
        return new BulkRemovalResponse(
            result.getContributionsRemoved(), result.getQuantityChangesRemoved(), result.getFailures());
    }
}
