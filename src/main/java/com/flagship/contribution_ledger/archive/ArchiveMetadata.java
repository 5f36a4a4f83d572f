package com.flagship.contribution_ledger.archive;

import lombok.Builder;
import lombok.Value;

/**
 * Caller-supplied labels stored alongside an archive snapshot.
 */
@Value
@Builder
public class ArchiveMetadata {
    String name;
    String description;
    String notes;
    long createdBy;
}
