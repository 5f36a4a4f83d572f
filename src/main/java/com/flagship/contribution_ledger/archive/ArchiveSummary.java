package com.flagship.contribution_ledger.archive;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ArchiveSummary {
    long id;
    long guildId;
    String name;
    String description;
    String notes;
    Instant createdAt;
    long createdBy;
}
