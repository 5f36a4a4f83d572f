package com.flagship.contribution_ledger.archive;

import lombok.Value;

/**
 * A stored archive with its snapshot parsed back.
 */
@Value
public class LedgerArchive {
    ArchiveSummary summary;
    ArchiveSnapshot snapshot;
}
