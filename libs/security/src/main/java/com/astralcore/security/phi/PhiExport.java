package com.astralcore.security.phi;

import java.util.List;

/**
 * Result of a best-effort batch export.
 *
 * @param records    records that decrypted cleanly
 * @param skippedIds ids of records left out because a PHI field failed verification
 */
public record PhiExport(List<PhiRecord> records, List<String> skippedIds) {

    public PhiExport {
        records = List.copyOf(records);
        skippedIds = List.copyOf(skippedIds);
    }

    public boolean complete() {
        return skippedIds.isEmpty();
    }
}
