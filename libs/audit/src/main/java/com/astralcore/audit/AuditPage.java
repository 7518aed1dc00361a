package com.astralcore.audit;

import java.util.List;

/**
 * One page of audit events plus the total number of matches across all pages.
 */
public record AuditPage(List<AuditEvent> events, long total) {

    public AuditPage {
        events = List.copyOf(events);
    }
}
