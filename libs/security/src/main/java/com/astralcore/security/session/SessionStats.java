package com.astralcore.security.session;

import java.util.Map;

/**
 * Point-in-time summary of live sessions.
 */
public record SessionStats(long totalActive, Map<String, Long> byRole, double averageAgeSeconds) {

    public SessionStats {
        byRole = Map.copyOf(byRole);
    }
}
