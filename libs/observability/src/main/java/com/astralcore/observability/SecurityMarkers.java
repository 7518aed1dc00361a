package com.astralcore.observability;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * SLF4J markers for log lines that security monitoring should pick up
 * (session hijack suspicion, MFA lockouts, IP blocks, integrity failures).
 */
public final class SecurityMarkers {

    public static final Marker SECURITY = MarkerFactory.getMarker("SECURITY");

    private SecurityMarkers() {
        // Utility class
    }
}
