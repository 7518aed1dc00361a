package com.astralcore.audit;

/**
 * Result of an audited operation.
 */
public enum AuditOutcome {
    SUCCESS,
    FAILURE,
    ERROR
}
