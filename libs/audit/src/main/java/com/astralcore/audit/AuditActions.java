package com.astralcore.audit;

/**
 * Action names written to the audit trail. Compliance reports filter on these values, so
 * existing names must never change.
 */
public final class AuditActions {

    public static final String SESSION_CREATED = "SESSION_CREATED";
    public static final String SESSION_RENEWED = "SESSION_RENEWED";
    public static final String SESSION_DESTROYED = "SESSION_DESTROYED";
    public static final String SESSION_EXPIRED = "SESSION_EXPIRED";
    public static final String SESSION_EVICTED = "SESSION_EVICTED";
    public static final String SESSION_HIJACK_SUSPECTED = "SESSION_HIJACK_SUSPECTED";
    public static final String SESSIONS_REVOKED_FOR_USER = "SESSIONS_REVOKED_FOR_USER";
    public static final String DEVICE_TRUST_CHANGED = "DEVICE_TRUST_CHANGED";

    public static final String CSRF_REJECTED = "CSRF_REJECTED";

    public static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
    public static final String IP_BLOCKED = "IP_BLOCKED";

    public static final String MFA_SETUP_INITIATED = "MFA_SETUP_INITIATED";
    public static final String MFA_ENABLED = "MFA_ENABLED";
    public static final String MFA_DISABLED = "MFA_DISABLED";
    public static final String MFA_VERIFIED = "MFA_VERIFIED";
    public static final String MFA_VERIFICATION_FAILED = "MFA_VERIFICATION_FAILED";
    public static final String MFA_EXCESSIVE_ATTEMPTS = "MFA_EXCESSIVE_ATTEMPTS";
    public static final String MFA_CODE_SENT = "MFA_CODE_SENT";
    public static final String MFA_BACKUP_CODE_USED = "MFA_BACKUP_CODE_USED";
    public static final String MFA_BACKUP_CODES_REGENERATED = "MFA_BACKUP_CODES_REGENERATED";

    public static final String PHI_CREATE = "CREATE";
    public static final String PHI_READ = "READ";
    public static final String PHI_READ_MANY = "READ_MANY";
    public static final String PHI_UPDATE = "UPDATE";
    public static final String PHI_DELETE = "DELETE";
    public static final String PHI_EXPORT = "EXPORT";

    public static final String AUDIT_RETENTION_PURGE = "AUDIT_RETENTION_PURGE";

    private AuditActions() {
        // Utility class
    }
}
