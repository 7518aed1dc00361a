package com.astralcore.security.mfa;

import java.util.Optional;

/**
 * Durable storage for MFA enrollments, one per user.
 */
public interface MfaEnrollmentStore {

    Optional<MfaEnrollment> find(String userId);

    void save(MfaEnrollment enrollment);

    /**
     * @return whether an enrollment existed
     */
    boolean delete(String userId);
}
