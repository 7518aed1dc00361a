package com.astralcore.security.testing;

import com.astralcore.security.mfa.MfaEnrollment;
import com.astralcore.security.mfa.MfaEnrollmentStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link MfaEnrollmentStore} for tests and single-node development.
 */
public class InMemoryMfaEnrollmentStore implements MfaEnrollmentStore {

    private final Map<String, MfaEnrollment> enrollments = new ConcurrentHashMap<>();

    @Override
    public Optional<MfaEnrollment> find(String userId) {
        return Optional.ofNullable(enrollments.get(userId));
    }

    @Override
    public void save(MfaEnrollment enrollment) {
        enrollments.put(enrollment.userId(), enrollment);
    }

    @Override
    public boolean delete(String userId) {
        return enrollments.remove(userId) != null;
    }

    public int size() {
        return enrollments.size();
    }
}
