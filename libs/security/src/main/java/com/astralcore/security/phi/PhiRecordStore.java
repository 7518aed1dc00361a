package com.astralcore.security.phi;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence of PHI-bearing records. Implementations only ever see ciphertext in PHI fields.
 */
public interface PhiRecordStore {

    void create(PhiRecord record);

    Optional<PhiRecord> findById(String entityType, String id);

    /**
     * Records of {@code entityType} whose fields equal every entry of {@code criteria}.
     */
    List<PhiRecord> findMany(String entityType, Map<String, String> criteria);

    /**
     * @return whether a record with the same type and id existed and was replaced
     */
    boolean update(PhiRecord record);

    boolean delete(String entityType, String id);
}
