package com.astralcore.security.phi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A stored record of some entity type, as a flat map of field name to value. Whether the
 * PHI fields hold plaintext or ciphertext depends on which side of
 * {@link PhiRecordService} the record is seen from.
 */
public record PhiRecord(String entityType, String id, Map<String, String> fields) {

    public PhiRecord {
        if (entityType == null || entityType.isBlank()) {
            throw new IllegalArgumentException("entityType must not be null or blank");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String field(String name) {
        return fields.get(name);
    }

    public PhiRecord withFields(Map<String, String> fields) {
        return new PhiRecord(entityType, id, fields);
    }

    @Override
    public String toString() {
        return "PhiRecord[entityType=" + entityType + ", id=" + id + ", fields=" + fields.keySet() + "]";
    }
}
