package com.astralcore.security.phi;

import com.astralcore.audit.AuditActions;
import com.astralcore.audit.AuditDetails;
import com.astralcore.audit.AuditEntry;
import com.astralcore.audit.AuditTrail;
import com.astralcore.common.error.IntegrityFailureException;
import com.astralcore.common.error.ResourceNotFoundException;
import com.astralcore.common.error.ValidationFailureException;
import com.astralcore.crypto.PhiFieldEncryptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Audited CRUD over PHI-bearing records.
 * <p>
 * PHI fields are encrypted before they reach the {@link PhiRecordStore} and decrypted on the
 * way out. Reads are strict: a field that fails verification aborts the read with
 * {@link IntegrityFailureException}. Only {@link #exportDecrypted} tolerates corrupt
 * records, skipping them. Every call leaves one audit event, whether it succeeds or not.
 */
public final class PhiRecordService {

    private static final Logger log = LoggerFactory.getLogger(PhiRecordService.class);

    private final PhiRecordStore store;
    private final PhiFieldEncryptor encryptor;
    private final PhiFieldPolicy policy;
    private final AuditTrail audit;

    public PhiRecordService(PhiRecordStore store, PhiFieldEncryptor encryptor, PhiFieldPolicy policy,
                            AuditTrail audit) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        if (encryptor == null) {
            throw new IllegalArgumentException("encryptor must not be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        if (audit == null) {
            throw new IllegalArgumentException("audit must not be null");
        }
        this.store = store;
        this.encryptor = encryptor;
        this.policy = policy;
        this.audit = audit;
    }

    /**
     * Stores a new record under a generated id.
     *
     * @return the stored record, in plaintext
     */
    public PhiRecord create(String entityType, Map<String, String> fields, String actorId) {
        String id = UUID.randomUUID().toString();
        return audited(AuditActions.PHI_CREATE, entityType, id, actorId,
                () -> {
                    PhiRecord plain = new PhiRecord(entityType, id, fields);
                    store.create(plain.withFields(encryptor.encryptFields(plain.fields(), phiFields(entityType))));
                    return plain;
                },
                created -> AuditDetails.attributes(Map.of("fieldCount", created.fields().size())));
    }

    /**
     * @throws ResourceNotFoundException if no such record exists
     * @throws IntegrityFailureException if a PHI field fails verification
     */
    public PhiRecord findById(String entityType, String id, String actorId) {
        return audited(AuditActions.PHI_READ, entityType, id, actorId,
                () -> decrypt(load(entityType, id)),
                found -> AuditDetails.none());
    }

    /**
     * Records matching {@code criteria}. Criteria may only name non-PHI fields, since
     * encrypted values never compare equal.
     *
     * @throws ValidationFailureException if a criterion names a PHI field
     */
    public List<PhiRecord> findMany(String entityType, Map<String, String> criteria, String actorId) {
        return audited(AuditActions.PHI_READ_MANY, entityType, null, actorId,
                () -> search(entityType, criteria).stream().map(this::decrypt).toList(),
                found -> AuditDetails.attributes(Map.of("count", found.size())));
    }

    /**
     * Applies {@code changes} to an existing record. A {@code null} value removes the field.
     *
     * @return the updated record, in plaintext
     */
    public PhiRecord update(String entityType, String id, Map<String, String> changes, String actorId) {
        return audited(AuditActions.PHI_UPDATE, entityType, id, actorId,
                () -> {
                    PhiRecord current = decrypt(load(entityType, id));
                    Map<String, String> merged = new LinkedHashMap<>(current.fields());
                    changes.forEach((field, value) -> {
                        if (value == null) {
                            merged.remove(field);
                        } else {
                            merged.put(field, value);
                        }
                    });
                    PhiRecord updated = current.withFields(merged);
                    if (!store.update(updated.withFields(encryptor.encryptFields(merged, phiFields(entityType))))) {
                        throw new ResourceNotFoundException(entityType, id);
                    }
                    return updated;
                },
                updated -> AuditDetails.attributes(Map.of("changedFields", List.copyOf(changes.keySet()))));
    }

    public void delete(String entityType, String id, String actorId) {
        audited(AuditActions.PHI_DELETE, entityType, id, actorId,
                () -> {
                    if (!store.delete(entityType, id)) {
                        throw new ResourceNotFoundException(entityType, id);
                    }
                    return Boolean.TRUE;
                },
                deleted -> AuditDetails.none());
    }

    /**
     * Decrypts every matching record it can. Records with a PHI field that fails
     * verification are logged and left out of the export.
     */
    public PhiExport exportDecrypted(String entityType, Map<String, String> criteria, String actorId) {
        return audited(AuditActions.PHI_EXPORT, entityType, null, actorId,
                () -> {
                    List<PhiRecord> exported = new ArrayList<>();
                    List<String> skipped = new ArrayList<>();
                    for (PhiRecord stored : search(entityType, criteria)) {
                        PhiFieldEncryptor.FieldDecryption result =
                                encryptor.decryptFieldsLenient(stored.fields(), phiFields(entityType));
                        if (result.complete()) {
                            exported.add(stored.withFields(result.values()));
                        } else {
                            log.error("Skipping {} {} in export: fields {} failed verification",
                                    entityType, stored.id(), result.failedFields());
                            skipped.add(stored.id());
                        }
                    }
                    return new PhiExport(exported, skipped);
                },
                export -> AuditDetails.attributes(Map.of(
                        "exported", export.records().size(),
                        "skipped", export.skippedIds().size())));
    }

    public PhiFieldPolicy policy() {
        return policy;
    }

    private List<PhiRecord> search(String entityType, Map<String, String> criteria) {
        Map<String, String> filter = criteria == null ? Map.of() : criteria;
        for (String field : filter.keySet()) {
            if (policy.isPhi(entityType, field)) {
                throw new ValidationFailureException(field, "Encrypted fields cannot be used as search criteria");
            }
        }
        return store.findMany(entityType, filter);
    }

    private PhiRecord load(String entityType, String id) {
        return store.findById(entityType, id)
                .orElseThrow(() -> new ResourceNotFoundException(entityType, id));
    }

    private PhiRecord decrypt(PhiRecord stored) {
        return stored.withFields(encryptor.decryptFields(stored.fields(), phiFields(stored.entityType())));
    }

    private Set<String> phiFields(String entityType) {
        return policy.fieldsFor(entityType);
    }

    private <T> T audited(String action, String entityType, String entityId, String actorId,
                          Supplier<T> operation, Function<T, AuditDetails> details) {
        if (entityType == null || entityType.isBlank()) {
            throw new IllegalArgumentException("entityType must not be null or blank");
        }
        AuditEntry entry = AuditEntry.of(action, entityType).entityId(entityId).actor(actorId);
        T result;
        try {
            result = operation.get();
        } catch (ResourceNotFoundException | ValidationFailureException e) {
            audit.recordFailure(entry, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("PHI {} on {} failed", action, entityType, e);
            audit.recordError(entry, e);
            throw e;
        }
        audit.recordSuccess(entry.details(details.apply(result)));
        return result;
    }
}
