package com.astralcore.crypto;

import com.astralcore.common.error.IntegrityFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-level encryption over a record represented as a map of field name to value.
 * <p>
 * Only the listed fields are touched, and only when present and non-null. Two decryption
 * modes exist: {@link #decryptFields} fails on the first field that does not verify and is
 * used on every PHI read path; {@link #decryptFieldsLenient} is for batch exports, where
 * one corrupt field must not abort the whole batch.
 */
public final class PhiFieldEncryptor {

    private static final Logger log = LoggerFactory.getLogger(PhiFieldEncryptor.class);

    private final EncryptionService encryption;

    public PhiFieldEncryptor(EncryptionService encryption) {
        if (encryption == null) {
            throw new IllegalArgumentException("encryption must not be null");
        }
        this.encryption = encryption;
    }

    public Map<String, String> encryptFields(Map<String, String> record, Collection<String> fields) {
        Map<String, String> result = new LinkedHashMap<>(record);
        for (String field : fields) {
            String value = result.get(field);
            if (value != null) {
                result.put(field, encryption.encrypt(value));
            }
        }
        return result;
    }

    /**
     * @throws IntegrityFailureException if any listed field fails to decrypt
     */
    public Map<String, String> decryptFields(Map<String, String> record, Collection<String> fields) {
        Map<String, String> result = new LinkedHashMap<>(record);
        for (String field : fields) {
            String value = result.get(field);
            if (value != null) {
                result.put(field, encryption.decrypt(value));
            }
        }
        return result;
    }

    /**
     * Decrypts what it can. Fields that fail verification are left as ciphertext and named
     * in the returned report.
     */
    public FieldDecryption decryptFieldsLenient(Map<String, String> record, Collection<String> fields) {
        Map<String, String> result = new LinkedHashMap<>(record);
        List<String> failed = new ArrayList<>();
        for (String field : fields) {
            String value = result.get(field);
            if (value == null) {
                continue;
            }
            try {
                result.put(field, encryption.decrypt(value));
            } catch (IntegrityFailureException e) {
                log.error("Failed to decrypt field {}", field);
                failed.add(field);
            }
        }
        return new FieldDecryption(result, failed);
    }

    /**
     * Outcome of a lenient decryption pass.
     *
     * @param values       the record with every verifiable field decrypted
     * @param failedFields fields left encrypted because they failed verification
     */
    public record FieldDecryption(Map<String, String> values, List<String> failedFields) {

        public FieldDecryption {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
            failedFields = List.copyOf(failedFields);
        }

        public boolean complete() {
            return failedFields.isEmpty();
        }
    }
}
