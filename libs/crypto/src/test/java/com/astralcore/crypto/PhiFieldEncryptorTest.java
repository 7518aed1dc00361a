package com.astralcore.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.astralcore.common.error.IntegrityFailureException;
import com.astralcore.observability.SecurityMetrics;
import java.security.SecureRandom;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PhiFieldEncryptor")
class PhiFieldEncryptorTest {

    private final EncryptionService encryption = new EncryptionService(
            KeyMaterial.fromHex(EncryptionServiceTest.MASTER_KEY_HEX), 1_000,
            new SecureRandom(), SecurityMetrics.standalone());
    private final PhiFieldEncryptor encryptor = new PhiFieldEncryptor(encryption);

    @Test
    @DisplayName("only listed, present fields are encrypted")
    void encryptsListedFields() {
        Map<String, String> record = new HashMap<>();
        record.put("id", "p-1");
        record.put("firstName", "Jane");
        record.put("lastName", null);

        Map<String, String> encrypted =
                encryptor.encryptFields(record, List.of("firstName", "lastName", "address"));

        assertThat(encrypted.get("id")).isEqualTo("p-1");
        assertThat(encrypted.get("firstName")).isNotEqualTo("Jane");
        assertThat(encrypted).containsEntry("lastName", null).doesNotContainKey("address");
        assertThat(encryptor.decryptFields(encrypted, List.of("firstName", "lastName")))
                .containsEntry("firstName", "Jane");
    }

    @Test
    @DisplayName("strict decryption propagates integrity failures")
    void strictDecryptionFails() {
        Map<String, String> record = Map.of("firstName", "tampered");

        assertThatThrownBy(() -> encryptor.decryptFields(record, List.of("firstName")))
                .isInstanceOf(IntegrityFailureException.class);
    }

    @Test
    @DisplayName("lenient decryption reports failed fields and keeps going")
    void lenientDecryptionReports() {
        Map<String, String> record = new HashMap<>(
                encryptor.encryptFields(Map.of("firstName", "Jane", "lastName", "Doe"),
                        List.of("firstName", "lastName")));
        record.put("lastName", "corrupted");

        var result = encryptor.decryptFieldsLenient(record, List.of("firstName", "lastName"));

        assertThat(result.values()).containsEntry("firstName", "Jane")
                .containsEntry("lastName", "corrupted");
        assertThat(result.failedFields()).containsExactly("lastName");
        assertThat(result.complete()).isFalse();
    }
}
