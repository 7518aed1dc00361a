package com.astralcore.security.mfa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.astralcore.audit.AuditActions;
import com.astralcore.audit.AuditOutcome;
import com.astralcore.audit.AuditTrail;
import com.astralcore.audit.testing.InMemoryAuditStore;
import com.astralcore.common.error.DeliveryFailureException;
import com.astralcore.common.error.IntegrityFailureException;
import com.astralcore.common.error.ResourceNotFoundException;
import com.astralcore.common.testing.Concurrently;
import com.astralcore.common.testing.MutableClock;
import com.astralcore.crypto.EncryptionService;
import com.astralcore.crypto.KeyMaterial;
import com.astralcore.crypto.PasswordHasher;
import com.astralcore.observability.PhiRedactor;
import com.astralcore.observability.SecurityMetrics;
import com.astralcore.security.testing.InMemoryMfaEnrollmentStore;
import com.astralcore.security.testing.RecordingNotificationGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MfaService")
class MfaServiceTest {

    private static final String MASTER_KEY_HEX =
            "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";
    private static final Pattern SIX_DIGITS = Pattern.compile("(\\d{6})");
    private static final String USER = "user-1";

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private InMemoryAuditStore auditStore;
    private InMemoryMfaEnrollmentStore enrollments;
    private RecordingNotificationGateway gateway;
    private TotpGenerator totp;
    private MfaService mfa;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochDay();
        registry = new SimpleMeterRegistry();
        auditStore = new InMemoryAuditStore();
        enrollments = new InMemoryMfaEnrollmentStore();
        gateway = new RecordingNotificationGateway();
        totp = new TotpGenerator(clock);
        SecurityMetrics metrics = new SecurityMetrics(registry, "test");
        EncryptionService encryption =
                new EncryptionService(KeyMaterial.fromHex(MASTER_KEY_HEX), 1_000, new SecureRandom(), metrics);
        AuditTrail audit = new AuditTrail(auditStore, Runnable::run, clock, metrics, new PhiRedactor(), false);
        mfa = new MfaService(enrollments, encryption, totp, new BackupCodes(new PasswordHasher(1_000)),
                gateway, audit, metrics, clock, MfaSettings.DEFAULT);
    }

    private TotpEnrollment enrollTotp() {
        TotpEnrollment setup = mfa.setupTotp(USER, "jane@example.com");
        String code = totp.codeAt(setup.secret(), clock.instant());
        assertThat(mfa.enable(MfaEnableRequest.totp(USER, setup.secret(), code, setup.backupCodes())))
                .isEqualTo(EnableOutcome.ENABLED);
        return setup;
    }

    private String lastCode(DeliveryChannel channel) {
        Matcher matcher = SIX_DIGITS.matcher(gateway.lastBody(channel));
        assertThat(matcher.find()).isTrue();
        return matcher.group(1);
    }

    @Nested
    @DisplayName("TOTP enrollment")
    class TotpSetup {

        @Test
        @DisplayName("setup should return secret, provisioning URI and backup codes without persisting")
        void setupShouldNotPersist() {
            TotpEnrollment setup = mfa.setupTotp(USER, "jane@example.com");

            assertThat(setup.secret()).matches("[A-Z2-7]{32}");
            assertThat(setup.qrPayload()).startsWith("otpauth://totp/Astral%20Core:").contains(setup.secret());
            assertThat(setup.backupCodes()).hasSize(10);
            assertThat(mfa.isEnabled(USER)).isFalse();
            assertThat(auditStore.eventsWithAction(AuditActions.MFA_SETUP_INITIATED)).hasSize(1);
        }

        @Test
        @DisplayName("enable should persist the secret encrypted and backup codes hashed")
        void enableShouldPersistProtected() {
            TotpEnrollment setup = enrollTotp();

            MfaEnrollment stored = enrollments.find(USER).orElseThrow();
            assertThat(stored.encryptedSecret()).isNotBlank().doesNotContain(setup.secret());
            assertThat(stored.hashedBackupCodes()).hasSize(10)
                    .noneMatch(hash -> setup.backupCodes().stream().anyMatch(hash::contains));
            assertThat(mfa.status(USER).method()).isEqualTo(MfaMethod.TOTP);
            assertThat(mfa.status(USER).backupCodesRemaining()).isEqualTo(10);
        }

        @Test
        @DisplayName("enable should refuse a wrong code")
        void enableShouldRefuseWrongCode() {
            TotpEnrollment setup = mfa.setupTotp(USER, null);

            EnableOutcome outcome = mfa.enable(MfaEnableRequest.totp(USER, setup.secret(), "abcdef", null));

            assertThat(outcome).isEqualTo(EnableOutcome.INVALID_CODE);
            assertThat(mfa.isEnabled(USER)).isFalse();
        }
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        @DisplayName("should accept the current TOTP code")
        void shouldAcceptTotp() {
            TotpEnrollment setup = enrollTotp();

            MfaVerificationResult result = mfa.verify(USER, totp.codeAt(setup.secret(), clock.instant()), false);

            assertThat(result.success()).isTrue();
            assertThat(auditStore.eventsWithAction(AuditActions.MFA_VERIFIED)).hasSize(1);
            assertThat(registry.find("astral.mfa.verifications").tag("outcome", "VERIFIED").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should report users without MFA")
        void shouldReportNotEnabled() {
            assertThat(mfa.verify("nobody", "123456", false).outcome()).isEqualTo(MfaOutcome.NOT_ENABLED);
        }

        @Test
        @DisplayName("should lock after three failures and refuse even a correct code while locked")
        void shouldLockOut() {
            TotpEnrollment setup = enrollTotp();

            MfaVerificationResult first = mfa.verify(USER, "abcdef", false);
            MfaVerificationResult second = mfa.verify(USER, "abcdef", false);
            MfaVerificationResult third = mfa.verify(USER, "abcdef", false);

            assertThat(first.outcome()).isEqualTo(MfaOutcome.INVALID_CODE);
            assertThat(first.remainingAttempts()).isEqualTo(2);
            assertThat(second.remainingAttempts()).isEqualTo(1);
            assertThat(third.outcome()).isEqualTo(MfaOutcome.LOCKED);
            assertThat(third.lockedUntil()).isEqualTo(clock.instant().plus(Duration.ofMinutes(15)));

            String valid = totp.codeAt(setup.secret(), clock.instant());
            assertThat(mfa.verify(USER, valid, false).outcome()).isEqualTo(MfaOutcome.LOCKED);
            assertThat(auditStore.eventsWithAction(AuditActions.MFA_EXCESSIVE_ATTEMPTS)).hasSize(1);
            assertThat(gateway.sentWithCategory(NotificationPayload.CATEGORY_SECURITY_ALERT)).hasSize(1);
        }

        @Test
        @DisplayName("should unlock once the lockout has passed")
        void shouldUnlockAfterCooldown() {
            TotpEnrollment setup = enrollTotp();
            for (int i = 0; i < 3; i++) {
                mfa.verify(USER, "abcdef", false);
            }

            clock.advance(Duration.ofMinutes(15));

            assertThat(mfa.verify(USER, totp.codeAt(setup.secret(), clock.instant()), false).success()).isTrue();
        }

        @Test
        @DisplayName("should reset the failure count after a success")
        void shouldResetFailuresOnSuccess() {
            TotpEnrollment setup = enrollTotp();
            mfa.verify(USER, "abcdef", false);
            mfa.verify(USER, "abcdef", false);
            mfa.verify(USER, totp.codeAt(setup.secret(), clock.instant()), false);

            assertThat(mfa.verify(USER, "abcdef", false).remainingAttempts()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fail with an integrity error when the stored secret was tampered with")
        void shouldFailOnTamperedSecret() {
            enrollTotp();
            MfaEnrollment stored = enrollments.find(USER).orElseThrow();
            enrollments.save(new MfaEnrollment(USER, MfaMethod.TOTP, "AAAA" + stored.encryptedSecret().substring(4),
                    null, stored.hashedBackupCodes(), stored.enabledAt()));

            assertThatThrownBy(() -> mfa.verify(USER, "123456", false))
                    .isInstanceOf(IntegrityFailureException.class);
            assertThat(auditStore.eventsWithAction(AuditActions.MFA_VERIFICATION_FAILED))
                    .anyMatch(e -> e.outcome() == AuditOutcome.ERROR);
        }
    }

    @Nested
    @DisplayName("backup codes")
    class Backup {

        @Test
        @DisplayName("should accept each backup code exactly once")
        void shouldBeSingleUse() {
            TotpEnrollment setup = enrollTotp();
            String code = setup.backupCodes().get(3);

            assertThat(mfa.verify(USER, code, true).success()).isTrue();
            assertThat(mfa.verify(USER, code, true).outcome()).isEqualTo(MfaOutcome.INVALID_CODE);
            assertThat(mfa.status(USER).backupCodesRemaining()).isEqualTo(9);
        }

        @Test
        @DisplayName("should audit and notify with the remaining count")
        void shouldNotifyOnUse() {
            TotpEnrollment setup = enrollTotp();

            mfa.verify(USER, setup.backupCodes().get(0), true);

            assertThat(auditStore.eventsWithAction(AuditActions.MFA_BACKUP_CODE_USED).get(0).details())
                    .containsEntry("remainingBackupCount", 9);
            assertThat(gateway.lastBody(DeliveryChannel.IN_APP)).contains("9 backup codes remaining");
        }

        @Test
        @DisplayName("regenerate should replace all codes")
        void regenerateShouldReplace() {
            TotpEnrollment setup = enrollTotp();

            List<String> fresh = mfa.regenerateBackupCodes(USER);

            assertThat(fresh).hasSize(10);
            assertThat(mfa.verify(USER, setup.backupCodes().get(0), true).success()).isFalse();
            assertThat(mfa.verify(USER, fresh.get(0), true).success()).isTrue();
        }

        @Test
        @DisplayName("regenerate should require an enrollment")
        void regenerateShouldRequireEnrollment() {
            assertThatThrownBy(() -> mfa.regenerateBackupCodes(USER))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("SMS and email codes")
    class DeliveredCodes {

        @Test
        @DisplayName("should enable SMS with the delivered code and store the phone number encrypted")
        void shouldEnableSms() {
            mfa.sendSmsCode(USER, "+15551234567").join();

            EnableOutcome outcome = mfa.enable(MfaEnableRequest.sms(USER, "+15551234567", lastCode(DeliveryChannel.SMS)));

            assertThat(outcome).isEqualTo(EnableOutcome.ENABLED);
            assertThat(enrollments.find(USER).orElseThrow().encryptedContact()).doesNotContain("5551234567");
        }

        @Test
        @DisplayName("should verify an emailed code once")
        void shouldVerifyEmailCodeOnce() {
            mfa.sendEmailCode(USER, "jane@example.com").join();
            mfa.enable(MfaEnableRequest.email(USER, "jane@example.com", lastCode(DeliveryChannel.EMAIL)));
            mfa.sendEmailCode(USER, "jane@example.com").join();
            String code = lastCode(DeliveryChannel.EMAIL);

            assertThat(mfa.verify(USER, code, false).success()).isTrue();
            assertThat(mfa.verify(USER, code, false).outcome()).isEqualTo(MfaOutcome.NO_PENDING_CODE);
        }

        @Test
        @DisplayName("should reject an expired code")
        void shouldExpireCodes() {
            mfa.sendSmsCode(USER, "+15551234567").join();
            String code = lastCode(DeliveryChannel.SMS);
            clock.advance(Duration.ofMinutes(5));

            assertThat(mfa.enable(MfaEnableRequest.sms(USER, "+15551234567", code)))
                    .isEqualTo(EnableOutcome.CODE_EXPIRED);
        }

        @Test
        @DisplayName("should require a pending code")
        void shouldRequirePendingCode() {
            assertThat(mfa.enable(MfaEnableRequest.sms(USER, "+15551234567", "123456")))
                    .isEqualTo(EnableOutcome.NO_PENDING_CODE);
        }

        @Test
        @DisplayName("wrong enrollment codes should count towards the lockout and discard the pending code")
        void wrongEnrollmentCodesShouldLockOut() {
            mfa.sendSmsCode(USER, "+15551234567").join();
            String code = lastCode(DeliveryChannel.SMS);
            String wrong = code.equals("000000") ? "111111" : "000000";

            assertThat(mfa.enable(MfaEnableRequest.sms(USER, "+15551234567", wrong)))
                    .isEqualTo(EnableOutcome.INVALID_CODE);
            assertThat(mfa.enable(MfaEnableRequest.sms(USER, "+15551234567", wrong)))
                    .isEqualTo(EnableOutcome.INVALID_CODE);
            assertThat(mfa.enable(MfaEnableRequest.sms(USER, "+15551234567", wrong)))
                    .isEqualTo(EnableOutcome.LOCKED);

            assertThat(mfa.enable(MfaEnableRequest.sms(USER, "+15551234567", code)))
                    .isEqualTo(EnableOutcome.LOCKED);
            assertThat(mfa.pendingCodeCount()).isZero();
            assertThat(mfa.isEnabled(USER)).isFalse();
            assertThat(auditStore.eventsWithAction(AuditActions.MFA_EXCESSIVE_ATTEMPTS)).hasSize(1);
        }

        @Test
        @DisplayName("should fail the send and drop the code when delivery fails")
        void shouldPropagateDeliveryFailure() {
            gateway.failChannel(DeliveryChannel.SMS);

            assertThatThrownBy(() -> mfa.sendSmsCode(USER, "+15551234567").join())
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(DeliveryFailureException.class);
            assertThat(mfa.pendingCodeCount()).isZero();
        }

        @Test
        @DisplayName("sweep should drop expired codes")
        void sweepShouldDropExpired() {
            mfa.sendSmsCode(USER, "+15551234567").join();
            mfa.sendEmailCode("user-2", "jo@example.com").join();
            clock.advance(Duration.ofMinutes(6));

            assertThat(mfa.sweep()).isEqualTo(2);
            assertThat(mfa.pendingCodeCount()).isZero();
        }
    }

    @Nested
    @DisplayName("disable")
    class Disable {

        @Test
        @DisplayName("should remove the enrollment, audit the actor and alert the user")
        void shouldDisable() {
            enrollTotp();

            mfa.disable(USER, "admin-1");

            assertThat(mfa.isEnabled(USER)).isFalse();
            assertThat(mfa.status(USER).enabled()).isFalse();
            assertThat(auditStore.eventsWithAction(AuditActions.MFA_DISABLED).get(0).actorId()).isEqualTo("admin-1");
            assertThat(gateway.sentWithCategory(NotificationPayload.CATEGORY_SECURITY_ALERT)).hasSize(1);
        }

        @Test
        @DisplayName("should reject users without an enrollment")
        void shouldRequireEnrollment() {
            assertThatThrownBy(() -> mfa.disable(USER, USER))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("concurrent attempts")
    class ConcurrentAttempts {

        @Test
        @DisplayName("a failure that passed the lock check before the lockout should not lift it")
        void lateFailureShouldKeepLockout() throws Exception {
            PausingEnrollmentStore pausing = new PausingEnrollmentStore();
            SecurityMetrics metrics = new SecurityMetrics(registry, "test");
            EncryptionService encryption =
                    new EncryptionService(KeyMaterial.fromHex(MASTER_KEY_HEX), 1_000, new SecureRandom(), metrics);
            AuditTrail audit = new AuditTrail(auditStore, Runnable::run, clock, metrics, new PhiRedactor(), false);
            MfaService service = new MfaService(pausing, encryption, totp, new BackupCodes(new PasswordHasher(1_000)),
                    gateway, audit, metrics, clock, MfaSettings.DEFAULT);
            TotpEnrollment setup = service.setupTotp(USER, null);
            service.enable(MfaEnableRequest.totp(USER, setup.secret(),
                    totp.codeAt(setup.secret(), clock.instant()), setup.backupCodes()));
            service.verify(USER, "abcdef", false);
            service.verify(USER, "abcdef", false);

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                pausing.pauseNextFind();
                Future<MfaVerificationResult> late = executor.submit(() -> service.verify(USER, "abcdef", false));
                assertThat(pausing.awaitPaused()).isTrue();

                MfaVerificationResult locking = service.verify(USER, "abcdef", false);
                pausing.resume();
                MfaVerificationResult lateResult = late.get(10, TimeUnit.SECONDS);

                assertThat(locking.outcome()).isEqualTo(MfaOutcome.LOCKED);
                assertThat(lateResult.outcome()).isEqualTo(MfaOutcome.LOCKED);
                assertThat(lateResult.lockedUntil()).isEqualTo(locking.lockedUntil());
            } finally {
                executor.shutdownNow();
            }

            String valid = totp.codeAt(setup.secret(), clock.instant());
            assertThat(service.verify(USER, valid, false).outcome()).isEqualTo(MfaOutcome.LOCKED);
            assertThat(auditStore.eventsWithAction(AuditActions.MFA_EXCESSIVE_ATTEMPTS)).hasSize(1);
        }

        @Test
        @DisplayName("parallel wrong codes should lock exactly once and keep the lock")
        void parallelFailuresShouldLockOnce() {
            TotpEnrollment setup = enrollTotp();

            List<MfaVerificationResult> results = Concurrently.run(16, () -> mfa.verify(USER, "abcdef", false));

            assertThat(results).filteredOn(r -> r.outcome() == MfaOutcome.INVALID_CODE).hasSize(2);
            assertThat(results).filteredOn(r -> r.outcome() == MfaOutcome.LOCKED).hasSize(14);
            assertThat(auditStore.eventsWithAction(AuditActions.MFA_EXCESSIVE_ATTEMPTS)).hasSize(1);
            assertThat(gateway.sentWithCategory(NotificationPayload.CATEGORY_SECURITY_ALERT)).hasSize(1);
            String valid = totp.codeAt(setup.secret(), clock.instant());
            assertThat(mfa.verify(USER, valid, false).outcome()).isEqualTo(MfaOutcome.LOCKED);
        }

        @Test
        @DisplayName("the same backup code used in parallel should succeed exactly once")
        void backupCodeShouldBeSingleUseUnderContention() {
            TotpEnrollment setup = enrollTotp();
            String code = setup.backupCodes().get(0);

            List<MfaVerificationResult> results = Concurrently.run(8, () -> mfa.verify(USER, code, true));

            assertThat(results).filteredOn(MfaVerificationResult::success).hasSize(1);
            assertThat(mfa.status(USER).backupCodesRemaining()).isEqualTo(9);
            assertThat(auditStore.eventsWithAction(AuditActions.MFA_BACKUP_CODE_USED)).hasSize(1);
        }
    }

    /**
     * Enrollment store that can hold one lookup until released, to interleave two verifications.
     */
    private static final class PausingEnrollmentStore extends InMemoryMfaEnrollmentStore {

        private final AtomicBoolean pauseNext = new AtomicBoolean();
        private final CountDownLatch paused = new CountDownLatch(1);
        private final CountDownLatch released = new CountDownLatch(1);

        void pauseNextFind() {
            pauseNext.set(true);
        }

        boolean awaitPaused() throws InterruptedException {
            return paused.await(10, TimeUnit.SECONDS);
        }

        void resume() {
            released.countDown();
        }

        @Override
        public Optional<MfaEnrollment> find(String userId) {
            if (pauseNext.compareAndSet(true, false)) {
                paused.countDown();
                try {
                    if (!released.await(10, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("lookup was never released");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            return super.find(userId);
        }
    }
}
