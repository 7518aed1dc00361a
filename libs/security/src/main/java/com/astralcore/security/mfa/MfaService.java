package com.astralcore.security.mfa;

import com.astralcore.audit.AuditActions;
import com.astralcore.audit.AuditDetails;
import com.astralcore.audit.AuditEntry;
import com.astralcore.audit.AuditTrail;
import com.astralcore.common.error.DeliveryFailureException;
import com.astralcore.common.error.IntegrityFailureException;
import com.astralcore.common.error.ResourceNotFoundException;
import com.astralcore.crypto.EncryptionService;
import com.astralcore.crypto.HmacSigner;
import com.astralcore.crypto.SecureTokens;
import com.astralcore.observability.PhiRedactor;
import com.astralcore.observability.SecurityMarkers;
import com.astralcore.observability.SecurityMetrics;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Multi-factor authentication: TOTP enrollment, SMS/email one-time codes, backup codes and
 * lockout after repeated failures.
 * <p>
 * Enrollments are durable (via {@link MfaEnrollmentStore}); pending codes and failure
 * counters live in memory and are lost on restart.
 */
public final class MfaService {

    private static final Logger log = LoggerFactory.getLogger(MfaService.class);

    private static final String ENTITY = "MfaEnrollment";
    private static final int CODE_LENGTH = 6;

    private final MfaEnrollmentStore enrollments;
    private final EncryptionService encryption;
    private final TotpGenerator totp;
    private final BackupCodes backupCodes;
    private final NotificationGateway notifications;
    private final AuditTrail audit;
    private final SecurityMetrics metrics;
    private final Clock clock;
    private final MfaSettings settings;

    private final ConcurrentHashMap<String, VerificationCode> pendingCodes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, FailedAttempts> failures = new ConcurrentHashMap<>();
    private final LoadingCache<String, Object> backupCodeLocks =
            Caffeine.newBuilder().weakValues().build(userId -> new Object());

    public MfaService(MfaEnrollmentStore enrollments, EncryptionService encryption, TotpGenerator totp,
                      BackupCodes backupCodes, NotificationGateway notifications, AuditTrail audit,
                      SecurityMetrics metrics, Clock clock, MfaSettings settings) {
        if (enrollments == null) {
            throw new IllegalArgumentException("enrollments must not be null");
        }
        if (encryption == null) {
            throw new IllegalArgumentException("encryption must not be null");
        }
        if (totp == null) {
            throw new IllegalArgumentException("totp must not be null");
        }
        if (backupCodes == null) {
            throw new IllegalArgumentException("backupCodes must not be null");
        }
        if (notifications == null) {
            throw new IllegalArgumentException("notifications must not be null");
        }
        if (audit == null) {
            throw new IllegalArgumentException("audit must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.enrollments = enrollments;
        this.encryption = encryption;
        this.totp = totp;
        this.backupCodes = backupCodes;
        this.notifications = notifications;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = settings != null ? settings : MfaSettings.DEFAULT;
    }

    // ---- Enrollment ----

    /**
     * Generates a TOTP secret, its provisioning URI and a fresh set of backup codes. Nothing is
     * stored until {@link #enable} confirms the user can produce a valid code.
     */
    public TotpEnrollment setupTotp(String userId, String accountName) {
        requireUser(userId);
        String secret = totp.generateSecret();
        String uri = totp.provisioningUri(settings.issuer(),
                accountName == null || accountName.isBlank() ? userId : accountName, secret);
        List<String> codes = backupCodes.generate(settings.backupCodeCount());
        audit.recordSuccess(entry(AuditActions.MFA_SETUP_INITIATED, userId)
                .details(methodDetails(MfaMethod.TOTP)));
        return new TotpEnrollment(secret, uri, codes);
    }

    public EnableOutcome enable(MfaEnableRequest request) {
        String userId = request.userId();
        EnableOutcome outcome = switch (request.method()) {
            case TOTP -> totp.verify(request.secret(), request.code())
                    ? EnableOutcome.ENABLED
                    : EnableOutcome.INVALID_CODE;
            case SMS, EMAIL -> request.contact() == null || request.contact().isBlank()
                    ? EnableOutcome.MISSING_CONTACT
                    : confirmDeliveredCode(request.method().deliveryChannel(), userId, request.code());
        };

        if (outcome != EnableOutcome.ENABLED) {
            log.info("MFA enable for user {} refused: {}", userId, outcome);
            audit.recordFailure(entry(AuditActions.MFA_ENABLED, userId)
                    .details(methodDetails(request.method())), outcome.name());
            return outcome;
        }

        MfaEnrollment enrollment = new MfaEnrollment(
                userId,
                request.method(),
                request.method() == MfaMethod.TOTP ? encryption.encrypt(request.secret()) : null,
                request.contact() != null ? encryption.encrypt(request.contact()) : null,
                backupCodes.hashAll(request.backupCodes()),
                clock.instant());
        enrollments.save(enrollment);
        clearFailures(userId, clock.instant());
        log.info("MFA enabled for user {} with method {}", userId, request.method());
        audit.recordSuccess(entry(AuditActions.MFA_ENABLED, userId).details(methodDetails(request.method())));
        return EnableOutcome.ENABLED;
    }

    // ---- Verification ----

    /**
     * Checks a second-factor code. A locked user is refused before the code is looked at.
     * After {@link MfaSettings#maxVerificationAttempts()} consecutive failures the user is
     * locked for {@link MfaSettings#lockoutDuration()} and a security alert is sent.
     *
     * @param isBackupCode whether {@code code} is a backup code rather than the enrolled factor
     * @throws IntegrityFailureException if the stored TOTP secret cannot be decrypted
     */
    public MfaVerificationResult verify(String userId, String code, boolean isBackupCode) {
        requireUser(userId);
        Instant now = clock.instant();

        FailedAttempts state = failures.get(userId);
        if (state != null && state.lockedAt(now)) {
            metrics.mfaVerification(MfaOutcome.LOCKED.name());
            return MfaVerificationResult.locked(state.lockedUntil());
        }

        Optional<MfaEnrollment> enrollment = enrollments.find(userId);
        if (enrollment.isEmpty()) {
            metrics.mfaVerification(MfaOutcome.NOT_ENABLED.name());
            return MfaVerificationResult.notEnabled();
        }
        MfaEnrollment factor = enrollment.get();

        MfaOutcome outcome;
        int remainingBackupCodes = -1;
        if (isBackupCode) {
            remainingBackupCodes = consumeBackupCode(userId, code);
            outcome = remainingBackupCodes >= 0 ? MfaOutcome.VERIFIED : MfaOutcome.INVALID_CODE;
        } else {
            outcome = switch (factor.method()) {
                case TOTP -> verifyTotp(factor, code) ? MfaOutcome.VERIFIED : MfaOutcome.INVALID_CODE;
                case SMS, EMAIL -> consumeCode(factor.method().deliveryChannel(), userId, code);
            };
        }
        metrics.mfaVerification(outcome.name());

        if (outcome == MfaOutcome.VERIFIED) {
            clearFailures(userId, now);
            if (isBackupCode) {
                onBackupCodeUsed(userId, remainingBackupCodes);
            } else {
                audit.recordSuccess(entry(AuditActions.MFA_VERIFIED, userId)
                        .details(methodDetails(factor.method())));
            }
            return MfaVerificationResult.verified();
        }
        return onFailure(userId, outcome, now);
    }

    // ---- Code delivery ----

    public CompletableFuture<Void> sendSmsCode(String userId, String phoneNumber) {
        return sendCode(userId, DeliveryChannel.SMS, phoneNumber, PhiRedactor.maskPhone(phoneNumber));
    }

    public CompletableFuture<Void> sendEmailCode(String userId, String email) {
        return sendCode(userId, DeliveryChannel.EMAIL, email, PhiRedactor.maskEmail(email));
    }

    private CompletableFuture<Void> sendCode(String userId, DeliveryChannel channel, String recipient,
                                             String maskedRecipient) {
        requireUser(userId);
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("recipient must not be null or blank");
        }
        String key = codeKey(channel, userId);
        VerificationCode pending = new VerificationCode(SecureTokens.randomDigits(CODE_LENGTH), channel,
                clock.instant().plus(settings.codeExpiry()));
        pendingCodes.put(key, pending);

        NotificationPayload payload = new NotificationPayload(NotificationPayload.CATEGORY_CODE,
                "Your verification code",
                "Your " + settings.issuer() + " verification code is " + pending.code()
                        + ". It expires in " + settings.codeExpiry().toMinutes() + " minutes.");

        CompletableFuture<Void> delivery;
        try {
            delivery = notifications.deliver(channel, recipient, payload);
        } catch (RuntimeException e) {
            delivery = CompletableFuture.failedFuture(e);
        }
        return delivery.handle((ignored, error) -> {
            AuditEntry sent = entry(AuditActions.MFA_CODE_SENT, userId)
                    .details(AuditDetails.attributes(Map.of("channel", channel.name())));
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                pendingCodes.remove(key, pending);
                log.warn("Failed to deliver {} code to {} for user {}", channel, maskedRecipient, userId, cause);
                audit.recordFailure(sent, "delivery failed");
                throw new CompletionException(new DeliveryFailureException(channel.name(), cause));
            }
            log.info("Sent {} verification code to {} for user {}", channel, maskedRecipient, userId);
            audit.recordSuccess(sent);
            return null;
        });
    }

    // ---- Management ----

    /**
     * Replaces all backup codes of an enrolled user.
     *
     * @return the new plaintext codes, shown once
     * @throws ResourceNotFoundException if the user has no enrollment
     */
    public List<String> regenerateBackupCodes(String userId) {
        requireUser(userId);
        List<String> codes = backupCodes.generate(settings.backupCodeCount());
        List<String> hashed = backupCodes.hashAll(codes);
        synchronized (backupCodeLocks.get(userId)) {
            MfaEnrollment enrollment = enrollments.find(userId)
                    .orElseThrow(() -> new ResourceNotFoundException(ENTITY, userId));
            enrollments.save(enrollment.withBackupCodes(hashed));
        }
        audit.recordSuccess(entry(AuditActions.MFA_BACKUP_CODES_REGENERATED, userId)
                .details(AuditDetails.attributes(Map.of("count", codes.size()))));
        return codes;
    }

    /**
     * Removes the user's second factor and any pending codes or lockout, and notifies the user.
     *
     * @param actorId who disabled it (the user or an administrator)
     * @throws ResourceNotFoundException if the user has no enrollment
     */
    public void disable(String userId, String actorId) {
        requireUser(userId);
        MfaEnrollment enrollment = enrollments.find(userId)
                .orElseThrow(() -> new ResourceNotFoundException(ENTITY, userId));
        enrollments.delete(userId);
        for (DeliveryChannel channel : DeliveryChannel.values()) {
            pendingCodes.remove(codeKey(channel, userId));
        }
        failures.remove(userId);

        log.warn(SecurityMarkers.SECURITY, "MFA disabled for user {} by {}", userId, actorId);
        audit.recordSuccess(entry(AuditActions.MFA_DISABLED, userId)
                .actor(actorId != null ? actorId : userId)
                .details(methodDetails(enrollment.method())));
        alert(userId, "Multi-factor authentication disabled",
                "Multi-factor authentication was turned off for your account. "
                        + "If this was not you, contact support immediately.");
    }

    public MfaStatus status(String userId) {
        return enrollments.find(userId)
                .map(e -> new MfaStatus(true, e.method(), e.enabledAt(), e.hashedBackupCodes().size()))
                .orElseGet(MfaStatus::disabled);
    }

    public boolean isEnabled(String userId) {
        return enrollments.find(userId).isPresent();
    }

    /**
     * Drops expired pending codes and lockouts that have run out.
     *
     * @return the number of removed entries
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, VerificationCode> e : pendingCodes.entrySet()) {
            if (e.getValue().expired(now) && pendingCodes.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        for (Map.Entry<String, FailedAttempts> e : failures.entrySet()) {
            FailedAttempts state = e.getValue();
            if (state.lockedUntil() != null && !state.lockedAt(now) && failures.remove(e.getKey(), state)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("MFA sweep removed {} expired entries", removed);
        }
        return removed;
    }

    public int pendingCodeCount() {
        return pendingCodes.size();
    }

    public MfaSettings settings() {
        return settings;
    }

    // ---- Internals ----

    private boolean verifyTotp(MfaEnrollment enrollment, String code) {
        String secret;
        try {
            secret = encryption.decrypt(enrollment.encryptedSecret());
        } catch (IntegrityFailureException e) {
            log.error(SecurityMarkers.SECURITY, "Stored TOTP secret of user {} failed integrity check",
                    enrollment.userId());
            audit.recordError(entry(AuditActions.MFA_VERIFICATION_FAILED, enrollment.userId()), e);
            throw e;
        }
        return totp.verify(secret, code);
    }

    /**
     * Checks the code sent to confirm an SMS/email enrollment. Wrong codes count towards the
     * same lockout as verification; once locked the pending code is discarded.
     */
    private EnableOutcome confirmDeliveredCode(DeliveryChannel channel, String userId, String code) {
        Instant now = clock.instant();
        FailedAttempts state = failures.get(userId);
        if (state != null && state.lockedAt(now)) {
            return EnableOutcome.LOCKED;
        }
        MfaOutcome outcome = consumeCode(channel, userId, code);
        if (outcome == MfaOutcome.INVALID_CODE && countFailure(userId, now).lockedAt(now)) {
            pendingCodes.remove(codeKey(channel, userId));
            return EnableOutcome.LOCKED;
        }
        return toEnableOutcome(outcome);
    }

    /**
     * Single-use lookup of a pending SMS/email code.
     */
    private MfaOutcome consumeCode(DeliveryChannel channel, String userId, String code) {
        String key = codeKey(channel, userId);
        VerificationCode pending = pendingCodes.get(key);
        if (pending == null) {
            return MfaOutcome.NO_PENDING_CODE;
        }
        if (pending.expired(clock.instant())) {
            pendingCodes.remove(key, pending);
            return MfaOutcome.CODE_EXPIRED;
        }
        if (code == null || !HmacSigner.constantTimeEquals(pending.code(), code.strip())) {
            return MfaOutcome.INVALID_CODE;
        }
        // A concurrent verification may have consumed it first.
        return pendingCodes.remove(key, pending) ? MfaOutcome.VERIFIED : MfaOutcome.NO_PENDING_CODE;
    }

    /**
     * @return the number of backup codes left after consuming {@code code}, or -1 if it did not match
     */
    private int consumeBackupCode(String userId, String code) {
        synchronized (backupCodeLocks.get(userId)) {
            Optional<MfaEnrollment> current = enrollments.find(userId);
            if (current.isEmpty()) {
                return -1;
            }
            List<String> hashes = current.get().hashedBackupCodes();
            OptionalInt match = backupCodes.match(code, hashes);
            if (match.isEmpty()) {
                return -1;
            }
            List<String> remaining = new ArrayList<>(hashes);
            remaining.remove(match.getAsInt());
            enrollments.save(current.get().withBackupCodes(remaining));
            return remaining.size();
        }
    }

    private void onBackupCodeUsed(String userId, int remaining) {
        log.info("Backup code used by user {}, {} remaining", userId, remaining);
        audit.recordSuccess(entry(AuditActions.MFA_BACKUP_CODE_USED, userId)
                .details(AuditDetails.attributes(Map.of("remainingBackupCount", remaining))));
        alert(userId, "Backup code used",
                "A backup code was used to sign in to your account. You have " + remaining
                        + " backup codes remaining.");
    }

    private MfaVerificationResult onFailure(String userId, MfaOutcome outcome, Instant now) {
        audit.recordFailure(entry(AuditActions.MFA_VERIFICATION_FAILED, userId), outcome.name());
        FailedAttempts updated = countFailure(userId, now);
        if (updated.lockedAt(now)) {
            return MfaVerificationResult.locked(updated.lockedUntil());
        }
        return MfaVerificationResult.failed(outcome, settings.maxVerificationAttempts() - updated.count());
    }

    /**
     * Adds one failure to the user's counter. An active lockout is left untouched, so attempts
     * that passed the lock check before it was set cannot reset it.
     */
    private FailedAttempts countFailure(String userId, Instant now) {
        AtomicBoolean newlyLocked = new AtomicBoolean();
        FailedAttempts updated = failures.compute(userId, (user, previous) -> {
            if (previous != null && previous.lockedAt(now)) {
                return previous;
            }
            int count = (previous == null || previous.lockedUntil() != null ? 0 : previous.count()) + 1;
            if (count >= settings.maxVerificationAttempts()) {
                newlyLocked.set(true);
                return new FailedAttempts(count, now.plus(settings.lockoutDuration()));
            }
            return new FailedAttempts(count, null);
        });

        if (newlyLocked.get()) {
            log.warn(SecurityMarkers.SECURITY, "User {} locked out of MFA after {} failed attempts until {}",
                    userId, updated.count(), updated.lockedUntil());
            audit.recordFailure(entry(AuditActions.MFA_EXCESSIVE_ATTEMPTS, userId)
                    .details(AuditDetails.attributes(Map.of(
                            "attempts", updated.count(),
                            "lockedUntil", updated.lockedUntil().toString()))), "too many failed attempts");
            alert(userId, "Suspicious sign-in activity",
                    "Several incorrect verification codes were entered for your account. "
                            + "Verification is locked for " + settings.lockoutDuration().toMinutes() + " minutes.");
        }
        return updated;
    }

    /**
     * Resets the failure counter after a success, unless a lockout set meanwhile is still running.
     */
    private void clearFailures(String userId, Instant now) {
        failures.computeIfPresent(userId, (user, state) -> state.lockedAt(now) ? state : null);
    }

    /**
     * Fire-and-forget in-app security alert; delivery problems are only logged.
     */
    private void alert(String userId, String subject, String body) {
        NotificationPayload payload =
                new NotificationPayload(NotificationPayload.CATEGORY_SECURITY_ALERT, subject, body);
        try {
            notifications.deliver(DeliveryChannel.IN_APP, userId, payload)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            log.warn("Security alert delivery to user {} failed: {}", userId, error.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Security alert delivery to user {} failed: {}", userId, e.getMessage());
        }
    }

    private static EnableOutcome toEnableOutcome(MfaOutcome outcome) {
        return switch (outcome) {
            case VERIFIED -> EnableOutcome.ENABLED;
            case CODE_EXPIRED -> EnableOutcome.CODE_EXPIRED;
            case NO_PENDING_CODE -> EnableOutcome.NO_PENDING_CODE;
            default -> EnableOutcome.INVALID_CODE;
        };
    }

    private static String codeKey(DeliveryChannel channel, String userId) {
        return channel.name().toLowerCase(Locale.ROOT) + ":" + userId;
    }

    private static AuditEntry entry(String action, String userId) {
        return AuditEntry.of(action, ENTITY).entityId(userId).actor(userId);
    }

    private static AuditDetails methodDetails(MfaMethod method) {
        return AuditDetails.attributes(Map.of("method", method.name()));
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
    }

    private record FailedAttempts(int count, Instant lockedUntil) {

        boolean lockedAt(Instant now) {
            return lockedUntil != null && now.isBefore(lockedUntil);
        }
    }
}
