package com.flagship.restaurant_pos.access;

import com.flagship.restaurant_pos.audit.AuditActionType;
import com.flagship.restaurant_pos.audit.AuditRecord;
import com.flagship.restaurant_pos.audit.AuditTrailService;
import com.flagship.restaurant_pos.exception.AccessDeniedException;
import com.flagship.restaurant_pos.observability.PosMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Ties each non-admin user to the first terminal they use.
 *
 * Binding is per user, not per session. A user whose stored device id differs
 * from the presented one is refused with {@link AccessDeniedException.Reason#DEVICE_MISMATCH}
 * and sent back to login. Clearing a binding is an administrative override that
 * this service does not offer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceBindingService {

    public enum Outcome {
        EXEMPT,
        BOUND,
        VERIFIED
    }

    private final UserRepository userRepository;
    private final AuditTrailService auditTrail;
    private final PosMetrics metrics;

    /**
     * Binds on first use, verifies afterwards.
     *
     * @param userId acting user
     * @param presentedDeviceId device id sent by the terminal
     * @param ipAddress client address, for the audit entry
     * @return what happened
     * @throws AccessDeniedException if the user is unknown or inactive, no device id
     *         was presented, or the device does not match the stored one
     */
    @Transactional
    public Outcome bindOrVerify(UUID userId, String presentedDeviceId, String ipAddress) {
        User user = userRepository.findByIdForUpdate(userId)
                .filter(User::isActive)
                .orElseThrow(() -> new AccessDeniedException(
                        AccessDeniedException.Reason.UNAUTHENTICATED, "Unknown or inactive user: " + userId));

        if (user.getRole().isExemptFromDeviceBinding()) {
            return Outcome.EXEMPT;
        }

        if (presentedDeviceId == null || presentedDeviceId.isBlank()) {
            metrics.recordDeviceMismatch();
            throw new AccessDeniedException(AccessDeniedException.Reason.DEVICE_MISMATCH,
                    "No device id presented for user " + user.getUsername());
        }

        if (!user.isDeviceBound()) {
            user.bindDevice(presentedDeviceId);
            log.info("Device bound: user={}, device={}", user.getUsername(), presentedDeviceId);
            auditTrail.record(AuditRecord.by(ActorContext.of(user.getId(), presentedDeviceId, ipAddress),
                            AuditActionType.USER_ACTION)
                    .tableName("users")
                    .recordId(user.getId().toString())
                    .description("Device " + presentedDeviceId + " bound to user " + user.getUsername())
                    .meta("device_id", presentedDeviceId)
                    .build());
            return Outcome.BOUND;
        }

        if (!user.getDeviceId().equals(presentedDeviceId)) {
            log.warn("Device mismatch: user={}, bound={}, presented={}, ip={}",
                    user.getUsername(), user.getDeviceId(), presentedDeviceId, ipAddress);
            metrics.recordDeviceMismatch();
            throw new AccessDeniedException(AccessDeniedException.Reason.DEVICE_MISMATCH,
                    "This account is registered to a different device");
        }
        return Outcome.VERIFIED;
    }
}
