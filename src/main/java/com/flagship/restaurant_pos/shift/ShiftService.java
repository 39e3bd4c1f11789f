package com.flagship.restaurant_pos.shift;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.access.CapabilityGuard;
import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.access.User;
import com.flagship.restaurant_pos.access.UserRepository;
import com.flagship.restaurant_pos.audit.AuditActionType;
import com.flagship.restaurant_pos.audit.AuditRecord;
import com.flagship.restaurant_pos.audit.AuditTrailService;
import com.flagship.restaurant_pos.exception.AccessDeniedException;
import com.flagship.restaurant_pos.exception.StateConflictException;
import com.flagship.restaurant_pos.observability.PosMetrics;
import com.flagship.restaurant_pos.payment.PaymentMethod;
import com.flagship.restaurant_pos.payment.PaymentRepository;
import com.flagship.restaurant_pos.shift.dto.ShiftResponse;
import com.flagship.restaurant_pos.shift.dto.ShiftSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Opens and reconciles cashier drawer sessions.
 *
 * Starting a shift locks the user row, so two terminals racing to open a
 * shift for the same cashier are serialized and the second one sees the
 * first one's shift. The partial unique index on open shifts backs this up.
 */
@Service
@Slf4j
public class ShiftService {

    private final ShiftRepository shiftRepository;
    private final UserRepository userRepository;
    private final PaymentRepository paymentRepository;
    private final AuditTrailService auditTrail;
    private final CapabilityGuard capabilities;
    private final PosMetrics metrics;

    @Value("${pos.shift.variance-threshold:10}")
    private BigDecimal varianceThreshold;

    @Value("${pos.currency-code:XAF}")
    private String currencyCode;

    public ShiftService(ShiftRepository shiftRepository, UserRepository userRepository,
                        PaymentRepository paymentRepository, AuditTrailService auditTrail,
                        CapabilityGuard capabilities, PosMetrics metrics) {
        this.shiftRepository = shiftRepository;
        this.userRepository = userRepository;
        this.paymentRepository = paymentRepository;
        this.auditTrail = auditTrail;
        this.capabilities = capabilities;
        this.metrics = metrics;
    }

    /**
     * @throws StateConflictException if the user already has an open shift
     */
    @Transactional
    public ShiftResponse startShift(BigDecimal openingCash, ActorContext actor) {
        User user = lockUser(actor);
        capabilities.requires(actor, Role.CASHIER, Role.ADMIN);
        if (shiftRepository.findOpenByUserId(user.getId()).isPresent()) {
            throw new StateConflictException("User " + user.getUsername() + " already has an open shift");
        }

        Shift shift = shiftRepository.save(Shift.start(user, actor.getDeviceId(), openingCash, Instant.now()));
        user.markShiftStarted();

        auditTrail.record(AuditRecord.by(actor, AuditActionType.USER_ACTION)
                .tableName("shifts")
                .recordId(shift.getId().toString())
                .description(String.format("Shift started with %s %s opening cash",
                        shift.getOpeningCash().toPlainString(), currencyCode))
                .meta("opening_cash", shift.getOpeningCash().toPlainString())
                .build());
        log.info("Shift started: user={}, device={}, opening={}", user.getUsername(), actor.getDeviceId(),
                shift.getOpeningCash());
        return ShiftResponse.from(shift, false);
    }

    /**
     * Closes the open shift and reconciles the drawer.
     *
     * expected = opening cash + cash payments processed by this user since the
     * shift started. A variance above the threshold is flagged, not refused.
     *
     * @throws StateConflictException if the user has no open shift
     */
    @Transactional
    public ShiftResponse endShift(BigDecimal closingCash, ActorContext actor) {
        User user = lockUser(actor);
        capabilities.requires(actor, Role.CASHIER, Role.ADMIN);
        Shift shift = shiftRepository.findOpenByUserId(user.getId())
                .orElseThrow(() -> new StateConflictException("User " + user.getUsername() + " has no open shift"));

        BigDecimal cashCollected = paymentRepository.sumAmountByProcessorAndMethodSince(
                user.getId(), PaymentMethod.CASH, shift.getStartedAt());
        BigDecimal expected = shift.getOpeningCash().add(cashCollected);
        shift.end(closingCash, expected, Instant.now());
        user.markShiftEnded();

        boolean varianceWarning = shift.getVariance().abs().compareTo(varianceThreshold) > 0;
        if (varianceWarning) {
            metrics.incrementVarianceWarnings();
            log.warn("Cash variance on shift close: user={}, expected={}, counted={}, variance={}",
                    user.getUsername(), shift.getExpectedCash(), shift.getClosingCash(), shift.getVariance());
        }

        auditTrail.record(AuditRecord.by(actor, AuditActionType.USER_ACTION)
                .tableName("shifts")
                .recordId(shift.getId().toString())
                .description(String.format("Shift ended: expected %s, counted %s, variance %s %s",
                        shift.getExpectedCash().toPlainString(), shift.getClosingCash().toPlainString(),
                        shift.getVariance().toPlainString(), currencyCode))
                .meta("expected_cash", shift.getExpectedCash().toPlainString())
                .meta("closing_cash", shift.getClosingCash().toPlainString())
                .meta("variance", shift.getVariance().toPlainString())
                .meta("variance_warning", varianceWarning)
                .build());
        log.info("Shift ended: user={}, variance={}", user.getUsername(), shift.getVariance());
        return ShiftResponse.from(shift, varianceWarning);
    }

    @Transactional(readOnly = true)
    public ShiftSummary currentSummary(ActorContext actor) {
        User user = capabilities.requires(actor, Role.CASHIER, Role.ADMIN);
        Shift shift = shiftRepository.findOpenByUserId(user.getId())
                .orElseThrow(() -> new StateConflictException("User " + user.getUsername() + " has no open shift"));

        BigDecimal cashCollected = paymentRepository.sumAmountByProcessorAndMethodSince(
                user.getId(), PaymentMethod.CASH, shift.getStartedAt());
        return ShiftSummary.builder()
                .shiftId(shift.getId())
                .startedAt(shift.getStartedAt())
                .openingCash(shift.getOpeningCash())
                .cashCollected(cashCollected)
                .expectedCash(shift.getOpeningCash().add(cashCollected))
                .transactionCount(paymentRepository.countByProcessorSince(user.getId(), shift.getStartedAt()))
                .build();
    }

    private User lockUser(ActorContext actor) {
        return userRepository.findByIdForUpdate(actor.getUserId())
                .orElseThrow(() -> new AccessDeniedException(AccessDeniedException.Reason.UNAUTHENTICATED,
                        "Unknown user: " + actor.getUserId()));
    }
}
