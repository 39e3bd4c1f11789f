package com.flagship.restaurant_pos.payment;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.access.CapabilityGuard;
import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.access.User;
import com.flagship.restaurant_pos.access.UserRepository;
import com.flagship.restaurant_pos.audit.AuditActionType;
import com.flagship.restaurant_pos.audit.AuditRecord;
import com.flagship.restaurant_pos.audit.AuditTrailService;
import com.flagship.restaurant_pos.exception.NotFoundException;
import com.flagship.restaurant_pos.exception.StateConflictException;
import com.flagship.restaurant_pos.observability.CorrelationContext;
import com.flagship.restaurant_pos.observability.PosMetrics;
import com.flagship.restaurant_pos.order.Order;
import com.flagship.restaurant_pos.order.OrderRepository;
import com.flagship.restaurant_pos.payment.dto.PaymentResponse;
import com.flagship.restaurant_pos.sequence.DailySequenceService;
import com.flagship.restaurant_pos.sequence.DocumentNumber;
import com.flagship.restaurant_pos.signal.CashDrawerSignal;
import com.flagship.restaurant_pos.signal.TerminalSignalService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records payments against orders.
 *
 * Payment flow:
 * 1. Validate amount, method and reference; require an open shift
 * 2. Allocate the payment number (own committed transaction)
 * 3. Lock the order row, read what is already paid
 * 4. Cap the amount to the remaining balance
 * 5. Insert the payment, complete the order if it is now fully paid
 * 6. Audit, and raise the cash drawer signal for cash after commit
 *
 * Steps 3 to 6 share one transaction. Concurrent payments on the same order
 * queue on the order lock, so the sum of payments never exceeds the total.
 */
@Service
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final UserRepository userRepository;
    private final DailySequenceService sequences;
    private final AuditTrailService auditTrail;
    private final TerminalSignalService signals;
    private final CapabilityGuard capabilities;
    private final PosMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    @Value("${pos.currency-code:XAF}")
    private String currencyCode;

    public PaymentService(PaymentRepository paymentRepository, OrderRepository orderRepository,
                          UserRepository userRepository, DailySequenceService sequences,
                          AuditTrailService auditTrail, TerminalSignalService signals,
                          CapabilityGuard capabilities, PosMetrics metrics,
                          TransactionTemplate transactionTemplate) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
        this.userRepository = userRepository;
        this.sequences = sequences;
        this.auditTrail = auditTrail;
        this.signals = signals;
        this.capabilities = capabilities;
        this.metrics = metrics;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Takes a payment. An amount above the remaining balance is reduced to
     * the balance, never refused.
     *
     * @throws com.flagship.restaurant_pos.exception.ValidationException for a bad amount, method or missing reference
     * @throws StateConflictException if the cashier has no open shift, the order is closed or nothing is left to pay
     * @throws NotFoundException if the order does not exist
     */
    public PaymentResponse processPayment(UUID orderId, BigDecimal amount, String methodCode,
                                          String transactionReference, ActorContext actor) {
        long startTime = System.currentTimeMillis();
        User cashier = capabilities.requires(actor, Role.CASHIER, Role.ADMIN);
        PaymentMethod method = PaymentMethod.fromCode(methodCode);
        Payment.validate(amount, method, transactionReference);
        if (!cashier.isActiveShift()) {
            throw new StateConflictException("User " + cashier.getUsername() + " has no open shift");
        }
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, orderId.toString());

        String paymentNumber = sequences.next(DocumentNumber.PAYMENT);
        PaymentResponse response = transactionTemplate.execute(status ->
                recordPayment(paymentNumber, orderId, amount, method, transactionReference, cashier.getId(), actor));

        metrics.recordPaymentProcessed(method.code());
        metrics.recordLatency("process_payment", System.currentTimeMillis() - startTime);
        return response;
    }

    private PaymentResponse recordPayment(String paymentNumber, UUID orderId, BigDecimal requested,
                                          PaymentMethod method, String transactionReference,
                                          UUID cashierId, ActorContext actor) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> NotFoundException.of("Order", orderId));
        if (order.getStatus().isTerminal()) {
            throw new StateConflictException("Order " + order.getOrderNumber() + " is " + order.getStatus());
        }

        BigDecimal alreadyPaid = paymentRepository.sumAmountByOrderId(orderId);
        BigDecimal remaining = order.getTotalAmount().subtract(alreadyPaid);
        if (remaining.signum() <= 0) {
            throw new StateConflictException("Order " + order.getOrderNumber() + " has nothing left to pay");
        }

        BigDecimal normalized = requested.setScale(2, RoundingMode.HALF_UP);
        BigDecimal amount = normalized;
        if (normalized.compareTo(remaining) > 0) {
            log.warn("Payment capped to remaining balance: order={}, requested={}, remaining={}",
                    order.getOrderNumber(), normalized, remaining);
            metrics.incrementCappedPayments();
            amount = remaining;
        }

        Instant now = Instant.now();
        Payment payment = paymentRepository.save(Payment.record(paymentNumber, order, amount, method,
                transactionReference, userRepository.getReferenceById(cashierId), actor.getDeviceId(), now));
        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, payment.getId().toString());

        BigDecimal totalPaid = alreadyPaid.add(payment.getAmount());
        boolean completed = totalPaid.compareTo(order.getTotalAmount()) >= 0;
        if (completed) {
            order.complete(now);
            metrics.incrementOrdersCompleted();
        }

        auditTrail.record(AuditRecord.by(actor, AuditActionType.PAYMENT_PROCESS)
                .tableName("payments")
                .recordId(payment.getId().toString())
                .description(String.format("Payment %s of %s %s by %s on order %s",
                        paymentNumber, payment.getAmount().toPlainString(), currencyCode, method.code(),
                        order.getOrderNumber()))
                .meta("order_id", order.getId().toString())
                .meta("requested_amount", normalized.toPlainString())
                .meta("total_paid", totalPaid.toPlainString())
                .meta("order_completed", completed)
                .build());

        if (method == PaymentMethod.CASH) {
            signals.raiseCashDrawer(new CashDrawerSignal(payment.getId(), paymentNumber, payment.getAmount(),
                    actor.getDeviceId(), now));
        }
        log.info("Payment processed: number={}, order={}, amount={}, method={}, order_status={}",
                paymentNumber, order.getOrderNumber(), payment.getAmount(), method, order.getStatus());
        return PaymentResponse.from(payment, normalized, totalPaid);
    }

    @Transactional(readOnly = true)
    public PaymentResponse getPayment(UUID paymentId, ActorContext actor) {
        capabilities.requires(actor, Role.CASHIER, Role.ADMIN);
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> NotFoundException.of("Payment", paymentId));
        return PaymentResponse.from(payment, payment.getAmount(),
                paymentRepository.sumAmountByOrderId(payment.getOrder().getId()));
    }

    @Transactional(readOnly = true)
    public List<PaymentResponse> paymentsForOrder(UUID orderId, ActorContext actor) {
        capabilities.requires(actor, Role.CASHIER, Role.ADMIN);
        BigDecimal totalPaid = paymentRepository.sumAmountByOrderId(orderId);
        return paymentRepository.findByOrderIdOrderByProcessedAtAsc(orderId).stream()
                .map(payment -> PaymentResponse.from(payment, payment.getAmount(), totalPaid))
                .toList();
    }

    /**
     * Pending drawer-open request for the caller's terminal, consumed on read.
     */
    public Optional<CashDrawerSignal> takeCashDrawerSignal(ActorContext actor) {
        capabilities.requires(actor, Role.CASHIER, Role.ADMIN);
        if (actor.getDeviceId() == null) {
            return Optional.empty();
        }
        return signals.takeCashDrawer(actor.getDeviceId());
    }
}
