package com.flagship.restaurant_pos.payment;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.access.CapabilityGuard;
import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.access.User;
import com.flagship.restaurant_pos.audit.AuditActionType;
import com.flagship.restaurant_pos.audit.AuditRecord;
import com.flagship.restaurant_pos.audit.AuditTrailService;
import com.flagship.restaurant_pos.exception.NotFoundException;
import com.flagship.restaurant_pos.order.Order;
import com.flagship.restaurant_pos.order.OrderItem;
import com.flagship.restaurant_pos.payment.dto.ReceiptResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Builds receipts and sends them to the {@link ReceiptPrinter}.
 *
 * {@code receipt_printed} is the one mutable column of a payment. It is set
 * after the first successful print and never cleared; reprints are allowed
 * and leave it untouched.
 */
@Service
@Slf4j
public class ReceiptService {

    private final PaymentRepository paymentRepository;
    private final ReceiptPrinter printer;
    private final AuditTrailService auditTrail;
    private final CapabilityGuard capabilities;

    @Value("${pos.receipt.business-name:Restaurant}")
    private String businessName;

    @Value("${pos.receipt.address:}")
    private String businessAddress;

    @Value("${pos.receipt.tax-id:}")
    private String taxId;

    @Value("${pos.currency-code:XAF}")
    private String currencyCode;

    public ReceiptService(PaymentRepository paymentRepository, ReceiptPrinter printer,
                          AuditTrailService auditTrail, CapabilityGuard capabilities) {
        this.paymentRepository = paymentRepository;
        this.printer = printer;
        this.auditTrail = auditTrail;
        this.capabilities = capabilities;
    }

    @Transactional
    public ReceiptResponse print(UUID paymentId, ActorContext actor) {
        capabilities.requires(actor, Role.CASHIER, Role.ADMIN);
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> NotFoundException.of("Payment", paymentId));
        Receipt receipt = buildReceipt(payment, Instant.now());

        boolean printed;
        try {
            printed = printer.print(receipt);
        } catch (RuntimeException e) {
            log.error("Receipt printer failed for payment {}: {}", payment.getPaymentNumber(), e.getMessage(), e);
            printed = false;
        }

        if (printed && payment.markReceiptPrinted(Instant.now())) {
            auditTrail.record(AuditRecord.by(actor, AuditActionType.USER_ACTION)
                    .tableName("payments")
                    .recordId(payment.getId().toString())
                    .description("Receipt printed for payment " + payment.getPaymentNumber())
                    .build());
        } else if (!printed) {
            log.warn("Receipt not printed: payment={}", payment.getPaymentNumber());
        }

        return ReceiptResponse.builder()
                .paymentId(payment.getId())
                .printed(printed)
                .receiptPrintedAt(payment.getReceiptPrintedAt())
                .receipt(receipt)
                .build();
    }

    Receipt buildReceipt(Payment payment, Instant issuedAt) {
        Order order = payment.getOrder();
        Receipt.ReceiptBuilder builder = Receipt.builder()
                .businessName(businessName)
                .businessAddress(businessAddress)
                .taxId(taxId)
                .receiptNumber(payment.getPaymentNumber())
                .orderNumber(order.getOrderNumber())
                .table(order.isTakeout() ? "Takeout" : order.getTable().getNumber())
                .waiter(displayName(order.getWaiter()))
                .cashier(displayName(payment.getProcessedBy()))
                .issuedAt(issuedAt)
                .subtotal(order.getSubtotal())
                .taxAmount(order.getTaxAmount())
                .totalAmount(order.getTotalAmount())
                .paymentMethod(payment.getMethod().code())
                .amountPaid(payment.getAmount())
                .transactionReference(payment.getTransactionReference())
                .currency(currencyCode);
        for (OrderItem item : order.getItems()) {
            builder.line(new Receipt.Line(item.getProduct().getName(), item.getQuantity(),
                    item.getUnitPrice(), item.getSubtotal()));
        }
        return builder.build();
    }

    private static String displayName(User user) {
        return user.getFullName() != null && !user.getFullName().isBlank() ? user.getFullName() : user.getUsername();
    }
}
