package com.flagship.restaurant_pos.payment;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.payment.dto.PaymentResponse;
import com.flagship.restaurant_pos.payment.dto.ProcessPaymentRequest;
import com.flagship.restaurant_pos.payment.dto.ReceiptResponse;
import com.flagship.restaurant_pos.signal.CashDrawerSignal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;
    private final ReceiptService receiptService;

    @PostMapping("/payments")
    public ResponseEntity<PaymentResponse> processPayment(@Valid @RequestBody ProcessPaymentRequest request,
                                                          @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        PaymentResponse response = paymentService.processPayment(request.getOrderId(), request.getAmount(),
                request.getPaymentMethod(), request.getTransactionReference(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/payments/{paymentId}")
    public PaymentResponse getPayment(@PathVariable("paymentId") UUID paymentId,
                                      @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return paymentService.getPayment(paymentId, actor);
    }

    @GetMapping("/orders/{orderId}/payments")
    public List<PaymentResponse> paymentsForOrder(@PathVariable("orderId") UUID orderId,
                                                  @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return paymentService.paymentsForOrder(orderId, actor);
    }

    @PostMapping("/payments/{paymentId}/receipt")
    public ReceiptResponse printReceipt(@PathVariable("paymentId") UUID paymentId,
                                        @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return receiptService.print(paymentId, actor);
    }

    /**
     * Polled by the cashier terminal. 204 when there is nothing to open.
     */
    @GetMapping("/cash-drawer")
    public ResponseEntity<CashDrawerSignal> pollCashDrawer(@RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return paymentService.takeCashDrawerSignal(actor)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
