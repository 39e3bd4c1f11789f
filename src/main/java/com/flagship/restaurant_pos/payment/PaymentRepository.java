package com.flagship.restaurant_pos.payment;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append and read only; no delete or bulk update is exposed.
 */
public interface PaymentRepository extends Repository<Payment, UUID> {

    <S extends Payment> S save(S payment);

    Optional<Payment> findById(UUID id);

    List<Payment> findByOrderIdOrderByProcessedAtAsc(UUID orderId);

    long count();

    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payment p WHERE p.order.id = :orderId")
    BigDecimal sumAmountByOrderId(@Param("orderId") UUID orderId);

    @Query("""
        SELECT COALESCE(SUM(p.amount), 0) FROM Payment p
        WHERE p.processedBy.id = :userId AND p.method = :method AND p.processedAt >= :since
        """)
    BigDecimal sumAmountByProcessorAndMethodSince(@Param("userId") UUID userId,
                                                  @Param("method") PaymentMethod method,
                                                  @Param("since") Instant since);

    @Query("SELECT COUNT(p) FROM Payment p WHERE p.processedBy.id = :userId AND p.processedAt >= :since")
    long countByProcessorSince(@Param("userId") UUID userId, @Param("since") Instant since);
}
