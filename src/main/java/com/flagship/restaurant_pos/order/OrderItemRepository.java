package com.flagship.restaurant_pos.order;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderItemRepository extends JpaRepository<OrderItem, UUID> {

    @Query("SELECT i.order.id FROM OrderItem i WHERE i.id = :itemId")
    Optional<UUID> findOrderIdByItemId(@Param("itemId") UUID itemId);

    /**
     * Lines the kitchen still has to prepare, oldest first. Orders paid before
     * the kitchen finished are completed but still listed.
     */
    @Query("""
        SELECT i FROM OrderItem i
        JOIN FETCH i.order o
        JOIN FETCH i.product p
        LEFT JOIN FETCH o.table
        WHERE i.confirmed = false
          AND p.requiresKitchen = true
          AND o.status <> com.flagship.restaurant_pos.order.OrderStatus.CANCELLED
        ORDER BY i.createdAt ASC
        """)
    List<OrderItem> findAwaitingKitchen();
}
