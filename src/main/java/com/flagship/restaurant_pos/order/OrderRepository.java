package com.flagship.restaurant_pos.order;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    /**
     * Row lock on the order. Every item, confirmation and payment operation
     * takes it first, so totals and the paid amount are computed against a
     * stable item set.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :id")
    Optional<Order> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT o FROM Order o WHERE o.table.id = :tableId AND o.status IN :statuses")
    Optional<Order> findByTableIdAndStatusIn(@Param("tableId") UUID tableId,
                                             @Param("statuses") Collection<OrderStatus> statuses);

    List<Order> findByStatusInOrderByCreatedAtAsc(Collection<OrderStatus> statuses);
}
