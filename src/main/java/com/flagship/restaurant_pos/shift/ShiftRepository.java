package com.flagship.restaurant_pos.shift;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ShiftRepository extends JpaRepository<Shift, UUID> {

    @Query("SELECT s FROM Shift s WHERE s.user.id = :userId AND s.endedAt IS NULL")
    Optional<Shift> findOpenByUserId(@Param("userId") UUID userId);

    List<Shift> findByUserIdOrderByStartedAtDesc(UUID userId);
}
