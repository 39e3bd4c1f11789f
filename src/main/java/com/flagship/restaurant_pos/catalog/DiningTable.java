package com.flagship.restaurant_pos.catalog;

import com.flagship.restaurant_pos.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Physical table. {@code occupied} mirrors whether a non-terminal order sits on it
 * and is only toggled by the order lifecycle.
 */
@Entity
@Table(name = "dining_tables")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DiningTable {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 10)
    private String number;

    @Column(nullable = false)
    private int capacity;

    @Column(nullable = false)
    private boolean occupied;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public static DiningTable create(String number, int capacity) {
        if (number == null || number.isBlank()) {
            throw new ValidationException("Table number is required");
        }
        if (capacity <= 0) {
            throw new ValidationException("Table capacity must be positive");
        }
        return new DiningTable(UUID.randomUUID(), number, capacity, false, true, null);
    }

    public void occupy() {
        this.occupied = true;
    }

    public void release() {
        this.occupied = false;
    }
}
