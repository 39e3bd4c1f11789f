package com.flagship.restaurant_pos.access;

import com.flagship.restaurant_pos.exception.StateConflictException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * Staff member operating a terminal.
 *
 * Role is fixed at creation. The bound device id is write-once: the first
 * verified request binds it and only an administrative override outside this
 * service may clear it.
 */
@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class User {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, updatable = false, length = 150)
    private String username;

    @Column(name = "full_name", length = 200)
    private String fullName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private Role role;

    @Column(name = "device_id", length = 100)
    private String deviceId;

    @Column(name = "pin_code", length = 6)
    private String pinCode;

    @Column(name = "active_shift", nullable = false)
    private boolean activeShift;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public static User create(String username, String fullName, Role role) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role is required");
        }
        return new User(UUID.randomUUID(), username, fullName, role, null, null, false, true, null);
    }

    public boolean hasRole(Role candidate) {
        return role == candidate;
    }

    public boolean isDeviceBound() {
        return deviceId != null;
    }

    /**
     * Stores the device id on first use. Rebinding is refused.
     */
    void bindDevice(String presentedDeviceId) {
        if (isDeviceBound()) {
            throw new StateConflictException("User " + username + " is already bound to a device");
        }
        this.deviceId = presentedDeviceId;
    }

    public void markShiftStarted() {
        this.activeShift = true;
    }

    public void markShiftEnded() {
        this.activeShift = false;
    }
}
