package com.flagship.restaurant_pos.access;

import com.flagship.restaurant_pos.PosIntegrationTestSupport;
import com.flagship.restaurant_pos.audit.AuditActionType;
import com.flagship.restaurant_pos.audit.AuditLog;
import com.flagship.restaurant_pos.audit.AuditTrailService;
import com.flagship.restaurant_pos.exception.AccessDeniedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Device binding")
class DeviceBindingServiceTest extends PosIntegrationTestSupport {

    @Autowired
    private DeviceBindingService deviceBindingService;

    @Autowired
    private AuditTrailService auditTrail;

    @Test
    @DisplayName("First device is bound, later calls from it are verified")
    void testBindThenVerify() {
        printTestHeader("Bind and verify");

        // Given
        User waiter = createUser(Role.WAITER);
        printInput("User", waiter.getUsername());

        // When
        DeviceBindingService.Outcome first = deviceBindingService.bindOrVerify(waiter.getId(), "tablet-7", "10.0.0.7");
        DeviceBindingService.Outcome second = deviceBindingService.bindOrVerify(waiter.getId(), "tablet-7", "10.0.0.7");
        printOutput("Outcomes", first + ", " + second);

        // Then
        assertEquals(DeviceBindingService.Outcome.BOUND, first);
        assertEquals(DeviceBindingService.Outcome.VERIFIED, second);
        assertEquals("tablet-7", userRepository.findById(waiter.getId()).orElseThrow().getDeviceId());

        List<AuditLog> entries = auditTrail.forRecord("users", waiter.getId().toString());
        assertEquals(1, entries.size());
        assertEquals(AuditActionType.USER_ACTION, entries.get(0).getActionType());
        assertEquals("tablet-7", entries.get(0).getDeviceId());
        printSuccess("Device bound once and audited");
    }

    @Test
    @DisplayName("Another device is refused with a re-login request")
    void testMismatch() {
        printTestHeader("Device mismatch");

        User cashier = createUser(Role.CASHIER);
        deviceBindingService.bindOrVerify(cashier.getId(), "till-1", null);

        AccessDeniedException exception = assertThrows(AccessDeniedException.class,
                () -> deviceBindingService.bindOrVerify(cashier.getId(), "till-2", "10.0.0.9"));
        printExpectedException("AccessDeniedException", exception.getMessage());

        assertEquals(AccessDeniedException.Reason.DEVICE_MISMATCH, exception.getReason());
        assertTrue(exception.requiresReauthentication());
        assertEquals("till-1", userRepository.findById(cashier.getId()).orElseThrow().getDeviceId());
    }

    @Test
    @DisplayName("A missing device id is refused for bound roles")
    void testMissingDevice() {
        User kitchen = createUser(Role.KITCHEN);

        AccessDeniedException exception = assertThrows(AccessDeniedException.class,
                () -> deviceBindingService.bindOrVerify(kitchen.getId(), " ", null));
        assertEquals(AccessDeniedException.Reason.DEVICE_MISMATCH, exception.getReason());
    }

    @Test
    @DisplayName("Administrators may use any device")
    void testAdminExempt() {
        User admin = createUser(Role.ADMIN);

        assertEquals(DeviceBindingService.Outcome.EXEMPT, deviceBindingService.bindOrVerify(admin.getId(), "pc-1", null));
        assertEquals(DeviceBindingService.Outcome.EXEMPT, deviceBindingService.bindOrVerify(admin.getId(), "pc-2", null));
        assertNull(userRepository.findById(admin.getId()).orElseThrow().getDeviceId());
    }

    @Test
    @DisplayName("Unknown users are unauthenticated")
    void testUnknownUser() {
        AccessDeniedException exception = assertThrows(AccessDeniedException.class,
                () -> deviceBindingService.bindOrVerify(UUID.randomUUID(), "tablet-1", null));
        assertEquals(AccessDeniedException.Reason.UNAUTHENTICATED, exception.getReason());
    }
}
