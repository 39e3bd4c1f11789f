package com.flagship.restaurant_pos.access;

import com.flagship.restaurant_pos.exception.AccessDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Role check performed once at the entry of each core operation.
 *
 * <pre>
 *   User waiter = capabilities.requires(actor, Role.WAITER, Role.ADMIN);
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CapabilityGuard {

    private final UserRepository userRepository;

    /**
     * Loads the acting user and verifies the role.
     *
     * @throws AccessDeniedException if the user is unknown, inactive or holds none of the roles
     */
    public User requires(ActorContext actor, Role... allowed) {
        if (actor == null || actor.getUserId() == null) {
            throw new AccessDeniedException(AccessDeniedException.Reason.UNAUTHENTICATED, "No acting user");
        }
        User user = userRepository.findById(actor.getUserId())
                .filter(User::isActive)
                .orElseThrow(() -> new AccessDeniedException(
                        AccessDeniedException.Reason.UNAUTHENTICATED,
                        "Unknown or inactive user: " + actor.getUserId()));

        Set<Role> roles = allowed.length == 0 ? EnumSet.allOf(Role.class) : EnumSet.copyOf(Arrays.asList(allowed));
        if (!roles.contains(user.getRole())) {
            log.warn("Capability check failed: user={}, role={}, required={}", user.getUsername(), user.getRole(), roles);
            throw new AccessDeniedException(AccessDeniedException.Reason.ROLE,
                    "Role " + user.getRole() + " may not perform this operation");
        }
        return user;
    }
}
