package com.flagship.restaurant_pos.audit;

import com.flagship.restaurant_pos.access.ActorContext;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditTrailService auditTrailService;

    @GetMapping
    public List<AuditLog> recent(@RequestParam(name = "action_type", required = false) String actionType,
                                 @RequestParam(name = "user_id", required = false) UUID userId,
                                 @RequestParam(name = "limit", defaultValue = "50") int limit,
                                 @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        AuditActionType type = actionType != null && !actionType.isBlank() ? AuditActionType.fromCode(actionType) : null;
        return auditTrailService.recent(type, userId, limit, actor);
    }

    @PostMapping("/purge")
    public Map<String, Object> purge(@RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return Map.of("removed", auditTrailService.purgeExpired(actor));
    }
}
