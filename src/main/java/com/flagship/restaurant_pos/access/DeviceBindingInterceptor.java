package com.flagship.restaurant_pos.access;

import com.flagship.restaurant_pos.exception.AccessDeniedException;
import com.flagship.restaurant_pos.observability.CorrelationContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Resolves the acting user and terminal from request headers, runs device
 * binding and exposes the result as the {@link ActorContext} request attribute.
 *
 * Session handling and login live outside this service; the gateway in front
 * of it forwards the authenticated user id in {@value #USER_HEADER}.
 */
@Component
@RequiredArgsConstructor
public class DeviceBindingInterceptor implements HandlerInterceptor {

    public static final String USER_HEADER = "X-User-Id";
    public static final String DEVICE_HEADER = "X-Device-Id";
    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private final DeviceBindingService deviceBindingService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        UUID userId = parseUserId(request.getHeader(USER_HEADER));
        String deviceId = request.getHeader(DEVICE_HEADER);
        String ipAddress = clientAddress(request);

        deviceBindingService.bindOrVerify(userId, deviceId, ipAddress);

        request.setAttribute(ActorContext.REQUEST_ATTRIBUTE, ActorContext.of(userId, deviceId, ipAddress));
        if (deviceId != null) {
            MDC.put(CorrelationContext.DEVICE_ID_MDC_KEY, deviceId);
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        MDC.remove(CorrelationContext.DEVICE_ID_MDC_KEY);
    }

    private UUID parseUserId(String header) {
        if (header == null || header.isBlank()) {
            throw new AccessDeniedException(AccessDeniedException.Reason.UNAUTHENTICATED, "Missing " + USER_HEADER);
        }
        try {
            return UUID.fromString(header.trim());
        } catch (IllegalArgumentException e) {
            throw new AccessDeniedException(AccessDeniedException.Reason.UNAUTHENTICATED, "Malformed " + USER_HEADER);
        }
    }

    private String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
