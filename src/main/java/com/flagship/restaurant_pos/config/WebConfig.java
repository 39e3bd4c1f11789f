package com.flagship.restaurant_pos.config;

import com.flagship.restaurant_pos.access.DeviceBindingInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Every terminal call under {@code /api} passes device binding first.
 * {@code /health} and {@code /actuator} stay open for health checks.
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final DeviceBindingInterceptor deviceBindingInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(deviceBindingInterceptor).addPathPatterns("/api/**");
    }
}
