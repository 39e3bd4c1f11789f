package com.flagship.restaurant_pos.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Configuration
@Slf4j
public class PosConfig {

    /**
     * Zone that decides which business day a document number belongs to.
     * Defaults to the server's zone.
     */
    @Bean
    public ZoneId businessZone(@Value("${pos.zone:}") String zone) {
        ZoneId resolved = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        log.info("Business zone: {}", resolved);
        return resolved;
    }
}
