package com.positionkeeper.config;

import com.positionkeeper.domain.model.LifecycleSettings;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link LifecycleSettings} bean from application.properties.
 *
 * <p>Properties prefixes: {@code positionkeeper.lifecycle.*} and {@code positionkeeper.expiry.*}
 */
@Configuration
public class LifecycleConfig {

    @Bean
    public LifecycleSettings lifecycleSettings(
            @Value("${positionkeeper.lifecycle.break-even-buffer:0.0005}") BigDecimal breakEvenBuffer,
            @Value("${positionkeeper.lifecycle.trailing-distance:0.01}") BigDecimal trailingDistance,
            @Value("${positionkeeper.lifecycle.tick-size:0.1}") BigDecimal tickSize,
            @Value("${positionkeeper.lifecycle.order-expiry-seconds:86400}") long orderExpirySeconds,
            @Value("${positionkeeper.expiry.max-position-age-hours:4}") int maxPositionAgeHours,
            @Value("${positionkeeper.expiry.warning-before-minutes:30}") int warningBeforeExpiryMinutes,
            @Value("${positionkeeper.expiry.force-close-before-minutes:5}") int forceCloseBeforeExpiryMinutes,
            @Value("${positionkeeper.expiry.force-close-enabled:true}") boolean forceCloseEnabled,
            @Value("${positionkeeper.expiry.flatten-on-force-close:false}") boolean flattenOnForceClose,
            @Value("${positionkeeper.expiry.retention-hours:24}") int trackingRetentionHours) {
        return LifecycleSettings.builder()
                .breakEvenBuffer(breakEvenBuffer)
                .trailingDistance(trailingDistance)
                .tickSize(tickSize)
                .orderExpirySeconds(orderExpirySeconds)
                .maxPositionAgeHours(maxPositionAgeHours)
                .warningBeforeExpiryMinutes(warningBeforeExpiryMinutes)
                .forceCloseBeforeExpiryMinutes(forceCloseBeforeExpiryMinutes)
                .forceCloseEnabled(forceCloseEnabled)
                .flattenOnForceClose(flattenOnForceClose)
                .trackingRetentionHours(trackingRetentionHours)
                .build();
    }
}
