package com.backtester.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Engine-wide settings that do not belong to an individual strategy.
 *
 * <p>Bound from {@code backtester.engine.*} in application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "backtester.engine")
public class EngineProperties {

    /** Progress listeners are notified every this many simulated trading days. */
    private int progressIntervalDays = 20;

    /** Whether the result carries a per-day snapshot of all positions. */
    private boolean recordPositionsHistory = true;
}
