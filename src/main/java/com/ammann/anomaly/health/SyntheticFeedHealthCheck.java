/* (C)2026 */
package com.ammann.anomaly.health;

import com.ammann.anomaly.service.SyntheticFeedService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Health check for the synthetic sample feed.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: feed disabled, started, or ticking on schedule</li>
 *   <li>DOWN: feed enabled but no tick within the staleness window, including a feed
 *       that has not ticked since startup</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class SyntheticFeedHealthCheck implements HealthCheck {

    @Inject SyntheticFeedService feed;

    @Override
    public HealthCheckResponse call() {
        boolean enabled = feed.isEnabled();
        boolean stalled = feed.isStalled();
        long ticks = feed.getTicksProcessed();

        String status;
        if (!enabled) {
            status = "DISABLED";
        } else if (stalled) {
            status = "STALLED";
        } else {
            status = ticks > 0 ? "ACTIVE" : "INITIALIZED";
        }

        return HealthCheckResponse.named("synthetic-feed")
                .status(!stalled)
                .withData("enabled", enabled)
                .withData("ticks-processed", ticks)
                .withData("samples-produced", feed.getSamplesProduced())
                .withData("samples-rejected", feed.getSamplesRejected())
                .withData("anomalies-found", feed.getAnomaliesFound())
                .withData("status", status)
                .build();
    }
}
