/* (C)2026 */
package com.ammann.anomaly.health;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness health check that unconditionally reports the application as alive.
 *
 * <p>A failure to respond indicates that the JVM is hung or the application
 * has entered an unrecoverable state.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.up("alive");
    }

}
