/* (C)2026 */
package com.ammann.anomaly.health;

import static org.assertj.core.api.Assertions.assertThat;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LivenessCheck")
class LivenessCheckTest {

    @Test
    @DisplayName("should return UP status")
    void shouldReturnUpStatus() {
        LivenessCheck livenessCheck = new LivenessCheck();

        HealthCheckResponse response = livenessCheck.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getName()).isEqualTo("alive");
    }
}
