/* (C)2026 */
package com.ammann.anomaly.enumeration;

import com.ammann.anomaly.model.TickResult;
import com.ammann.anomaly.model.WindowStatistic;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TickVerdictTest
{

    @Test
    void mapsTickResultsToVerdicts()
    {
        WindowStatistic statistic = new WindowStatistic(10.0, 1.0);

        assertThat(TickVerdict.of(new TickResult(0, 10.0, null, false))).isEqualTo(TickVerdict.WARMING_UP);
        assertThat(TickVerdict.of(new TickResult(5, 10.5, statistic, false))).isEqualTo(TickVerdict.NORMAL);
        assertThat(TickVerdict.of(new TickResult(6, 20.0, statistic, true))).isEqualTo(TickVerdict.ANOMALOUS);
    }
}
