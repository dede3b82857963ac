/* (C)2026 */
package com.ammann.anomaly.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.anomaly.enumeration.TickVerdict;
import com.ammann.anomaly.model.AnomalyRecord;
import com.ammann.anomaly.model.TickResult;
import com.ammann.anomaly.model.WindowStatistic;
import java.util.List;
import org.junit.jupiter.api.Test;

class TickResultDTOTest {

    @Test
    void warmUpTickHasNoStatistic() {
        TickResultDTO dto = TickResultDTO.from(new TickResult(0, 4.0, null, false));

        assertThat(dto.statistic()).isNull();
        assertThat(dto.verdict()).isEqualTo(TickVerdict.WARMING_UP);
    }

    @Test
    void copiesStatisticAndVerdict() {
        TickResultDTO dto =
                TickResultDTO.from(new TickResult(7, 50.0, new WindowStatistic(23.3, 18.8), true));

        assertThat(dto.tick()).isEqualTo(7);
        assertThat(dto.sample()).isEqualTo(50.0);
        assertThat(dto.statistic()).isEqualTo(new WindowStatisticDTO(23.3, 18.8));
        assertThat(dto.anomaly()).isTrue();
        assertThat(dto.verdict()).isEqualTo(TickVerdict.ANOMALOUS);
    }

    @Test
    void anomalyLogKeepsOrderAndCount() {
        AnomalyLogResponseDTO log = AnomalyLogResponseDTO.of(
                "s", List.of(new AnomalyRecord(3, 50.0), new AnomalyRecord(9, -2.0)));

        assertThat(log.count()).isEqualTo(2);
        assertThat(log.anomalies())
                .containsExactly(new AnomalyRecordDTO(3, 50.0), new AnomalyRecordDTO(9, -2.0));
    }
}
