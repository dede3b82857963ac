/* (C)2026 */
package com.ammann.anomaly.service;

import static org.assertj.core.api.Assertions.*;

import com.ammann.anomaly.detection.StreamDetector;
import com.ammann.anomaly.exception.InvalidConfigException;
import com.ammann.anomaly.exception.InvalidInputException;
import com.ammann.anomaly.exception.ValidationException;
import com.ammann.anomaly.model.AnomalyRecord;
import com.ammann.anomaly.model.DetectorConfig;
import com.ammann.anomaly.model.TickResult;
import com.ammann.anomaly.model.WindowStatistic;
import com.ammann.anomaly.service.StreamRegistryService.BatchResult;
import com.ammann.anomaly.service.StreamRegistryService.StreamSnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.ws.rs.NotFoundException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StreamRegistryServiceTest {

    private StreamRegistryService service;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new StreamRegistryService();
        service.defaultWindowSize = 3;
        service.defaultThreshold = 1.2;
        service.meterRegistry = meterRegistry;
        service.init();
    }

    @Test
    void ingestRunsSamplesThroughStreamPipeline() {
        service.create("cpu", DetectorConfig.defaults());

        service.ingest("cpu", 10);
        service.ingest("cpu", 10);
        service.ingest("cpu", 10);
        TickResult spike = service.ingest("cpu", 50);

        assertThat(spike.anomaly()).isTrue();
        assertThat(service.anomalies("cpu")).containsExactly(new AnomalyRecord(3, 50.0));
        assertThat(meterRegistry.counter("samples_ingested_total").count()).isEqualTo(4.0);
        assertThat(meterRegistry.counter("anomalies_detected_total").count()).isEqualTo(1.0);
    }

    @Test
    void streamsAreIndependent() {
        service.create("a", DetectorConfig.defaults());
        service.create("b", new DetectorConfig(2, 1.2));

        service.ingest("a", 1.0);
        service.ingest("a", 2.0);
        service.ingest("a", 3.0);
        service.ingest("b", 100.0);

        assertThat(service.statistic("a")).contains(new WindowStatistic(2.0, Math.sqrt(2.0 / 3)));
        assertThat(service.statistic("b")).isEmpty();
        assertThat(service.snapshot("b").samplesSeen()).isEqualTo(1);
    }

    @Test
    void batchIngestReportsRejectionsAndKeepsGoing() {
        service.create("s", DetectorConfig.defaults());

        BatchResult batch = service.ingestAll(
                "s", Arrays.asList(10.0, Double.NaN, 10.0, null, 10.0, 50.0));

        assertThat(batch.results()).extracting(TickResult::tick).containsExactly(0L, 1L, 2L, 3L);
        assertThat(batch.rejections())
                .extracting(StreamRegistryService.Rejection::index)
                .containsExactly(1, 3);
        assertThat(batch.anomalyCount()).isEqualTo(1);
        assertThat(service.anomalies("s")).containsExactly(new AnomalyRecord(3, 50.0));
        assertThat(meterRegistry.counter("samples_rejected_total").count()).isEqualTo(2.0);
    }

    @Test
    void singleIngestSurfacesRejection() {
        service.create("s", DetectorConfig.defaults());
        service.ingest("s", 1.0);

        assertThatThrownBy(() -> service.ingest("s", Double.POSITIVE_INFINITY))
                .isInstanceOf(InvalidInputException.class);

        assertThat(service.snapshot("s").samplesSeen()).isEqualTo(1);
    }

    @Test
    void unknownStreamIsNotFound() {
        assertThatThrownBy(() -> service.ingest("missing", 1.0)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.anomalies("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.reset("missing")).isInstanceOf(NotFoundException.class);
        assertThat(service.delete("missing")).isFalse();
    }

    @Test
    void duplicateOrBlankIdsAreRejected() {
        service.create("dup", DetectorConfig.defaults());

        assertThatThrownBy(() -> service.create("dup", DetectorConfig.defaults()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("already exists");
        assertThatThrownBy(() -> service.create(" ", DetectorConfig.defaults()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.getOrCreate(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void getOrCreateUsesDefaultsAndReturnsExistingStream() {
        var first = service.getOrCreate("auto");
        var second = service.getOrCreate("auto");

        assertThat(second).isSameAs(first);
        assertThat(first.config()).isEqualTo(new DetectorConfig(3, 1.2));
    }

    @Test
    void invalidDefaultsFailOnStartup() {
        StreamRegistryService misconfigured = new StreamRegistryService();
        misconfigured.defaultWindowSize = 1;
        misconfigured.defaultThreshold = 1.2;

        assertThatThrownBy(misconfigured::init).isInstanceOf(InvalidConfigException.class);
    }

    @Test
    void resetDiscardsStateButKeepsConfiguration() {
        service.create("r", new DetectorConfig(2, 0.5));
        service.ingestAll("r", List.of(1.0, 1.0, 9.0));
        assertThat(service.anomalies("r")).isNotEmpty();

        service.reset("r");

        StreamSnapshot snapshot = service.snapshot("r");
        assertThat(snapshot.samplesSeen()).isZero();
        assertThat(snapshot.warmingUp()).isTrue();
        assertThat(snapshot.anomalyCount()).isZero();
        assertThat(snapshot.config()).isEqualTo(new DetectorConfig(2, 0.5));
    }

    @Test
    void resetClearsTheSameDetectorInstance() {
        StreamDetector detector = service.create("r", new DetectorConfig(2, 0.5));
        service.ingestAll("r", List.of(1.0, 1.0, 9.0));

        service.reset("r");
        detector.process(4.0);

        assertThat(service.getOrCreate("r")).isSameAs(detector);
        assertThat(service.snapshot("r").samplesSeen()).isEqualTo(1);
    }

    @Test
    void deleteRemovesStream() {
        service.create("x", DetectorConfig.defaults());
        service.create("a", DetectorConfig.defaults());

        assertThat(service.streamIds()).containsExactly("a", "x");
        assertThat(service.delete("x")).isTrue();
        assertThat(service.exists("x")).isFalse();
        assertThat(service.streamIds()).containsExactly("a");
    }

    @Test
    void concurrentIngestIntoOneStreamLosesNoSamples() throws Exception {
        service.create("shared", new DetectorConfig(5, 1.2));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new java.util.ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        service.ingest("shared", i % 10);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(service.snapshot("shared").samplesSeen()).isEqualTo(2_000);
    }

    @Test
    void worksWithoutMeterRegistry() {
        StreamRegistryService bare = new StreamRegistryService();
        bare.defaultWindowSize = 3;
        bare.defaultThreshold = 1.2;
        bare.init();
        bare.create("s", DetectorConfig.defaults());

        assertThatCode(() -> bare.ingestAll("s", Arrays.asList(1.0, null, 2.0)))
                .doesNotThrowAnyException();
    }
}
