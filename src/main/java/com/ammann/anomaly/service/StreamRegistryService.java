/* (C)2026 */
package com.ammann.anomaly.service;

import com.ammann.anomaly.detection.StreamDetector;
import com.ammann.anomaly.exception.InvalidInputException;
import com.ammann.anomaly.exception.ValidationException;
import com.ammann.anomaly.model.AnomalyRecord;
import com.ammann.anomaly.model.DetectorConfig;
import com.ammann.anomaly.model.TickResult;
import com.ammann.anomaly.model.WindowStatistic;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Registry of named, independent sample streams.
 *
 * <p>Each stream owns its own {@link StreamDetector}; nothing mutable is shared between
 * streams. Calls against one stream are serialized on its detector, so different
 * streams are processed in parallel while a single stream always sees its samples
 * strictly in order.
 *
 * <p>Rejected samples are counted, logged and reported back to the caller; they never
 * reach the window.
 */
@ApplicationScoped
public class StreamRegistryService {

    private static final Logger LOG = Logger.getLogger(StreamRegistryService.class);

    @ConfigProperty(name = "anomaly.detector.window-size", defaultValue = "3")
    int defaultWindowSize;

    @ConfigProperty(name = "anomaly.detector.threshold", defaultValue = "1.2")
    double defaultThreshold;

    @Inject MeterRegistry meterRegistry;

    private final Map<String, StreamDetector> streams = new ConcurrentHashMap<>();

    private Counter samplesIngestedCounter;
    private Counter samplesRejectedCounter;
    private Counter anomaliesDetectedCounter;

    @PostConstruct
    void init() {
        // Throws InvalidConfigException on bad defaults.
        DetectorConfig defaults = defaultConfig();
        LOG.infof(
                "Stream registry ready (default windowSize=%d, threshold=%.3f)",
                defaults.windowSize(), defaults.threshold());
        initMetrics();
    }

    /**
     * Detector configuration applied to streams created without explicit parameters.
     */
    public DetectorConfig defaultConfig() {
        return new DetectorConfig(defaultWindowSize, defaultThreshold);
    }

    /**
     * Registers a new stream.
     *
     * @throws ValidationException if the id is blank or already registered
     */
    public StreamDetector create(String streamId, DetectorConfig config) {
        validateStreamId(streamId);
        StreamDetector detector = new StreamDetector(config);
        if (streams.putIfAbsent(streamId, detector) != null) {
            throw ValidationException.duplicateStream(streamId);
        }
        LOG.infof(
                "Created stream '%s' (windowSize=%d, threshold=%.3f)",
                streamId, config.windowSize(), config.threshold());
        return detector;
    }

    /**
     * Returns the stream, registering it with the default configuration if absent.
     */
    public StreamDetector getOrCreate(String streamId) {
        validateStreamId(streamId);
        return streams.computeIfAbsent(
                streamId,
                id -> {
                    LOG.infof("Created stream '%s' with default configuration", id);
                    return new StreamDetector(defaultConfig());
                });
    }

    /**
     * Pushes one sample through the stream's pipeline.
     *
     * @throws NotFoundException if the stream is unknown
     * @throws InvalidInputException if the sample is not finite; the stream is unaffected
     */
    public TickResult ingest(String streamId, double sample) {
        StreamDetector detector = require(streamId);
        synchronized (detector) {
            return processSample(streamId, detector, sample);
        }
    }

    /**
     * Pushes a batch of samples through the stream's pipeline in order.
     *
     * <p>Rejected samples (missing or non-finite) are reported by position and skipped;
     * the rest of the batch is processed as if they had never been sent.
     *
     * @throws NotFoundException if the stream is unknown
     */
    public BatchResult ingestAll(String streamId, List<Double> samples) {
        StreamDetector detector = require(streamId);
        List<TickResult> results = new ArrayList<>(samples.size());
        List<Rejection> rejections = new ArrayList<>();

        synchronized (detector) {
            for (int i = 0; i < samples.size(); i++) {
                Double sample = samples.get(i);
                try {
                    if (sample == null) {
                        incrementCounter(samplesRejectedCounter);
                        throw InvalidInputException.missing();
                    }
                    results.add(processSample(streamId, detector, sample));
                } catch (InvalidInputException e) {
                    rejections.add(new Rejection(i, e.getMessage()));
                }
            }
        }

        LOG.debugf(
                "Stream '%s' batch: %d accepted, %d rejected",
                streamId, results.size(), rejections.size());
        return new BatchResult(results, rejections);
    }

    private TickResult processSample(String streamId, StreamDetector detector, double sample) {
        TickResult result;
        try {
            result = detector.process(sample);
        } catch (InvalidInputException e) {
            incrementCounter(samplesRejectedCounter);
            LOG.warnf("Stream '%s' rejected sample %s", streamId, e.getRejectedValue());
            throw e;
        }

        incrementCounter(samplesIngestedCounter);
        if (result.anomaly()) {
            incrementCounter(anomaliesDetectedCounter);
            LOG.infof(
                    "Stream '%s' anomaly at tick %d: value=%.4f", streamId, result.tick(), result.sample());
        }
        return result;
    }

    public Optional<WindowStatistic> statistic(String streamId) {
        StreamDetector detector = require(streamId);
        synchronized (detector) {
            return detector.currentStatistic();
        }
    }

    public List<AnomalyRecord> anomalies(String streamId) {
        StreamDetector detector = require(streamId);
        synchronized (detector) {
            return detector.anomalies();
        }
    }

    /**
     * Consistent snapshot of one stream's state.
     */
    public StreamSnapshot snapshot(String streamId) {
        StreamDetector detector = require(streamId);
        synchronized (detector) {
            return new StreamSnapshot(
                    streamId,
                    detector.config(),
                    detector.samplesSeen(),
                    detector.currentStatistic().orElse(null),
                    detector.anomalyCount());
        }
    }

    /**
     * Reinitializes a stream with its existing configuration, discarding window and anomaly log.
     *
     * @throws NotFoundException if the stream is unknown
     */
    public void reset(String streamId) {
        StreamDetector detector = require(streamId);
        synchronized (detector) {
            detector.reset();
        }
        LOG.infof("Reset stream '%s'", streamId);
    }

    /**
     * Removes a stream.
     *
     * @return {@code true} if the stream existed
     */
    public boolean delete(String streamId) {
        boolean removed = streams.remove(streamId) != null;
        if (removed) {
            LOG.infof("Deleted stream '%s'", streamId);
        }
        return removed;
    }

    public List<String> streamIds() {
        return streams.keySet().stream().sorted().toList();
    }

    public boolean exists(String streamId) {
        return streamId != null && streams.containsKey(streamId);
    }

    private StreamDetector require(String streamId) {
        StreamDetector detector = streamId == null ? null : streams.get(streamId);
        if (detector == null) {
            throw new NotFoundException("Stream '" + streamId + "' not found");
        }
        return detector;
    }

    private void validateStreamId(String streamId) {
        if (streamId == null || streamId.isBlank()) {
            throw ValidationException.invalidParameter("id", streamId, "non-blank stream identifier");
        }
    }

    /**
     * Initialize Prometheus metrics.
     * Safe to call even if meterRegistry is null.
     */
    private void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - metrics disabled");
            return;
        }

        samplesIngestedCounter =
                Counter.builder("samples_ingested_total")
                        .description("Samples accepted into a stream window")
                        .register(meterRegistry);

        samplesRejectedCounter =
                Counter.builder("samples_rejected_total")
                        .description("Samples rejected as missing or non-finite")
                        .register(meterRegistry);

        anomaliesDetectedCounter =
                Counter.builder("anomalies_detected_total")
                        .description("Samples flagged as anomalous")
                        .register(meterRegistry);

        LOG.info("Stream registry metrics initialized");
    }

    private void incrementCounter(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }

    /**
     * Results of a batch ingest.
     *
     * @param results per-tick results of accepted samples, in arrival order
     * @param rejections refused samples, by position in the batch
     */
    public record BatchResult(List<TickResult> results, List<Rejection> rejections) {

        public int anomalyCount() {
            return (int) results.stream().filter(TickResult::anomaly).count();
        }
    }

    /**
     * A sample refused during a batch ingest.
     */
    public record Rejection(int index, String reason) {}

    /**
     * Point-in-time view of one stream.
     */
    public record StreamSnapshot(
            String streamId,
            DetectorConfig config,
            long samplesSeen,
            WindowStatistic statistic,
            int anomalyCount) {

        public boolean warmingUp() {
            return statistic == null;
        }
    }
}
