/* (C)2026 */
package com.ammann.anomaly.service;

import com.ammann.anomaly.exception.InvalidInputException;
import com.ammann.anomaly.model.TickResult;
import com.ammann.anomaly.source.SampleSource;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.Scheduled.ConcurrentExecution;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Live feed pulling one sample per interval from the {@link SampleSource} into a
 * registered stream.
 *
 * <p>Execution Flow:
 * <ol>
 *   <li>Pull the next sample from the source</li>
 *   <li>Push it through the stream's window and threshold rule</li>
 *   <li>Log the tick, and the anomaly if one was flagged</li>
 * </ol>
 *
 * <p>Overlapping runs are skipped ({@code ConcurrentExecution.SKIP}). A rejected sample
 * is logged and counted; the feed carries on with the next tick.
 */
@ApplicationScoped
public class SyntheticFeedService {

    private static final Logger LOG = Logger.getLogger(SyntheticFeedService.class);

    @ConfigProperty(name = "anomaly.synthetic.enabled", defaultValue = "false")
    boolean feedEnabled;

    @ConfigProperty(name = "anomaly.synthetic.stream-id", defaultValue = "synthetic")
    String streamId;

    @ConfigProperty(name = "anomaly.synthetic.stale-after", defaultValue = "PT30S")
    Duration staleAfter;

    @Inject SampleSource sampleSource;

    @Inject StreamRegistryService registry;

    private final AtomicLong ticksProcessed = new AtomicLong(0);
    private final AtomicLong samplesRejected = new AtomicLong(0);
    private final AtomicLong anomaliesFound = new AtomicLong(0);
    private volatile Instant lastTickTimestamp = null;
    private volatile Instant startedAt = null;

    @PostConstruct
    void init() {
        if (!feedEnabled) {
            LOG.info("Synthetic feed is disabled (anomaly.synthetic.enabled=false)");
            return;
        }
        registry.getOrCreate(streamId);
        startedAt = Instant.now();
        LOG.infof("Synthetic feed writing to stream '%s'", streamId);
    }

    @Scheduled(
            every = "${anomaly.synthetic.interval}",
            concurrentExecution = ConcurrentExecution.SKIP)
    public void feedTick() {
        if (!feedEnabled) {
            return;
        }

        if (!registry.exists(streamId)) {
            registry.getOrCreate(streamId);
            LOG.warnf("Synthetic stream '%s' was removed, re-registered it", streamId);
        }

        double sample = sampleSource.nextSample();
        try {
            TickResult result = registry.ingest(streamId, sample);
            ticksProcessed.incrementAndGet();
            lastTickTimestamp = Instant.now();

            if (result.anomaly()) {
                anomaliesFound.incrementAndGet();
                LOG.infof(
                        "Synthetic tick %d: %.4f ANOMALY (total anomalies: %d)",
                        result.tick(), sample, anomaliesFound.get());
            } else {
                LOG.debugf("Synthetic tick %d: %.4f", (Object) Long.valueOf(result.tick()), sample);
            }
        } catch (InvalidInputException e) {
            samplesRejected.incrementAndGet();
            LOG.warnf("Synthetic feed produced an unusable sample: %s", e.getMessage());
        } catch (NotFoundException e) {
            LOG.warnf("Synthetic stream '%s' removed during tick, sample dropped", streamId);
        }
    }

    /**
     * Whether the feed is enabled but has not ticked within the staleness window, counted
     * from the last tick or, before the first one, from startup.
     * Exposed for health checks.
     */
    public boolean isStalled() {
        if (!feedEnabled) {
            return false;
        }
        Instant last = lastTickTimestamp != null ? lastTickTimestamp : startedAt;
        return last != null && Duration.between(last, Instant.now()).compareTo(staleAfter) > 0;
    }

    public boolean isEnabled() {
        return feedEnabled;
    }

    public String getStreamId() {
        return streamId;
    }

    public long getTicksProcessed() {
        return ticksProcessed.get();
    }

    public long getSamplesRejected() {
        return samplesRejected.get();
    }

    public long getSamplesProduced() {
        return sampleSource.samplesProduced();
    }

    public long getAnomaliesFound() {
        return anomaliesFound.get();
    }

    /** Last successful tick timestamp, or null if nothing has been processed yet. */
    public Instant getLastTickTimestamp() {
        return lastTickTimestamp;
    }
}
