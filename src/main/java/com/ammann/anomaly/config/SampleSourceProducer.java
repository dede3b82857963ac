/* (C)2026 */
package com.ammann.anomaly.config;

import com.ammann.anomaly.source.SampleSource;
import com.ammann.anomaly.source.SyntheticSampleSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import java.time.Clock;
import java.util.Optional;
import java.util.Random;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer for the {@link SampleSource} feeding the synthetic stream.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>anomaly.synthetic.normal-mu</li>
 *   <li>anomaly.synthetic.normal-sigma</li>
 *   <li>anomaly.synthetic.seasonal-amplitude</li>
 *   <li>anomaly.synthetic.noise-sigma</li>
 *   <li>anomaly.synthetic.seed (optional, for reproducible runs)</li>
 * </ul>
 */
@ApplicationScoped
public class SampleSourceProducer {

    private static final Logger LOG = Logger.getLogger(SampleSourceProducer.class);

    @ConfigProperty(name = "anomaly.synthetic.normal-mu", defaultValue = "10.0")
    double normalMu;

    @ConfigProperty(name = "anomaly.synthetic.normal-sigma", defaultValue = "2.0")
    double normalSigma;

    @ConfigProperty(name = "anomaly.synthetic.seasonal-amplitude", defaultValue = "4.0")
    double seasonalAmplitude;

    @ConfigProperty(name = "anomaly.synthetic.noise-sigma", defaultValue = "0.5")
    double noiseSigma;

    @ConfigProperty(name = "anomaly.synthetic.seed")
    Optional<Long> seed;

    /**
     * Produces the synthetic source from configuration.
     *
     * @return configured synthetic source
     */
    @Produces
    @ApplicationScoped
    public SampleSource createSampleSource() {
        Random random = seed.map(Random::new).orElseGet(Random::new);
        LOG.infof(
                "Synthetic source: mu=%.2f, sigma=%.2f, amplitude=%.2f, noise=%.2f, seeded=%b",
                normalMu, normalSigma, seasonalAmplitude, noiseSigma, seed.isPresent());
        return new SyntheticSampleSource(
                normalMu, normalSigma, seasonalAmplitude, noiseSigma, random, Clock.systemUTC());
    }
}
