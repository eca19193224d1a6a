package com.energy.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String algorithm, String outcome, long durationMs) {
        Counter.builder("detection.run.count")
                .tag("algorithm", algorithm)
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("detection.run.duration")
                .tag("algorithm", algorithm)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordAnomalies(String algorithm, int anomalyCount) {
        DistributionSummary.builder("detection.anomaly.count")
                .tag("algorithm", algorithm)
                .register(registry)
                .record(anomalyCount);
    }

    public void recordReconstructionFallback() {
        Counter.builder("detection.reconstruction.fallback.count")
                .register(registry)
                .increment();
    }
}
