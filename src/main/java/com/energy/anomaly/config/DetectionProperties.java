package com.energy.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionProperties {

    // Percentile used when a run names none (Isolation Forest derives its own from contamination)
    private double defaultThresholdPercentile = 95.0;

    // Percentile statistics are unreliable below this many rows.
    private int minRows = 10;

    private long defaultSeed = 42L;

    // Zone for hour-of-day / day-of-week features derived from timestamps.
    private String timeZone = "UTC";

    private IsolationForest isolationForest = new IsolationForest();

    private Reconstruction reconstruction = new Reconstruction();

    private CentroidDistance centroidDistance = new CentroidDistance();

    private Density density = new Density();

    private Async async = new Async();

    @Data
    public static class IsolationForest {
        private int estimators = 100;
        private double contamination = 0.05;
        private int maxSamples = 256;
    }

    @Data
    public static class Reconstruction {
        private int embeddingSize = 2;
        private int epochs = 50;
        private int batchSize = 32;
        private double learningRate = 0.005;
        private Duration trainingTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class CentroidDistance {
        private int clusters = 5;
        private int maxIterations = 300;
        private double minClusterFraction = 0.05;
    }

    @Data
    public static class Density {
        private double radius = 0.5;
        private int minSamples = 5;
    }

    @Data
    public static class Async {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
    }
}
