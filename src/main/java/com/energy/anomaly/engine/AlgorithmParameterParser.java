package com.energy.anomaly.engine;

import com.energy.anomaly.config.DetectionProperties;
import com.energy.anomaly.exception.ConfigException;
import com.energy.anomaly.model.AlgorithmType;
import com.energy.anomaly.model.params.AlgorithmParams;
import com.energy.anomaly.model.params.CentroidDistanceParams;
import com.energy.anomaly.model.params.DensityParams;
import com.energy.anomaly.model.params.IsolationForestParams;
import com.energy.anomaly.model.params.ReconstructionParams;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates a loosely typed parameter map into the parameter object of one algorithm.
 *
 * Keys are matched ignoring case, underscores and dashes, so {@code n_estimators},
 * {@code nEstimators} and {@code estimators} are the same key. Missing keys take the
 * configured defaults.
 */
@Component
public class AlgorithmParameterParser {

    private static final Map<AlgorithmType, Map<String, String>> KEY_ALIASES = Map.of(
            AlgorithmType.ISOLATION_FOREST, Map.of(
                    "estimators", "estimators", "nestimators", "estimators",
                    "contamination", "contamination",
                    "maxsamples", "maxSamples"),
            AlgorithmType.RECONSTRUCTION, Map.of(
                    "embeddingsize", "embeddingSize", "encodingdim", "embeddingSize",
                    "epochs", "epochs",
                    "batchsize", "batchSize",
                    "learningrate", "learningRate",
                    "trainingtimeout", "trainingTimeout", "timeoutseconds", "trainingTimeout"),
            AlgorithmType.CENTROID_DISTANCE, Map.of(
                    "clusters", "clusters", "nclusters", "clusters", "k", "clusters",
                    "maxiterations", "maxIterations", "maxiter", "maxIterations",
                    "minclusterfraction", "minClusterFraction"),
            AlgorithmType.DENSITY, Map.of(
                    "radius", "radius", "eps", "radius",
                    "minsamples", "minSamples"));

    private final DetectionProperties properties;

    public AlgorithmParameterParser(DetectionProperties properties) {
        this.properties = properties;
    }

    public AlgorithmParams parse(AlgorithmType algorithm, Map<String, ?> raw) {
        Map<String, Object> values = canonicalize(algorithm, raw == null ? Map.of() : raw);
        return switch (algorithm) {
            case ISOLATION_FOREST -> {
                DetectionProperties.IsolationForest d = properties.getIsolationForest();
                yield new IsolationForestParams(
                        intValue(values, "estimators", d.getEstimators()),
                        doubleValue(values, "contamination", d.getContamination()),
                        intValue(values, "maxSamples", d.getMaxSamples()));
            }
            case RECONSTRUCTION -> {
                DetectionProperties.Reconstruction d = properties.getReconstruction();
                yield new ReconstructionParams(
                        intValue(values, "embeddingSize", d.getEmbeddingSize()),
                        intValue(values, "epochs", d.getEpochs()),
                        intValue(values, "batchSize", d.getBatchSize()),
                        doubleValue(values, "learningRate", d.getLearningRate()),
                        durationValue(values, "trainingTimeout", d.getTrainingTimeout()));
            }
            case CENTROID_DISTANCE -> {
                DetectionProperties.CentroidDistance d = properties.getCentroidDistance();
                yield new CentroidDistanceParams(
                        intValue(values, "clusters", d.getClusters()),
                        intValue(values, "maxIterations", d.getMaxIterations()),
                        doubleValue(values, "minClusterFraction", d.getMinClusterFraction()));
            }
            case DENSITY -> {
                DetectionProperties.Density d = properties.getDensity();
                yield new DensityParams(
                        doubleValue(values, "radius", d.getRadius()),
                        intValue(values, "minSamples", d.getMinSamples()));
            }
        };
    }

    /**
     * Parameters of the algorithm with nothing overridden.
     */
    public AlgorithmParams defaults(AlgorithmType algorithm) {
        return parse(algorithm, Map.of());
    }

    public Set<String> parameterNames(AlgorithmType algorithm) {
        return Set.copyOf(KEY_ALIASES.get(algorithm).values());
    }

    private static Map<String, Object> canonicalize(AlgorithmType algorithm, Map<String, ?> raw) {
        Map<String, String> aliases = KEY_ALIASES.get(algorithm);
        Map<String, Object> out = new HashMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String key = entry.getKey().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
            String canonical = aliases.get(key);
            if (canonical == null) {
                throw new ConfigException("Unknown parameter '" + entry.getKey() + "' for "
                        + algorithm.getDisplayName() + "; expected one of " + Set.copyOf(aliases.values()));
            }
            if (entry.getValue() != null) {
                out.put(canonical, entry.getValue());
            }
        }
        return out;
    }

    private static double doubleValue(Map<String, Object> values, String key, double fallback) {
        Object value = values.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("Parameter '" + key + "' must be numeric, got '" + value + "'", e);
        }
    }

    private static int intValue(Map<String, Object> values, String key, int fallback) {
        if (!values.containsKey(key)) {
            return fallback;
        }
        double v = doubleValue(values, key, fallback);
        if (v != Math.rint(v) || Math.abs(v) > Integer.MAX_VALUE) {
            throw new ConfigException("Parameter '" + key + "' must be a whole number, got " + values.get(key));
        }
        return (int) v;
    }

    /**
     * Numbers are seconds; strings may also be ISO-8601 durations such as {@code PT45S}.
     */
    private static Duration durationValue(Map<String, Object> values, String key, Duration fallback) {
        Object value = values.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Duration duration) {
            return duration;
        }
        String text = value.toString().trim();
        if (text.toUpperCase(Locale.ROOT).startsWith("PT")) {
            try {
                return Duration.parse(text);
            } catch (DateTimeParseException e) {
                throw new ConfigException("Parameter '" + key + "' is not a valid duration: '" + text + "'", e);
            }
        }
        double seconds = doubleValue(values, key, fallback.toMillis() / 1000.0);
        if (!Double.isFinite(seconds) || seconds > Long.MAX_VALUE / 1_000_000.0) {
            throw new ConfigException("Parameter '" + key + "' is out of range: " + value);
        }
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }
}
