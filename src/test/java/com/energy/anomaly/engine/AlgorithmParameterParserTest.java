package com.energy.anomaly.engine;

import com.energy.anomaly.config.DetectionProperties;
import com.energy.anomaly.exception.ConfigException;
import com.energy.anomaly.model.AlgorithmType;
import com.energy.anomaly.model.params.AlgorithmParams;
import com.energy.anomaly.model.params.CentroidDistanceParams;
import com.energy.anomaly.model.params.DensityParams;
import com.energy.anomaly.model.params.IsolationForestParams;
import com.energy.anomaly.model.params.ReconstructionParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlgorithmParameterParserTest {

    private AlgorithmParameterParser parser;

    @BeforeEach
    void setUp() {
        DetectionProperties properties = new DetectionProperties();
        properties.getIsolationForest().setEstimators(150);
        parser = new AlgorithmParameterParser(properties);
    }

    @Test
    void parse_emptyMap_usesConfiguredDefaults() {
        AlgorithmParams params = parser.parse(AlgorithmType.ISOLATION_FOREST, Map.of());

        assertThat(params).isEqualTo(new IsolationForestParams(150, 0.05, 256));
    }

    @Test
    void parse_nullMap_usesConfiguredDefaults() {
        assertThat(parser.parse(AlgorithmType.DENSITY, null)).isEqualTo(new DensityParams(0.5, 5));
    }

    @Test
    void parse_snakeCaseAliases_areAccepted() {
        AlgorithmParams params = parser.parse(AlgorithmType.ISOLATION_FOREST,
                Map.of("n_estimators", 200, "contamination", "0.02"));

        assertThat(params).isEqualTo(new IsolationForestParams(200, 0.02, 256));
    }

    @Test
    void parse_densityEpsAlias_mapsToRadius() {
        AlgorithmParams params = parser.parse(AlgorithmType.DENSITY, Map.of("eps", 0.8, "min_samples", 12));

        assertThat(params).isEqualTo(new DensityParams(0.8, 12));
    }

    @Test
    void parse_centroidDistance_acceptsK() {
        AlgorithmParams params = parser.parse(AlgorithmType.CENTROID_DISTANCE, Map.of("k", 7));

        assertThat(params).isEqualTo(new CentroidDistanceParams(7, 300, 0.05));
    }

    @Test
    void parse_reconstructionTimeout_acceptsSecondsAndIsoDurations() {
        ReconstructionParams seconds = (ReconstructionParams) parser.parse(AlgorithmType.RECONSTRUCTION,
                Map.of("trainingTimeout", 2.5, "encoding_dim", 3));
        ReconstructionParams iso = (ReconstructionParams) parser.parse(AlgorithmType.RECONSTRUCTION,
                Map.of("training-timeout", "PT1M"));

        assertThat(seconds.trainingTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(seconds.embeddingSize()).isEqualTo(3);
        assertThat(iso.trainingTimeout()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void parse_unknownKey_throwsConfigException() {
        assertThatThrownBy(() -> parser.parse(AlgorithmType.DENSITY, Map.of("clusters", 3)))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("clusters");
    }

    @Test
    void parse_nonNumericValue_throwsConfigException() {
        assertThatThrownBy(() -> parser.parse(AlgorithmType.ISOLATION_FOREST, Map.of("estimators", "many")))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void parse_fractionalCount_throwsConfigException() {
        assertThatThrownBy(() -> parser.parse(AlgorithmType.CENTROID_DISTANCE, Map.of("clusters", 2.5)))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void parse_outOfRangeValues_throwConfigException() {
        assertThatThrownBy(() -> parser.parse(AlgorithmType.CENTROID_DISTANCE, Map.of("clusters", 1)))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> parser.parse(AlgorithmType.ISOLATION_FOREST, Map.of("contamination", 0.7)))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> parser.parse(AlgorithmType.DENSITY, Map.of("radius", -1)))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> parser.parse(AlgorithmType.RECONSTRUCTION, Map.of("epochs", 0)))
                .isInstanceOf(ConfigException.class);
    }
}
