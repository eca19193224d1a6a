package com.energy.anomaly.model;

import com.energy.anomaly.exception.ConfigException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlgorithmTypeTest {

    @Test
    void fromId_canonicalIds_matchIgnoringCaseAndSeparators() {
        assertThat(AlgorithmType.fromId("isolation_forest")).isEqualTo(AlgorithmType.ISOLATION_FOREST);
        assertThat(AlgorithmType.fromId("Centroid-Distance")).isEqualTo(AlgorithmType.CENTROID_DISTANCE);
        assertThat(AlgorithmType.fromId(" RECONSTRUCTION ")).isEqualTo(AlgorithmType.RECONSTRUCTION);
    }

    @Test
    void fromId_aliases_resolve() {
        assertThat(AlgorithmType.fromId("autoencoder")).isEqualTo(AlgorithmType.RECONSTRUCTION);
        assertThat(AlgorithmType.fromId("kmeans")).isEqualTo(AlgorithmType.CENTROID_DISTANCE);
        assertThat(AlgorithmType.fromId("DBSCAN")).isEqualTo(AlgorithmType.DENSITY);
    }

    @Test
    void fromId_unknown_throwsConfigException() {
        assertThatThrownBy(() -> AlgorithmType.fromId("one_class_svm"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("one_class_svm");
        assertThatThrownBy(() -> AlgorithmType.fromId(" ")).isInstanceOf(ConfigException.class);
    }
}
