package com.energy.anomaly.engine;

import com.energy.anomaly.config.DetectionProperties;
import com.energy.anomaly.engine.reconstruction.TrainingMonitor;
import com.energy.anomaly.exception.AlgorithmException;
import com.energy.anomaly.exception.ConfigException;
import com.energy.anomaly.exception.DataException;
import com.energy.anomaly.model.AlgorithmType;
import com.energy.anomaly.model.AnomalyRecord;
import com.energy.anomaly.model.Dataset;
import com.energy.anomaly.model.DetectionConfig;
import com.energy.anomaly.model.DetectionRun;
import com.energy.anomaly.model.ExecutionPath;
import com.energy.anomaly.model.params.AlgorithmParams;
import com.energy.anomaly.model.params.CentroidDistanceParams;
import com.energy.anomaly.model.params.DensityParams;
import com.energy.anomaly.model.params.IsolationForestParams;
import com.energy.anomaly.model.params.ReconstructionParams;
import com.energy.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DetectionEngineTest {

    private DetectionEngine engine;
    private Dataset dataset;

    @BeforeEach
    void setUp() {
        engine = TestDataFactory.detectionEngine();
        dataset = TestDataFactory.energyDataset();
    }

    @Test
    void run_isolationForest_contaminationTwoPercent_flagsAboutTwentyRows() {
        DetectionConfig config = DetectionConfig.builder()
                .params(new IsolationForestParams(100, 0.02, 256))
                .build();

        DetectionRun run = engine.run(dataset, config);

        assertThat(run.getSummary().getAnomalyCount()).isBetween(15, 25);
        assertThat(run.getThresholdPercentile()).isCloseTo(98.0, within(1e-9));
        assertThat(run.getExecutionPath()).isEqualTo(ExecutionPath.DIRECT);
    }

    @Test
    void run_centroidDistance_flagsAllInjectedRowsAtNinetyFifthPercentile() {
        DetectionConfig config = DetectionConfig.builder()
                .params(new CentroidDistanceParams(5, 300, 0.05))
                .thresholdPercentile(95.0)
                .build();

        DetectionRun run = engine.run(dataset, config);

        Set<Integer> flagged = run.getAnomalies().stream()
                .map(AnomalyRecord::getRowIndex)
                .collect(Collectors.toSet());
        assertThat(flagged).hasSizeBetween(40, 60);
        assertThat(flagged).containsAll(TestDataFactory.injectedRows());
    }

    @Test
    void run_density_flagsInjectedRowsAsNoise() {
        DetectionConfig config = DetectionConfig.builder()
                .params(new DensityParams(0.5, 25))
                .build();

        DetectionRun run = engine.run(dataset, config);

        Set<Integer> flagged = run.getAnomalies().stream()
                .map(AnomalyRecord::getRowIndex)
                .collect(Collectors.toSet());
        assertThat(flagged).containsAll(TestDataFactory.injectedRows());
        assertThat(run.getAnomalies()).allMatch(r -> r.getScore() == 1.0);
    }

    @Test
    void run_unparseableTimestampOnTypicalRow_failsBeforeScoring() {
        Dataset broken = TestDataFactory.withCell(dataset, 0, "timestamp", "not-a-date");
        DetectionConfig config = DetectionConfig.builder()
                .params(new IsolationForestParams(100, 0.02, 256))
                .build();

        assertThatThrownBy(() -> engine.run(broken, config))
                .isInstanceOf(DataException.class)
                .hasMessageContaining("row 0");
    }

    @Test
    void run_unparseableTimestampOnSpikeRow_failsTheSameWay() {
        Dataset broken = TestDataFactory.withCell(dataset, 25, "timestamp", "not-a-date");
        DetectionConfig config = DetectionConfig.builder()
                .params(new IsolationForestParams(100, 0.02, 256))
                .build();

        assertThatThrownBy(() -> engine.run(broken, config))
                .isInstanceOf(DataException.class)
                .hasMessageContaining("row 25");
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void run_everyAlgorithm_scoresEveryRowAndIsDeterministic(AlgorithmType algorithm) {
        DetectionConfig config = DetectionConfig.builder()
                .params(fastParams(algorithm))
                .seed(17L)
                .build();

        DetectionRun first = engine.run(dataset, config);
        DetectionRun second = engine.run(dataset, config);

        assertThat(first.getScores()).hasSize(dataset.rowCount());
        assertThat(second.getScores()).isEqualTo(first.getScores());
        assertThat(second.getAnomalies()).extracting(AnomalyRecord::getRowIndex)
                .containsExactlyElementsOf(first.getAnomalies().stream().map(AnomalyRecord::getRowIndex).toList());
        assertThat(first.getSummary().getAnomalyCount()).isEqualTo(first.getAnomalies().size());
        assertThat(first.getConfig().getAlgorithm()).isEqualTo(algorithm);
    }

    @Test
    void run_anomalyIndicesAreUniqueAndInRange() {
        DetectionRun run = engine.run(dataset, DetectionConfig.builder()
                .params(new IsolationForestParams(50, 0.05, 128)).build());

        List<Integer> indices = run.getAnomalies().stream().map(AnomalyRecord::getRowIndex).toList();
        assertThat(indices).doesNotHaveDuplicates();
        assertThat(indices).allMatch(i -> i >= 0 && i < dataset.rowCount());
    }

    @Test
    void run_anomaliesAreStrictlyAboveThreshold() {
        DetectionRun run = engine.run(dataset, DetectionConfig.builder()
                .params(new CentroidDistanceParams(4, 300, 0.05)).thresholdPercentile(90.0).build());

        assertThat(run.getAnomalies()).allMatch(r -> r.getScore() > run.getThreshold());
        long aboveInScores = run.getScores().stream().filter(s -> s > run.getThreshold()).count();
        assertThat(run.getAnomalies()).hasSize((int) aboveInScores);
    }

    @Test
    void run_recordsCarryTimestampsAndFeatureSnapshot() {
        DetectionRun run = engine.run(dataset, DetectionConfig.builder()
                .params(new DensityParams(0.5, 25)).build());

        AnomalyRecord record = run.getAnomalies().get(0);
        assertThat(record.getTimestamp()).isNotNull();
        assertThat(record.getFeatures()).containsOnlyKeys("consumption", "temperature");
        assertThat(run.getTimestampColumn()).isEqualTo("timestamp");
    }

    @Test
    void run_withoutParams_usesConfiguredDefaults() {
        DetectionRun run = engine.run(dataset, DetectionConfig.builder()
                .algorithm(AlgorithmType.CENTROID_DISTANCE).build());

        assertThat(run.getConfig().getParams()).isEqualTo(new CentroidDistanceParams(5, 300, 0.05));
        assertThat(run.getThresholdPercentile()).isEqualTo(95.0);
        assertThat(run.getConfig().getSeed()).isEqualTo(42L);
    }

    @Test
    void run_reconstructionWithCancelledMonitor_reportsFallbackPath() {
        TrainingMonitor monitor = TrainingMonitor.unbounded();
        monitor.cancel();

        DetectionRun run = engine.run(dataset, DetectionConfig.builder()
                .params(fastParams(AlgorithmType.RECONSTRUCTION)).build(), monitor);

        assertThat(run.getExecutionPath()).isEqualTo(ExecutionPath.CLOSED_FORM_FALLBACK);
        assertThat(run.getModelDetails())
                .containsEntry("executionPath", "CLOSED_FORM_FALLBACK")
                .containsKey("fallbackReason");
    }

    @Test
    void run_invalidPercentile_throwsConfigExceptionBeforeScoring() {
        DetectionConfig config = DetectionConfig.builder()
                .params(new IsolationForestParams(10, 0.05, 64))
                .thresholdPercentile(100.0)
                .build();

        assertThatThrownBy(() -> engine.run(dataset, config)).isInstanceOf(ConfigException.class);
    }

    @Test
    void run_tooFewRows_throwsDataException() {
        DetectionConfig config = DetectionConfig.builder()
                .params(new IsolationForestParams(10, 0.05, 64))
                .build();

        assertThatThrownBy(() -> engine.run(TestDataFactory.sequentialDataset(8), config))
                .isInstanceOf(DataException.class);
    }

    @Test
    void run_paramsForOtherAlgorithm_throwsConfigException() {
        DetectionConfig config = DetectionConfig.builder()
                .algorithm(AlgorithmType.DENSITY)
                .params(new IsolationForestParams(10, 0.05, 64))
                .build();

        assertThatThrownBy(() -> engine.run(dataset, config)).isInstanceOf(ConfigException.class);
    }

    @Test
    void run_noAlgorithm_throwsConfigException() {
        assertThatThrownBy(() -> engine.run(dataset, DetectionConfig.builder().build()))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void run_reconstructionOnSingleFeature_propagatesAlgorithmException() {
        DetectionConfig config = DetectionConfig.builder()
                .params(fastParams(AlgorithmType.RECONSTRUCTION))
                .featureColumns(List.of("consumption"))
                .build();

        assertThatThrownBy(() -> engine.run(dataset, config)).isInstanceOf(AlgorithmException.class);
    }

    @Test
    void run_customMinRows_isHonoured() {
        DetectionProperties properties = new DetectionProperties();
        properties.setMinRows(20);
        DetectionEngine strict = TestDataFactory.detectionEngine(properties);

        assertThatThrownBy(() -> strict.run(TestDataFactory.sequentialDataset(15),
                DetectionConfig.builder().algorithm(AlgorithmType.ISOLATION_FOREST).build()))
                .isInstanceOf(DataException.class);
    }

    private static AlgorithmParams fastParams(AlgorithmType algorithm) {
        return switch (algorithm) {
            case ISOLATION_FOREST -> new IsolationForestParams(50, 0.05, 128);
            case RECONSTRUCTION -> new ReconstructionParams(1, 5, 64, 0.01, Duration.ofMinutes(5));
            case CENTROID_DISTANCE -> new CentroidDistanceParams(3, 300, 0.05);
            case DENSITY -> new DensityParams(0.5, 10);
        };
    }
}
