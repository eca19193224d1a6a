package com.energy.anomaly.engine.reconstruction;

import com.energy.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.stream.DoubleStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutoencoderTest {

    private final double[][] data = TestDataFactory.energyMatrix().standardized().toArray();

    @Test
    void train_reducesLossBelowUntrainedNetwork() throws Exception {
        Autoencoder untrained = Autoencoder.build(data[0].length, 1, 0.01, 3L);
        double before = DoubleStream.of(untrained.reconstructionErrors(data)).average().orElseThrow();

        Autoencoder model = Autoencoder.build(data[0].length, 1, 0.01, 3L);
        double loss = model.train(data, 10, 32, 3L, TrainingMonitor.unbounded());

        assertThat(loss).isFinite().isLessThan(before);
        assertThat(model.reconstructionErrors(data)).hasSize(data.length);
    }

    @Test
    void train_spikeRowsReconstructWorseThanTypicalRows() throws Exception {
        Autoencoder model = Autoencoder.build(data[0].length, 1, 0.01, 3L);
        model.train(data, 10, 32, 3L, TrainingMonitor.unbounded());
        double[] errors = model.reconstructionErrors(data);

        double injected = TestDataFactory.injectedRows().stream().mapToDouble(i -> errors[i]).average().orElseThrow();
        double typical = DoubleStream.of(errors).sorted().toArray()[errors.length / 2];

        assertThat(injected).isGreaterThan(typical);
    }

    @Test
    void train_cancelledBeforeStart_throwsWithoutFitting() {
        Autoencoder model = Autoencoder.build(data[0].length, 1, 0.01, 3L);
        TrainingMonitor monitor = TrainingMonitor.unbounded();
        monitor.cancel();

        assertThatThrownBy(() -> model.train(data, 10, 32, 3L, monitor))
                .isInstanceOf(TrainingAbortedException.class)
                .hasMessage("training cancelled by caller");
    }

    @Test
    void train_deadlinePassingMidTraining_stopsAtNextBatch() {
        Autoencoder model = Autoencoder.build(data[0].length, 1, 0.01, 3L);
        TrainingMonitor monitor = TrainingMonitor.withTimeout(Duration.ofMillis(200));

        assertThatThrownBy(() -> model.train(data, 1_000_000, 8, 3L, monitor))
                .isInstanceOf(TrainingAbortedException.class)
                .hasMessage("training exceeded its time budget");
    }
}
