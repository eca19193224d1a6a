package com.energy.anomaly.engine.reconstruction;

import org.deeplearning4j.nn.api.Model;
import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.deeplearning4j.optimize.api.BaseTrainingListener;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;

import java.util.Random;

/**
 * Single-bottleneck autoencoder: a tanh encoder of width k and a linear decoder back to the
 * input width, trained with mini-batch Adam on mean squared reconstruction error.
 */
class Autoencoder {

    private final MultiLayerNetwork network;

    private Autoencoder(MultiLayerNetwork network) {
        this.network = network;
    }

    static Autoencoder build(int inputDim, int hiddenDim, double learningRate, long seed) {
        MultiLayerConfiguration conf = new NeuralNetConfiguration.Builder()
                .seed(seed)
                .dataType(DataType.DOUBLE)
                .updater(new Adam(learningRate))
                .weightInit(WeightInit.XAVIER)
                .list()
                .layer(new DenseLayer.Builder()
                        .nIn(inputDim)
                        .nOut(hiddenDim)
                        .activation(Activation.TANH)
                        .build())
                .layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE)
                        .nIn(hiddenDim)
                        .nOut(inputDim)
                        .activation(Activation.IDENTITY)
                        .build())
                .build();
        MultiLayerNetwork network = new MultiLayerNetwork(conf);
        network.init();
        return new Autoencoder(network);
    }

    /**
     * The monitor is consulted after every mini-batch update; rows are reshuffled each epoch
     * from {@code seed}.
     *
     * @return mean squared reconstruction error over the data after the last epoch
     */
    double train(double[][] data, int epochs, int batchSize, long seed, TrainingMonitor monitor)
            throws TrainingAbortedException {
        monitor.checkpoint();
        INDArray input = Nd4j.create(data);
        DataSet all = new DataSet(input, input);
        Random shuffleSeeds = new Random(seed);

        network.setListeners(new MonitorListener(monitor));
        try {
            for (int epoch = 0; epoch < epochs; epoch++) {
                DataSet epochData = all.copy();
                epochData.shuffle(shuffleSeeds.nextLong());
                for (DataSet batch : epochData.batchBy(batchSize)) {
                    network.fit(batch);
                }
            }
        } catch (RuntimeException e) {
            throw unwrapAbort(e);
        } finally {
            network.setListeners();
        }

        double loss = mean(reconstructionErrors(data));
        if (!Double.isFinite(loss)) {
            throw new TrainingAbortedException("training loss diverged after " + epochs + " epochs");
        }
        return loss;
    }

    /**
     * Per-row mean squared error between each row and its reconstruction.
     */
    double[] reconstructionErrors(double[][] data) {
        INDArray input = Nd4j.create(data);
        INDArray diff = network.output(input).sub(input);
        return diff.muli(diff).mean(1).toDoubleVector();
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static TrainingAbortedException unwrapAbort(RuntimeException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof AbortSignal signal) {
                return signal.reason;
            }
        }
        throw e;
    }

    /**
     * Carries a checked abort out of the network's fit loop.
     */
    private static final class AbortSignal extends RuntimeException {

        private final TrainingAbortedException reason;

        AbortSignal(TrainingAbortedException reason) {
            super(reason.getMessage(), reason, false, false);
            this.reason = reason;
        }
    }

    private static final class MonitorListener extends BaseTrainingListener {

        private final TrainingMonitor monitor;

        MonitorListener(TrainingMonitor monitor) {
            this.monitor = monitor;
        }

        @Override
        public void iterationDone(Model model, int iteration, int epoch) {
            try {
                if (!Double.isFinite(model.score())) {
                    throw new TrainingAbortedException("training loss diverged at iteration " + iteration);
                }
                monitor.checkpoint();
            } catch (TrainingAbortedException e) {
                throw new AbortSignal(e);
            }
        }
    }
}
