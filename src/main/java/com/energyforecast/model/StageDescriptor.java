package com.energyforecast.model;

import org.nd4j.linalg.activations.Activation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 网络中的一个计算阶段及其输出形状约定
 * outputTimesteps 为 0 表示输出是不带时间轴的向量
 */
public class StageDescriptor {
    private final String name;
    private final StageKind kind;
    private final List<String> inputs;
    private final int width;
    private final int kernelSize;
    private final Activation activation;
    private final double dropoutRate;
    private final int outputChannels;
    private final int outputTimesteps;

    private StageDescriptor(String name, StageKind kind, List<String> inputs, int width, int kernelSize,
                            Activation activation, double dropoutRate, int outputChannels, int outputTimesteps) {
        this.name = name;
        this.kind = kind;
        this.inputs = Collections.unmodifiableList(inputs);
        this.width = width;
        this.kernelSize = kernelSize;
        this.activation = activation;
        this.dropoutRate = dropoutRate;
        this.outputChannels = outputChannels;
        this.outputTimesteps = outputTimesteps;
    }

    public static StageDescriptor convolution(String name, StageKind kind, String input, int filters,
                                              int kernelSize, Activation activation, int timesteps) {
        return new StageDescriptor(name, kind, List.of(input), filters, kernelSize, activation, 0.0, filters, timesteps);
    }

    public static StageDescriptor maxPool(String name, String input, int factor, int channels, int inputTimesteps) {
        int timesteps = (inputTimesteps - factor) / factor + 1;
        return new StageDescriptor(name, StageKind.MAX_POOL, List.of(input), factor, factor, null, 0.0, channels, timesteps);
    }

    public static StageDescriptor recurrent(String name, String input, int units, int timesteps) {
        return new StageDescriptor(name, StageKind.RECURRENT, List.of(input), units, 0, Activation.TANH, 0.0, units, timesteps);
    }

    public static StageDescriptor recurrentLastStep(String name, String input, int units) {
        return new StageDescriptor(name, StageKind.RECURRENT_LAST_STEP, List.of(input), units, 0, Activation.TANH, 0.0, units, 0);
    }

    public static StageDescriptor dropout(String name, String input, double rate, int channels, int timesteps) {
        return new StageDescriptor(name, StageKind.DROPOUT, List.of(input), channels, 0, null, rate, channels, timesteps);
    }

    public static StageDescriptor attentionContext(String name, String sequence, String weights, int units) {
        return new StageDescriptor(name, StageKind.ATTENTION_CONTEXT, Arrays.asList(sequence, weights), units, 0, null, 0.0, units, 0);
    }

    public static StageDescriptor denseOutput(String name, String input) {
        return new StageDescriptor(name, StageKind.DENSE_OUTPUT, List.of(input), 1, 0, Activation.IDENTITY, 0.0, 1, 0);
    }

    public String getName() {
        return name;
    }

    public StageKind getKind() {
        return kind;
    }

    public List<String> getInputs() {
        return inputs;
    }

    /**
     * 卷积核数、LSTM 单元数或池化倍数
     */
    public int getWidth() {
        return width;
    }

    public int getKernelSize() {
        return kernelSize;
    }

    public Activation getActivation() {
        return activation;
    }

    public double getDropoutRate() {
        return dropoutRate;
    }

    public int getOutputChannels() {
        return outputChannels;
    }

    public int getOutputTimesteps() {
        return outputTimesteps;
    }

    public boolean isSequenceOutput() {
        return outputTimesteps > 0;
    }

    @Override
    public String toString() {
        String shape = isSequenceOutput()
                ? "[" + outputChannels + ", " + outputTimesteps + "]"
                : "[" + outputChannels + "]";
        return name + " (" + kind + ") <- " + inputs + " : " + shape;
    }
}
