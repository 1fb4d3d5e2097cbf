package com.energyforecast.entity;

import org.deeplearning4j.nn.graph.ComputationGraph;

import java.util.Collections;
import java.util.List;

/**
 * 一次训练的结果：配置、逐轮损失、最终（或最佳）网络
 */
public class TrainingRun {
    private final HyperparameterConfig config;
    private final ComputationGraph model;
    private final List<Double> lossHistory;
    private final boolean validated;
    private final int bestEpoch;
    private final double bestValidationLoss;
    private final int epochsRun;
    private final String terminationReason;

    public TrainingRun(HyperparameterConfig config, ComputationGraph model, List<Double> lossHistory,
                       boolean validated, int bestEpoch, double bestValidationLoss,
                       int epochsRun, String terminationReason) {
        this.config = config;
        this.model = model;
        this.lossHistory = Collections.unmodifiableList(lossHistory);
        this.validated = validated;
        this.bestEpoch = bestEpoch;
        this.bestValidationLoss = bestValidationLoss;
        this.epochsRun = epochsRun;
        this.terminationReason = terminationReason;
    }

    public HyperparameterConfig getConfig() {
        return config;
    }

    public ComputationGraph getModel() {
        return model;
    }

    /**
     * 有验证集时为逐轮验证损失，否则为逐轮训练损失
     */
    public List<Double> getLossHistory() {
        return lossHistory;
    }

    public boolean isValidated() {
        return validated;
    }

    public int getBestEpoch() {
        return bestEpoch;
    }

    /**
     * @return 最小验证损失，无验证集时为 NaN
     */
    public double getBestValidationLoss() {
        return bestValidationLoss;
    }

    public int getEpochsRun() {
        return epochsRun;
    }

    public String getTerminationReason() {
        return terminationReason;
    }
}
