package com.energyforecast.entity;

import com.energyforecast.util.MinMaxScaler;
import org.deeplearning4j.nn.graph.ComputationGraph;

import java.util.Collections;
import java.util.List;

/**
 * 持久化单元：训练好的网络及其超参数、归一化器和训练历史
 */
public class ModelArtifact {
    private final ComputationGraph network;
    private final HyperparameterConfig config;
    private final MinMaxScaler scaler;
    private final List<Double> lossHistory;

    public ModelArtifact(ComputationGraph network, HyperparameterConfig config,
                         MinMaxScaler scaler, List<Double> lossHistory) {
        this.network = network;
        this.config = config;
        this.scaler = scaler;
        this.lossHistory = Collections.unmodifiableList(lossHistory);
    }

    public ComputationGraph getNetwork() {
        return network;
    }

    public HyperparameterConfig getConfig() {
        return config;
    }

    public MinMaxScaler getScaler() {
        return scaler;
    }

    public List<Double> getLossHistory() {
        return lossHistory;
    }
}
