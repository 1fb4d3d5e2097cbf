package com.energyforecast.entity;

import com.energyforecast.exception.InvalidHyperparameterException;

import java.util.Objects;

/**
 * 一组超参数，构造时校验取值范围
 */
public class HyperparameterConfig {
    private final int recurrentUnits;
    private final double dropoutRate;
    private final int batchSize;
    private final int epochBudget;

    public HyperparameterConfig(int recurrentUnits, double dropoutRate, int batchSize, int epochBudget) {
        if (recurrentUnits < 1) {
            throw new InvalidHyperparameterException("recurrentUnits must be >= 1, got " + recurrentUnits);
        }
        if (!(dropoutRate >= 0.0 && dropoutRate < 1.0)) {
            throw new InvalidHyperparameterException("dropoutRate must be in [0, 1), got " + dropoutRate);
        }
        if (batchSize < 1) {
            throw new InvalidHyperparameterException("batchSize must be >= 1, got " + batchSize);
        }
        if (epochBudget < 1) {
            throw new InvalidHyperparameterException("epochBudget must be >= 1, got " + epochBudget);
        }
        this.recurrentUnits = recurrentUnits;
        this.dropoutRate = dropoutRate;
        this.batchSize = batchSize;
        this.epochBudget = epochBudget;
    }

    public int getRecurrentUnits() {
        return recurrentUnits;
    }

    public double getDropoutRate() {
        return dropoutRate;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getEpochBudget() {
        return epochBudget;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HyperparameterConfig)) return false;
        HyperparameterConfig that = (HyperparameterConfig) o;
        return recurrentUnits == that.recurrentUnits
                && Double.compare(that.dropoutRate, dropoutRate) == 0
                && batchSize == that.batchSize
                && epochBudget == that.epochBudget;
    }

    @Override
    public int hashCode() {
        return Objects.hash(recurrentUnits, dropoutRate, batchSize, epochBudget);
    }

    @Override
    public String toString() {
        return "HyperparameterConfig{" +
                "recurrentUnits=" + recurrentUnits +
                ", dropoutRate=" + dropoutRate +
                ", batchSize=" + batchSize +
                ", epochBudget=" + epochBudget +
                '}';
    }
}
