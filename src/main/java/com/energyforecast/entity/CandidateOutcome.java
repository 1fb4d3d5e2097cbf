package com.energyforecast.entity;

/**
 * 网格搜索中单个候选的结果
 */
public class CandidateOutcome {
    private final int index;
    private final HyperparameterConfig config;
    private final double validationLoss;
    private final String failure;

    private CandidateOutcome(int index, HyperparameterConfig config, double validationLoss, String failure) {
        this.index = index;
        this.config = config;
        this.validationLoss = validationLoss;
        this.failure = failure;
    }

    public static CandidateOutcome succeeded(int index, HyperparameterConfig config, double validationLoss) {
        return new CandidateOutcome(index, config, validationLoss, null);
    }

    public static CandidateOutcome failed(int index, HyperparameterConfig config, String failure) {
        return new CandidateOutcome(index, config, Double.NaN, failure);
    }

    public int getIndex() {
        return index;
    }

    public HyperparameterConfig getConfig() {
        return config;
    }

    public double getValidationLoss() {
        return validationLoss;
    }

    public String getFailure() {
        return failure;
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
