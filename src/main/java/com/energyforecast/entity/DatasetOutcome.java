package com.energyforecast.entity;

/**
 * 单个数据集的处理结果：成功（附评估指标）或失败（附原因）
 */
public class DatasetOutcome {
    private final String datasetName;
    private final EvaluationResult normalizedMetrics;
    private final EvaluationResult originalUnitMetrics;
    private final HyperparameterConfig config;
    private final String errorCode;
    private final String errorMessage;

    private DatasetOutcome(String datasetName, EvaluationResult normalizedMetrics,
                           EvaluationResult originalUnitMetrics, HyperparameterConfig config,
                           String errorCode, String errorMessage) {
        this.datasetName = datasetName;
        this.normalizedMetrics = normalizedMetrics;
        this.originalUnitMetrics = originalUnitMetrics;
        this.config = config;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public static DatasetOutcome success(String datasetName, EvaluationResult normalizedMetrics,
                                         EvaluationResult originalUnitMetrics, HyperparameterConfig config) {
        return new DatasetOutcome(datasetName, normalizedMetrics, originalUnitMetrics, config, null, null);
    }

    public static DatasetOutcome failure(String datasetName, String errorCode, String errorMessage) {
        return new DatasetOutcome(datasetName, null, null, null, errorCode, errorMessage);
    }

    public String getDatasetName() {
        return datasetName;
    }

    public boolean isSuccess() {
        return errorCode == null;
    }

    public EvaluationResult getNormalizedMetrics() {
        return normalizedMetrics;
    }

    public EvaluationResult getOriginalUnitMetrics() {
        return originalUnitMetrics;
    }

    public HyperparameterConfig getConfig() {
        return config;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
