package com.energyforecast.entity;

import com.energyforecast.model.ArchitectureVariant;

/**
 * 流水线配置，所有取值由调用方提供
 */
public class PipelineConfig {
    private int windowLength = 24;                  // 输入窗口长度（小时）
    private double trainEnd = 0.8;                  // 训练集切分点
    private double validationEnd = 0.9;            // 验证集切分点，等于 trainEnd 表示不使用验证集
    private ArchitectureVariant architecture = ArchitectureVariant.HYBRID;
    private boolean searchEnabled = true;           // 是否先做网格搜索
    private HyperparameterGrid grid = HyperparameterGrid.getDefaultGrid();
    private HyperparameterConfig fixedConfig = new HyperparameterConfig(64, 0.2, 32, 50);
    private int searchPatience = 3;                 // 搜索阶段早停耐心值
    private int finalPatience = 5;                  // 最终训练早停耐心值
    private double learningRate = 0.001;            // Adam 学习率
    private long seed = 42L;                        // 全局随机种子
    private ScalerFitScope scalerFitScope = ScalerFitScope.FULL_SERIES;
    private int datasetParallelism = 1;             // 并行处理的数据集数
    private int searchParallelism = 1;              // 并行训练的候选配置数
    private boolean reportOriginalUnits = false;    // 报告是否使用原始负荷单位

    public static PipelineConfig getDefaultConfig() {
        return new PipelineConfig();
    }

    public SplitRatios getSplitRatios() {
        return new SplitRatios(trainEnd, validationEnd);
    }

    // Getters and Setters
    public int getWindowLength() {
        return windowLength;
    }

    public void setWindowLength(int windowLength) {
        this.windowLength = windowLength;
    }

    public double getTrainEnd() {
        return trainEnd;
    }

    public void setTrainEnd(double trainEnd) {
        this.trainEnd = trainEnd;
    }

    public double getValidationEnd() {
        return validationEnd;
    }

    public void setValidationEnd(double validationEnd) {
        this.validationEnd = validationEnd;
    }

    public ArchitectureVariant getArchitecture() {
        return architecture;
    }

    public void setArchitecture(ArchitectureVariant architecture) {
        this.architecture = architecture;
    }

    public boolean isSearchEnabled() {
        return searchEnabled;
    }

    public void setSearchEnabled(boolean searchEnabled) {
        this.searchEnabled = searchEnabled;
    }

    public HyperparameterGrid getGrid() {
        return grid;
    }

    public void setGrid(HyperparameterGrid grid) {
        this.grid = grid;
    }

    public HyperparameterConfig getFixedConfig() {
        return fixedConfig;
    }

    public void setFixedConfig(HyperparameterConfig fixedConfig) {
        this.fixedConfig = fixedConfig;
    }

    public int getSearchPatience() {
        return searchPatience;
    }

    public void setSearchPatience(int searchPatience) {
        this.searchPatience = searchPatience;
    }

    public int getFinalPatience() {
        return finalPatience;
    }

    public void setFinalPatience(int finalPatience) {
        this.finalPatience = finalPatience;
    }

    public double getLearningRate() {
        return learningRate;
    }

    public void setLearningRate(double learningRate) {
        this.learningRate = learningRate;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public ScalerFitScope getScalerFitScope() {
        return scalerFitScope;
    }

    public void setScalerFitScope(ScalerFitScope scalerFitScope) {
        this.scalerFitScope = scalerFitScope;
    }

    public int getDatasetParallelism() {
        return datasetParallelism;
    }

    public void setDatasetParallelism(int datasetParallelism) {
        this.datasetParallelism = datasetParallelism;
    }

    public int getSearchParallelism() {
        return searchParallelism;
    }

    public void setSearchParallelism(int searchParallelism) {
        this.searchParallelism = searchParallelism;
    }

    public boolean isReportOriginalUnits() {
        return reportOriginalUnits;
    }

    public void setReportOriginalUnits(boolean reportOriginalUnits) {
        this.reportOriginalUnits = reportOriginalUnits;
    }
}
