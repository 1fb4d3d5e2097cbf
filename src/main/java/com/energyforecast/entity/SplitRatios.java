package com.energyforecast.entity;

/**
 * 按时间顺序划分的切分比例
 * trainEnd: 训练集结束位置比例；validationEnd: 验证集结束位置比例（等于 trainEnd 表示不设验证集）
 */
public class SplitRatios {
    private final double trainEnd;
    private final double validationEnd;

    public SplitRatios(double trainEnd, double validationEnd) {
        if (!(trainEnd > 0.0 && trainEnd < 1.0)) {
            throw new IllegalArgumentException("trainEnd must be in (0, 1), got " + trainEnd);
        }
        if (!(validationEnd >= trainEnd && validationEnd < 1.0)) {
            throw new IllegalArgumentException("validationEnd must be in [trainEnd, 1), got " + validationEnd);
        }
        this.trainEnd = trainEnd;
        this.validationEnd = validationEnd;
    }

    public static SplitRatios trainTest(double trainEnd) {
        return new SplitRatios(trainEnd, trainEnd);
    }

    public static SplitRatios trainValidationTest(double trainEnd, double validationEnd) {
        return new SplitRatios(trainEnd, validationEnd);
    }

    public double getTrainEnd() {
        return trainEnd;
    }

    public double getValidationEnd() {
        return validationEnd;
    }

    public boolean hasValidation() {
        return validationEnd > trainEnd;
    }

    @Override
    public String toString() {
        return hasValidation()
                ? String.format("train/val/test cut at %.2f/%.2f", trainEnd, validationEnd)
                : String.format("train/test cut at %.2f", trainEnd);
    }
}
