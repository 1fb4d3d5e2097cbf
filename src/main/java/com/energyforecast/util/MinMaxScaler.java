package com.energyforecast.util;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * 最小-最大归一化器
 * 将数据线性映射到目标范围（默认为 [0, 1]），保留 (min, max) 供反归一化使用
 */
public class MinMaxScaler {
    private double dataMin;
    private double dataMax;
    private final double targetMin;
    private final double targetMax;
    private boolean fitted = false;

    /**
     * 默认构造函数，目标范围为 [0, 1]
     */
    public MinMaxScaler() {
        this(0.0, 1.0);
    }

    public MinMaxScaler(double targetMin, double targetMax) {
        if (!(targetMax > targetMin)) {
            throw new IllegalArgumentException("targetMax must be greater than targetMin");
        }
        this.targetMin = targetMin;
        this.targetMax = targetMax;
    }

    /**
     * 从已保存的 (min, max) 恢复归一化器
     */
    public static MinMaxScaler restore(double dataMin, double dataMax) {
        MinMaxScaler scaler = new MinMaxScaler();
        scaler.dataMin = dataMin;
        scaler.dataMax = dataMax;
        scaler.fitted = true;
        return scaler;
    }

    /**
     * 拟合数据，计算数据的最小值和最大值
     */
    public void fit(INDArray data) {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit scaler on empty data");
        }

        this.dataMin = data.minNumber().doubleValue();
        this.dataMax = data.maxNumber().doubleValue();
        this.fitted = true;
    }

    /**
     * 转换数据（原地修改）
     */
    public void transform(INDArray data) {
        checkFitted();

        double dataRange = dataMax - dataMin;
        double targetRange = targetMax - targetMin;

        if (dataRange > 0) {
            data.subi(dataMin)
                    .divi(dataRange)
                    .muli(targetRange)
                    .addi(targetMin);
        } else {
            // 所有值相同，设为目标范围的中点
            data.assign((targetMin + targetMax) / 2.0);
        }
    }

    public INDArray transformCopy(INDArray data) {
        INDArray copy = data.dup();
        transform(copy);
        return copy;
    }

    public double transform(double value) {
        checkFitted();
        double dataRange = dataMax - dataMin;
        if (dataRange > 0) {
            return (value - dataMin) / dataRange * (targetMax - targetMin) + targetMin;
        }
        return (targetMin + targetMax) / 2.0;
    }

    /**
     * 反归一化（原地修改）
     */
    public void inverseTransform(INDArray normalizedData) {
        checkFitted();

        double dataRange = dataMax - dataMin;
        double targetRange = targetMax - targetMin;

        if (dataRange > 0) {
            normalizedData.subi(targetMin)
                    .divi(targetRange)
                    .muli(dataRange)
                    .addi(dataMin);
        } else {
            normalizedData.assign(dataMin);
        }
    }

    public INDArray inverseTransformCopy(INDArray normalizedData) {
        INDArray copy = normalizedData.dup();
        inverseTransform(copy);
        return copy;
    }

    public double inverseTransform(double value) {
        checkFitted();
        double dataRange = dataMax - dataMin;
        if (dataRange > 0) {
            return (value - targetMin) / (targetMax - targetMin) * dataRange + dataMin;
        }
        return dataMin;
    }

    private void checkFitted() {
        if (!fitted) {
            throw new IllegalStateException("Scaler must be fitted before use");
        }
    }

    public double getDataMin() {
        return dataMin;
    }

    public double getDataMax() {
        return dataMax;
    }

    public boolean isFitted() {
        return fitted;
    }
}
