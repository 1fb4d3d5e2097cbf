package com.energyforecast.util;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.ops.transforms.Transforms;

public class EvaluationMetrics {

    private EvaluationMetrics() {
    }

    /**
     * 计算均方误差 (MSE)
     */
    public static double calculateMSE(INDArray predictions, INDArray actuals) {
        INDArray diff = predictions.sub(actuals);
        return diff.muli(diff).meanNumber().doubleValue();
    }

    /**
     * 计算平均绝对误差 (MAE)
     */
    public static double calculateMAE(INDArray predictions, INDArray actuals) {
        INDArray abs = Transforms.abs(predictions.sub(actuals), false);
        return abs.meanNumber().doubleValue();
    }

    /**
     * 计算均方根误差 (RMSE)
     */
    public static double calculateRMSE(INDArray predictions, INDArray actuals) {
        return Math.sqrt(calculateMSE(predictions, actuals));
    }

    /**
     * 计算决定系数 (R²)，真实值方差为0时返回 NaN
     */
    public static double calculateR2(INDArray predictions, INDArray actuals) {
        double actualMean = actuals.meanNumber().doubleValue();
        INDArray deviation = actuals.sub(actualMean);
        double totalSum = deviation.muli(deviation).sumNumber().doubleValue();

        if (totalSum == 0.0) {
            return Double.NaN;
        }

        INDArray residual = predictions.sub(actuals);
        double residualSum = residual.muli(residual).sumNumber().doubleValue();

        return 1 - (residualSum / totalSum);
    }
}
