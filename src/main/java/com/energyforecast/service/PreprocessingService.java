package com.energyforecast.service;

import com.energyforecast.entity.RawSeries;
import com.energyforecast.exception.DegenerateSeriesException;
import com.energyforecast.util.MinMaxScaler;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.indexing.NDArrayIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

public class PreprocessingService {
    private static final Logger logger = LoggerFactory.getLogger(PreprocessingService.class);

    public static final double Z_SCORE_THRESHOLD = 3.0;

    /**
     * 完整预处理流程：异常值替换 + 归一化，归一化器在整条序列上拟合
     */
    public PreprocessedSeries preprocess(RawSeries series) {
        return preprocess(series, series.size());
    }

    /**
     * 完整预处理流程
     *
     * @param scalerFitLength 用于拟合归一化器的前缀长度，异常值统计始终基于整条序列
     */
    public PreprocessedSeries preprocess(RawSeries series, int scalerFitLength) {
        if (scalerFitLength < 1 || scalerFitLength > series.size()) {
            throw new IllegalArgumentException("scalerFitLength must be in [1, " + series.size()
                    + "], got " + scalerFitLength);
        }
        logger.info("Preprocessing dataset {} ({} observations)", series.getDatasetName(), series.size());

        // 1. 异常值替换
        double[] raw = series.values();
        double[] cleaned = raw.clone();
        int replaced = replaceOutliersInPlace(cleaned);

        // 2. 归一化
        INDArray values = Nd4j.createFromArray(cleaned);
        MinMaxScaler scaler = new MinMaxScaler();
        if (scalerFitLength == values.length()) {
            scaler.fit(values);
        } else {
            scaler.fit(values.get(NDArrayIndex.interval(0, scalerFitLength)));
        }
        scaler.transform(values);

        logger.info("Dataset {}: replaced {} outliers, scaler range [{}, {}] fitted on {} values",
                series.getDatasetName(), replaced, scaler.getDataMin(), scaler.getDataMax(), scalerFitLength);

        return new PreprocessedSeries(values, scaler, replaced);
    }

    /**
     * 将 |z| > 3 的点替换为中位数，返回新数组
     * 重复替换直到没有点被标记，结果再次处理不会改变
     */
    public double[] replaceOutliers(double[] values) {
        double[] cleaned = values.clone();
        replaceOutliersInPlace(cleaned);
        return cleaned;
    }

    private int replaceOutliersInPlace(double[] values) {
        if (values.length < 2) {
            throw new DegenerateSeriesException("Cannot compute z-scores for a series of length " + values.length);
        }
        if (standardDeviation(values) == 0.0) {
            throw new DegenerateSeriesException("Series has zero variance, z-scores are undefined");
        }

        // 每轮至少替换一个点，轮数不超过序列长度
        int replaced = 0;
        for (int pass = 0; pass < values.length; pass++) {
            int replacedThisPass = replaceOnce(values);
            if (replacedThisPass == 0) {
                break;
            }
            replaced += replacedThisPass;
            logger.debug("Outlier pass {} replaced {} values", pass + 1, replacedThisPass);
        }
        return replaced;
    }

    /**
     * 单轮替换：均值、总体标准差和中位数都基于本轮替换前的序列
     */
    private static int replaceOnce(double[] values) {
        double std = standardDeviation(values);
        if (std == 0.0) {
            return 0;
        }
        double mean = Nd4j.createFromArray(values).meanNumber().doubleValue();
        double median = median(values);

        int replaced = 0;
        for (int i = 0; i < values.length; i++) {
            double z = (values[i] - mean) / std;
            if (Math.abs(z) > Z_SCORE_THRESHOLD) {
                values[i] = median;
                replaced++;
            }
        }
        return replaced;
    }

    private static double standardDeviation(double[] values) {
        double std = Nd4j.createFromArray(values).std(false).getDouble(0);
        if (!Double.isFinite(std)) {
            throw new DegenerateSeriesException("Series standard deviation is not finite");
        }
        return std;
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * 预处理结果：归一化后的序列、拟合好的归一化器、替换的异常值个数
     */
    public static class PreprocessedSeries {
        private final INDArray values;
        private final MinMaxScaler scaler;
        private final int replacedOutliers;

        public PreprocessedSeries(INDArray values, MinMaxScaler scaler, int replacedOutliers) {
            this.values = values;
            this.scaler = scaler;
            this.replacedOutliers = replacedOutliers;
        }

        public INDArray getValues() {
            return values;
        }

        public MinMaxScaler getScaler() {
            return scaler;
        }

        public int getReplacedOutliers() {
            return replacedOutliers;
        }

        public int size() {
            return (int) values.length();
        }
    }
}
