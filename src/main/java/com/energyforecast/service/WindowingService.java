package com.energyforecast.service;

import com.energyforecast.entity.WindowSet;
import com.energyforecast.exception.InvalidWindowLengthException;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.indexing.NDArrayIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class WindowingService {
    private static final Logger logger = LoggerFactory.getLogger(WindowingService.class);

    public static final int DEFAULT_WINDOW_LENGTH = 24;

    /**
     * 创建滑动窗口样本
     * 第 i 个样本输入为 series[i, i+T)，目标为 series[i+T]，共 N-T 个
     * 输出维度为 [samples, 1, time_steps]
     */
    public WindowSet createWindows(INDArray series, int windowLength) {
        int length = (int) series.length();
        if (windowLength < 1 || windowLength >= length) {
            throw new InvalidWindowLengthException(windowLength, length);
        }

        INDArray flat = series.reshape(length);
        int totalWindows = length - windowLength;

        INDArray features = Nd4j.create(DataType.DOUBLE, totalWindows, 1, windowLength);
        INDArray labels = Nd4j.create(DataType.DOUBLE, totalWindows, 1);

        for (int i = 0; i < totalWindows; i++) {
            INDArray window = flat.get(NDArrayIndex.interval(i, i + windowLength));
            features.get(NDArrayIndex.point(i), NDArrayIndex.point(0), NDArrayIndex.all()).assign(window);
            labels.putScalar(i, 0, flat.getDouble(i + windowLength));
        }

        logger.info("Created {} windows of length {} from {} values", totalWindows, windowLength, length);
        return new WindowSet(features, labels);
    }
}
