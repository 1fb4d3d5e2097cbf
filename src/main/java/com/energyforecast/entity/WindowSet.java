package com.energyforecast.entity;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.indexing.NDArrayIndex;

import java.util.Arrays;

/**
 * 滑动窗口样本集合
 * features 形状 [样本数, 1, 时间步长]，labels 形状 [样本数, 1]
 */
public class WindowSet {
    private final INDArray features;
    private final INDArray labels;

    public WindowSet(INDArray features, INDArray labels) {
        if (features.rank() != 3 || labels.rank() != 2) {
            throw new IllegalArgumentException("Expected features [n, 1, T] and labels [n, 1], got "
                    + Arrays.toString(features.shape()) + " and " + Arrays.toString(labels.shape()));
        }
        if (features.size(0) != labels.size(0)) {
            throw new IllegalArgumentException("Features and labels must have same number of examples");
        }
        this.features = features;
        this.labels = labels;
    }

    public INDArray getFeatures() {
        return features;
    }

    public INDArray getLabels() {
        return labels;
    }

    public int size() {
        return (int) features.size(0);
    }

    public int getWindowLength() {
        return (int) features.size(2);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public double[] input(int index) {
        return features.get(NDArrayIndex.point(index), NDArrayIndex.point(0), NDArrayIndex.all()).toDoubleVector();
    }

    public double target(int index) {
        return labels.getDouble(index, 0);
    }

    /**
     * 截取 [from, to) 区间的窗口，返回独立副本
     */
    public WindowSet slice(int from, int to) {
        if (from < 0 || to > size() || from > to) {
            throw new IndexOutOfBoundsException("Invalid window range [" + from + ", " + to + ") for " + size() + " windows");
        }
        if (from == to) {
            return new WindowSet(
                    Nd4j.create(features.dataType(), 0, features.size(1), features.size(2)),
                    Nd4j.create(labels.dataType(), 0, labels.size(1)));
        }
        return new WindowSet(
                features.get(NDArrayIndex.interval(from, to), NDArrayIndex.all(), NDArrayIndex.all()).dup(),
                labels.get(NDArrayIndex.interval(from, to), NDArrayIndex.all()).dup());
    }

    public DataSet toDataSet() {
        return new DataSet(features, labels);
    }
}
