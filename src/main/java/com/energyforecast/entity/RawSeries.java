package com.energyforecast.entity;

import com.energyforecast.exception.MalformedSeriesException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 原始时间序列：按时间严格递增排列的 (时间戳, 数值)
 */
public class RawSeries {
    private final String datasetName;
    private final List<SeriesPoint> points;

    public RawSeries(String datasetName, List<SeriesPoint> points) {
        if (points == null || points.isEmpty()) {
            throw new MalformedSeriesException("Dataset " + datasetName + " contains no observations");
        }

        for (int i = 0; i < points.size(); i++) {
            SeriesPoint point = points.get(i);
            if (point.getTimestamp() == null) {
                throw new MalformedSeriesException("Dataset " + datasetName + " has a missing timestamp at row " + i);
            }
            if (!Double.isFinite(point.getValue())) {
                throw new MalformedSeriesException("Dataset " + datasetName + " has a non-finite value at "
                        + point.getTimestamp());
            }
            if (i > 0 && !point.getTimestamp().isAfter(points.get(i - 1).getTimestamp())) {
                throw new MalformedSeriesException("Dataset " + datasetName + " timestamps are not strictly increasing at "
                        + point.getTimestamp());
            }
        }

        this.datasetName = datasetName;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public String getDatasetName() {
        return datasetName;
    }

    public List<SeriesPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    /**
     * 提取数值列
     */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }
}
