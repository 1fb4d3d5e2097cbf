package com.energyforecast.dao;

import com.energyforecast.entity.RawSeries;

import java.io.IOException;

/**
 * 按数据集名称提供原始时间序列
 */
public interface SeriesSource {

    RawSeries load(String datasetName) throws IOException;
}
