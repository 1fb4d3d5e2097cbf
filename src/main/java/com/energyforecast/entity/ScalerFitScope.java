package com.energyforecast.entity;

/**
 * 归一化器拟合范围
 */
public enum ScalerFitScope {
    /** 整条序列（含测试段），与参考结果保持一致 */
    FULL_SERIES,
    /** 仅用训练窗口覆盖的前缀，避免测试数据泄漏 */
    TRAINING_PREFIX
}
