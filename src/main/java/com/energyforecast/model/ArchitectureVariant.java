package com.energyforecast.model;

public enum ArchitectureVariant {
    /** 两层 LSTM + dropout + 线性输出 */
    BASIC,
    /** 一维卷积 + 池化 + 三层 LSTM + 时间注意力 + 线性输出 */
    HYBRID
}
