package com.energyforecast.model;

public enum StageKind {
    CONVOLUTION,
    MAX_POOL,
    RECURRENT,
    RECURRENT_LAST_STEP,
    DROPOUT,
    ATTENTION_FEATURES,
    ATTENTION_SCORE,
    ATTENTION_CONTEXT,
    DENSE_OUTPUT
}
