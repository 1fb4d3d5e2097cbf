package com.energyforecast.entity;

/**
 * 训练/验证/测试三段，保持时间顺序且互不重叠
 */
public class SplitSet {
    private final WindowSet train;
    private final WindowSet validation;
    private final WindowSet test;

    public SplitSet(WindowSet train, WindowSet validation, WindowSet test) {
        this.train = train;
        this.validation = validation;
        this.test = test;
    }

    public WindowSet getTrain() {
        return train;
    }

    /**
     * @return 验证集，两段划分时为 null
     */
    public WindowSet getValidation() {
        return validation;
    }

    public WindowSet getTest() {
        return test;
    }

    public boolean hasValidation() {
        return validation != null;
    }
}
