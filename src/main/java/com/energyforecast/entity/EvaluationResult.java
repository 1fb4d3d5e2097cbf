package com.energyforecast.entity;

import java.util.Locale;

public class EvaluationResult {
    private final double mae;
    private final double rmse;
    private final double r2;

    public EvaluationResult(double mae, double rmse, double r2) {
        this.mae = mae;
        this.rmse = rmse;
        this.r2 = r2;
    }

    public double getMae() {
        return mae;
    }

    public double getRmse() {
        return rmse;
    }

    /**
     * @return 决定系数，目标方差为0时为 NaN
     */
    public double getR2() {
        return r2;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "MAE=%.4f, RMSE=%.4f, R2=%.4f", mae, rmse, r2);
    }
}
