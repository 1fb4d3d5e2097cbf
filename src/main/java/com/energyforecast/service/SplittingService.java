package com.energyforecast.service;

import com.energyforecast.entity.SplitRatios;
import com.energyforecast.entity.SplitSet;
import com.energyforecast.entity.WindowSet;
import com.energyforecast.exception.InsufficientDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 按时间顺序切分窗口，不打乱
 */
public class SplittingService {
    private static final Logger logger = LoggerFactory.getLogger(SplittingService.class);

    public SplitSet split(WindowSet windows, SplitRatios ratios) {
        int total = windows.size();
        int trainCut = trainWindowCount(total, ratios);
        int validationCut = ratios.hasValidation()
                ? (int) Math.floor(total * ratios.getValidationEnd())
                : trainCut;

        if (trainCut == 0) {
            throw new InsufficientDataException("Training partition is empty for " + total + " windows (" + ratios + ")");
        }
        if (validationCut >= total) {
            throw new InsufficientDataException("Test partition is empty for " + total + " windows (" + ratios + ")");
        }
        if (ratios.hasValidation() && validationCut == trainCut) {
            throw new InsufficientDataException("Validation partition is empty for " + total + " windows (" + ratios + ")");
        }

        WindowSet train = windows.slice(0, trainCut);
        WindowSet validation = ratios.hasValidation() ? windows.slice(trainCut, validationCut) : null;
        WindowSet test = windows.slice(validationCut, total);

        logger.info("Split {} windows into train={}, validation={}, test={}",
                total, train.size(), validation == null ? 0 : validation.size(), test.size());

        return new SplitSet(train, validation, test);
    }

    /**
     * 训练集窗口数 floor(N * trainEnd)
     */
    public static int trainWindowCount(int totalWindows, SplitRatios ratios) {
        return (int) Math.floor(totalWindows * ratios.getTrainEnd());
    }
}
