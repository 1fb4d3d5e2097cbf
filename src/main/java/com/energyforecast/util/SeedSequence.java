package com.energyforecast.util;

import java.nio.charset.StandardCharsets;
import java.util.SplittableRandom;

/**
 * 从全局种子派生互相独立且可复现的子种子
 */
public final class SeedSequence {

    private SeedSequence() {
    }

    public static long derive(long seed, String key) {
        long mixed = seed;
        for (byte b : key.getBytes(StandardCharsets.UTF_8)) {
            mixed = mixed * 31 + b;
        }
        return new SplittableRandom(mixed).nextLong();
    }
}
