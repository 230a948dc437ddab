package com.missionmind.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Scores {

    private Scores() {
    }

    /**
     * Rounds the exact binary value of {@code value}, so a sum such as 0.595 that is stored
     * as 0.59499... rounds down. Exact ties go to the even neighbour.
     */
    static double round2(double value) {
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
