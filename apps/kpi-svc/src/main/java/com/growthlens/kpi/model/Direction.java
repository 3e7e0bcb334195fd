package com.growthlens.kpi.model;

import java.math.BigDecimal;

public enum Direction {
    INCREASE,
    DECREASE,
    EITHER;

    /**
     * Inclusive at the threshold in every direction.
     */
    public boolean triggers(BigDecimal signedChange, BigDecimal thresholdValue) {
        return switch (this) {
            case INCREASE -> signedChange.compareTo(thresholdValue) >= 0;
            case DECREASE -> signedChange.compareTo(thresholdValue.negate()) <= 0;
            case EITHER -> signedChange.abs().compareTo(thresholdValue) >= 0;
        };
    }
}
