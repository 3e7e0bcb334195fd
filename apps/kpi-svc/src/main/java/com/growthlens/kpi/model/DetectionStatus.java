package com.growthlens.kpi.model;

public enum DetectionStatus {
    NORMAL,
    ATTENTION,
    ALERT;

    public static DetectionStatus forFindingCount(int findings) {
        if (findings == 0) {
            return NORMAL;
        }
        return findings <= 2 ? ATTENTION : ALERT;
    }
}
