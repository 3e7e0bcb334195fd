package com.growthlens.kpi.model;

public enum ThresholdKind {
    PERCENTAGE,
    ABSOLUTE
}
