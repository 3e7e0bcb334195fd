package com.growthlens.kpi.model;

/**
 * Declared in ascending order; {@link #compareTo} ranks HIGH above LOW.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
