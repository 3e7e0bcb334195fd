package com.growthlens.kpi.model;

public record SanityIssue(Level level, Granularity granularity, String granularityKey, String check, String message) {

    public enum Level {
        WARNING,
        ERROR
    }
}
