package com.growthlens.kpi.model;

import java.util.function.Function;

public enum Granularity {
    GLOBAL(fact -> ""),
    CHANNEL(FactRecord::channel),
    AGENT(FactRecord::agent),
    OS_TYPE(FactRecord::osType);

    private final Function<FactRecord, String> keyExtractor;

    Granularity(Function<FactRecord, String> keyExtractor) {
        this.keyExtractor = keyExtractor;
    }

    public String keyOf(FactRecord fact) {
        return keyExtractor.apply(fact);
    }
}
