package com.growthlens.kpi.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface FactSource {

    /**
     * Raw upstream rows for one day, keyed by column name. Values may be null.
     */
    List<Map<String, Object>> fetchFacts(LocalDate date);
}
