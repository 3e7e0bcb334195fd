package com.growthlens.kpi.config;

import com.growthlens.kpi.model.AnomalyRule;
import java.util.List;

@FunctionalInterface
public interface RuleSource {

    /**
     * Ordered, read-only rule set. Order breaks ties between otherwise equal rules.
     */
    List<AnomalyRule> rules();
}
