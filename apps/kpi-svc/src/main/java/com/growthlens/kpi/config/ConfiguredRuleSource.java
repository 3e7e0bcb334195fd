package com.growthlens.kpi.config;

import com.growthlens.kpi.model.AnomalyRule;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ConfiguredRuleSource implements RuleSource {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredRuleSource.class);

    private final List<AnomalyRule> rules;

    public ConfiguredRuleSource(KpiProperties properties) {
        this.rules = properties.anomalyRules();
        if (rules.isEmpty()) {
            log.warn("No anomaly rules configured (kpi.rules); detection will report no findings");
        } else {
            log.info("Loaded {} anomaly rules", rules.size());
        }
    }

    @Override
    public List<AnomalyRule> rules() {
        return rules;
    }
}
