package com.growthlens.kpi.analytics;

import com.growthlens.kpi.model.FactRecord;
import java.util.Set;

/**
 * Category values that define the user populations counted by the rollup. Values are compared
 * against normalized (trimmed, lower-cased where applicable) fact dimensions.
 */
public record PopulationRules(
        String goodStatus,
        String verifiedStatus,
        String femaleGender,
        Set<String> youngAgeBands,
        Set<String> highCityTiers
) {

    public PopulationRules {
        if (goodStatus == null || goodStatus.isBlank()) {
            throw new IllegalArgumentException("goodStatus must be provided");
        }
        if (verifiedStatus == null || verifiedStatus.isBlank()) {
            throw new IllegalArgumentException("verifiedStatus must be provided");
        }
        femaleGender = femaleGender == null ? "female" : femaleGender;
        youngAgeBands = youngAgeBands == null ? Set.of() : Set.copyOf(youngAgeBands);
        highCityTiers = highCityTiers == null ? Set.of() : Set.copyOf(highCityTiers);
    }

    public static PopulationRules defaults() {
        return new PopulationRules("good", "verified", "female",
                Set.of("20-", "20~23"),
                Set.of("超一线", "一线", "二线"));
    }

    public boolean isGood(FactRecord fact) {
        return goodStatus.equals(fact.status());
    }

    public boolean isVerified(FactRecord fact) {
        return verifiedStatus.equals(fact.verification());
    }

    public boolean isQuality(FactRecord fact) {
        return isGood(fact) && isVerified(fact);
    }

    public boolean isFemale(FactRecord fact) {
        return femaleGender.equals(fact.gender());
    }

    public boolean isYoung(FactRecord fact) {
        return youngAgeBands.contains(fact.ageBand());
    }

    public boolean isHighTier(FactRecord fact) {
        return highCityTiers.contains(fact.cityTier());
    }
}
