package com.growthlens.kpi.analytics;

import com.growthlens.kpi.error.InconsistentRollupException;
import com.growthlens.kpi.model.FactRecord;
import com.growthlens.kpi.model.Granularity;
import com.growthlens.kpi.model.RollupRow;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Aggregates one date's facts into rollup rows per granularity. Output depends only on the fact
 * multiset: sums are integers and rows are emitted sorted by granularity then key.
 */
@Component
public class RollupEngine {

    public List<RollupRow> rollup(LocalDate date,
                                  Collection<FactRecord> facts,
                                  Set<Granularity> granularities,
                                  PopulationRules population) {
        if (granularities == null || granularities.isEmpty()) {
            throw new IllegalArgumentException("at least one granularity must be requested");
        }
        for (FactRecord fact : facts) {
            if (!date.equals(fact.date())) {
                throw new IllegalArgumentException("fact dated " + fact.date() + " in batch for " + date);
            }
        }
        Map<Granularity, List<RollupRow>> byGranularity = new TreeMap<>();
        Set<Granularity> computed = EnumSet.copyOf(granularities);
        computed.add(Granularity.GLOBAL);
        try {
            for (Granularity granularity : computed) {
                byGranularity.put(granularity, aggregate(date, facts, granularity, population));
            }
        } catch (ArithmeticException ex) {
            throw new InconsistentRollupException(date, "sum overflow", ex);
        }
        reconcile(date, byGranularity);

        List<RollupRow> rows = new ArrayList<>();
        byGranularity.forEach((granularity, granularityRows) -> {
            if (granularities.contains(granularity)) {
                rows.addAll(granularityRows);
            }
        });
        return rows;
    }

    private List<RollupRow> aggregate(LocalDate date,
                                      Collection<FactRecord> facts,
                                      Granularity granularity,
                                      PopulationRules population) {
        Map<String, Totals> grouped = new TreeMap<>();
        if (granularity == Granularity.GLOBAL) {
            grouped.put("", new Totals());
        }
        for (FactRecord fact : facts) {
            grouped.computeIfAbsent(granularity.keyOf(fact), key -> new Totals()).add(fact, population);
        }
        return grouped.entrySet().stream()
                .map(entry -> entry.getValue().toRow(date, granularity, entry.getKey()))
                .toList();
    }

    private void reconcile(LocalDate date, Map<Granularity, List<RollupRow>> byGranularity) {
        RollupRow global = byGranularity.get(Granularity.GLOBAL).get(0);
        for (Map.Entry<Granularity, List<RollupRow>> entry : byGranularity.entrySet()) {
            if (entry.getKey() == Granularity.GLOBAL) {
                continue;
            }
            long allUsers = 0;
            long qualityUsers = 0;
            long revenue = 0;
            long cost = 0;
            try {
                for (RollupRow row : entry.getValue()) {
                    allUsers = Math.addExact(allUsers, row.allUsers());
                    qualityUsers = Math.addExact(qualityUsers, row.qualityUsers());
                    revenue = Math.addExact(revenue, row.totalRevenue());
                    cost = Math.addExact(cost, row.totalCost());
                }
            } catch (ArithmeticException ex) {
                throw new InconsistentRollupException(date, entry.getKey() + " sum overflow", ex);
            }
            requireEqual(date, entry.getKey(), "allUsers", global.allUsers(), allUsers);
            requireEqual(date, entry.getKey(), "qualityUsers", global.qualityUsers(), qualityUsers);
            requireEqual(date, entry.getKey(), "totalRevenue", global.totalRevenue(), revenue);
            requireEqual(date, entry.getKey(), "totalCost", global.totalCost(), cost);
        }
    }

    private static void requireEqual(LocalDate date, Granularity granularity, String field, long global, long keyed) {
        if (global != keyed) {
            throw new InconsistentRollupException(date,
                    granularity + " " + field + " sums to " + keyed + " but global is " + global);
        }
    }

    private static final class Totals {
        private long qualityUsers;
        private long allUsers;
        private long goodUsers;
        private long verifiedUsers;
        private long retainedUsers;
        private long payingUsers;
        private long femaleUsers;
        private long youngUsers;
        private long highTierUsers;
        private long revenue;
        private long cost;

        void add(FactRecord fact, PopulationRules population) {
            long users = fact.newUsers();
            allUsers = Math.addExact(allUsers, users);
            if (population.isGood(fact)) {
                goodUsers = Math.addExact(goodUsers, users);
            }
            if (population.isVerified(fact)) {
                verifiedUsers = Math.addExact(verifiedUsers, users);
            }
            if (!population.isQuality(fact)) {
                return;
            }
            // quality population: retention, money and segment counts
            qualityUsers = Math.addExact(qualityUsers, users);
            retainedUsers = Math.addExact(retainedUsers, fact.retainedUsers());
            revenue = Math.addExact(revenue, fact.netRevenue());
            cost = Math.addExact(cost, fact.cashCost());
            if (fact.netRevenue() > 0) {
                payingUsers = Math.addExact(payingUsers, users);
            }
            if (population.isFemale(fact)) {
                femaleUsers = Math.addExact(femaleUsers, users);
            }
            if (population.isYoung(fact)) {
                youngUsers = Math.addExact(youngUsers, users);
            }
            if (population.isHighTier(fact)) {
                highTierUsers = Math.addExact(highTierUsers, users);
            }
        }

        RollupRow toRow(LocalDate date, Granularity granularity, String key) {
            return new RollupRow(date, granularity, key,
                    qualityUsers, allUsers, goodUsers, verifiedUsers, retainedUsers,
                    payingUsers, femaleUsers, youngUsers, highTierUsers,
                    revenue, cost);
        }
    }
}
