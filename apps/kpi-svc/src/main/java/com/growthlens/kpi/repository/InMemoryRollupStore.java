package com.growthlens.kpi.repository;

import com.growthlens.kpi.model.Granularity;
import com.growthlens.kpi.model.RollupRow;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryRollupStore implements RollupStore {

    private record Key(LocalDate date, Granularity granularity, String granularityKey) {
    }

    private final Map<LocalDate, Map<Key, RollupRow>> storage = new ConcurrentHashMap<>();

    @Override
    public Optional<RollupRow> getRollup(LocalDate date, Granularity granularity, String granularityKey) {
        Map<Key, RollupRow> rows = storage.get(date);
        if (rows == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(new Key(date, granularity, granularityKey)));
    }

    @Override
    public RollupRow putRollup(RollupRow row) {
        storage.computeIfAbsent(row.date(), date -> new ConcurrentHashMap<>())
                .put(new Key(row.date(), row.granularity(), row.granularityKey()), row);
        return row;
    }

    @Override
    public List<RollupRow> findRollups(LocalDate date, Granularity granularity) {
        Map<Key, RollupRow> rows = storage.get(date);
        if (rows == null) {
            return List.of();
        }
        return rows.values().stream()
                .filter(row -> row.granularity() == granularity)
                .sorted(Comparator.comparing(RollupRow::granularityKey))
                .toList();
    }

    @Override
    public void replaceRollups(LocalDate date, List<RollupRow> rows) {
        Map<Key, RollupRow> replacement = new ConcurrentHashMap<>();
        for (RollupRow row : rows) {
            if (!date.equals(row.date())) {
                throw new IllegalArgumentException("row dated " + row.date() + " cannot replace rollups of " + date);
            }
            replacement.put(new Key(row.date(), row.granularity(), row.granularityKey()), row);
        }
        storage.put(date, replacement);
    }
}
