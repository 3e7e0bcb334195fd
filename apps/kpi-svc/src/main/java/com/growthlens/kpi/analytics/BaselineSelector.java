package com.growthlens.kpi.analytics;

import com.growthlens.kpi.model.BaselineWindow;
import com.growthlens.kpi.model.Granularity;
import com.growthlens.kpi.model.RollupRow;
import com.growthlens.kpi.repository.RollupStore;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class BaselineSelector {

    public static final int DEFAULT_WINDOW_DAYS = 7;

    public BaselineWindow select(RollupStore store,
                                 Granularity granularity,
                                 String granularityKey,
                                 LocalDate targetDate,
                                 int windowDays) {
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be positive");
        }
        List<RollupRow> rows = new ArrayList<>();
        for (int offset = windowDays; offset >= 1; offset--) {
            store.getRollup(targetDate.minusDays(offset), granularity, granularityKey).ifPresent(rows::add);
        }
        return new BaselineWindow(granularity, granularityKey, targetDate, windowDays, rows);
    }

    /**
     * Keyed rows of every date in the window, one list per date, for attribution across a
     * granularity.
     */
    public List<List<RollupRow>> selectKeyed(RollupStore store,
                                             Granularity granularity,
                                             List<LocalDate> dates) {
        List<List<RollupRow>> perDate = new ArrayList<>(dates.size());
        for (LocalDate date : dates) {
            perDate.add(store.findRollups(date, granularity));
        }
        return perDate;
    }
}
