package com.growthlens.kpi.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.growthlens.kpi.model.BaselineWindow;
import com.growthlens.kpi.model.Granularity;
import com.growthlens.kpi.model.RollupRow;
import com.growthlens.kpi.repository.InMemoryRollupStore;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BaselineSelectorTest {

    private static final LocalDate TARGET = LocalDate.of(2024, 5, 8);

    private final BaselineSelector selector = new BaselineSelector();
    private InMemoryRollupStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRollupStore();
    }

    @Test
    void selectsPriorDaysAscendingAndSkipsMissingOnes() {
        for (int offset : new int[] {1, 2, 4, 7, 8}) {
            store.putRollup(RollupRow.empty(TARGET.minusDays(offset), Granularity.GLOBAL, ""));
        }
        store.putRollup(RollupRow.empty(TARGET, Granularity.GLOBAL, ""));

        BaselineWindow window = selector.select(store, Granularity.GLOBAL, "", TARGET, 7);

        assertThat(window.dates()).containsExactly(
                TARGET.minusDays(7), TARGET.minusDays(4), TARGET.minusDays(2), TARGET.minusDays(1));
        assertThat(window.windowDays()).isEqualTo(7);
    }

    @Test
    void onlyRowsOfTheRequestedKey() {
        store.putRollup(RollupRow.empty(TARGET.minusDays(1), Granularity.CHANNEL, "A"));
        store.putRollup(RollupRow.empty(TARGET.minusDays(1), Granularity.CHANNEL, "B"));
        store.putRollup(RollupRow.empty(TARGET.minusDays(1), Granularity.GLOBAL, ""));

        BaselineWindow window = selector.select(store, Granularity.CHANNEL, "A", TARGET, 3);

        assertThat(window.rows()).singleElement()
                .satisfies(row -> assertThat(row.granularityKey()).isEqualTo("A"));
    }

    @Test
    void emptyHistoryGivesEmptyWindow() {
        assertThat(selector.select(store, Granularity.GLOBAL, "", TARGET, 7).rows()).isEmpty();
    }

    @Test
    void rejectsNonPositiveWindow() {
        assertThatThrownBy(() -> selector.select(store, Granularity.GLOBAL, "", TARGET, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void keyedSelectionKeepsOneListPerDate() {
        store.putRollup(RollupRow.empty(TARGET.minusDays(2), Granularity.CHANNEL, "A"));
        store.putRollup(RollupRow.empty(TARGET.minusDays(1), Granularity.CHANNEL, "A"));
        store.putRollup(RollupRow.empty(TARGET.minusDays(1), Granularity.CHANNEL, "B"));

        List<List<RollupRow>> perDate = selector.selectKeyed(store, Granularity.CHANNEL,
                List.of(TARGET.minusDays(3), TARGET.minusDays(2), TARGET.minusDays(1)));

        assertThat(perDate).hasSize(3);
        assertThat(perDate.get(0)).isEmpty();
        assertThat(perDate.get(1)).hasSize(1);
        assertThat(perDate.get(2)).extracting(RollupRow::granularityKey).containsExactly("A", "B");
    }
}
