package io.github.riemr.fleet.application.util;

import io.github.riemr.fleet.domain.model.HistoryEntry;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConsistencyMetricsTest {

    private static HistoryEntry on(LocalDate date) {
        return HistoryEntry.builder().driverId("D1").serviceDate(date).build();
    }

    @Test
    void fewerThanTwoRecords_isNeutral() {
        assertThat(ConsistencyMetrics.consistency(List.of())).isEqualTo(0.5);
        assertThat(ConsistencyMetrics.consistency(List.of(on(LocalDate.of(2025, 6, 2))))).isEqualTo(0.5);
        assertThat(ConsistencyMetrics.consistency(null)).isEqualTo(0.5);
    }

    @Test
    void sameWeekdayEveryWeek_isFullyConsistent() {
        // 月曜のみ
        var history = List.of(on(LocalDate.of(2025, 6, 2)), on(LocalDate.of(2025, 6, 9)), on(LocalDate.of(2025, 6, 16)));
        assertThat(ConsistencyMetrics.consistency(history)).isEqualTo(1.0);
    }

    @Test
    void unevenWeekdays_lowerConsistency() {
        // 月曜 2 回・火曜 1 回: mean 1.5, sd 0.5
        var history = List.of(on(LocalDate.of(2025, 6, 2)), on(LocalDate.of(2025, 6, 9)), on(LocalDate.of(2025, 6, 3)));
        assertThat(ConsistencyMetrics.consistency(history)).isCloseTo(0.6667, within(1e-4));
    }

    @Test
    void undatedRecordsOnly_isNeutral() {
        var history = List.of(HistoryEntry.builder().driverId("D1").build(), HistoryEntry.builder().driverId("D1").build());
        assertThat(ConsistencyMetrics.consistency(history)).isEqualTo(0.5);
    }
}
