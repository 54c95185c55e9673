package io.github.riemr.fleet.application.util;

import io.github.riemr.fleet.domain.model.HistoryEntry;

import java.time.DayOfWeek;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 勤務曜日の安定度。曜日別の出勤回数（0 回の曜日は除く）の変動係数から 1 - stddev/mean を求め [0,1] に収める。
 */
public final class ConsistencyMetrics {
    private ConsistencyMetrics() {}

    public static final double NEUTRAL = 0.5;

    public static double consistency(List<HistoryEntry> history) {
        if (history == null || history.size() < 2) return NEUTRAL;
        Map<DayOfWeek, Integer> counts = new EnumMap<>(DayOfWeek.class);
        for (var h : history) {
            if (h.getServiceDate() == null) continue;
            counts.merge(h.getServiceDate().getDayOfWeek(), 1, Integer::sum);
        }
        if (counts.isEmpty()) return NEUTRAL;
        double mean = counts.values().stream().mapToInt(Integer::intValue).average().orElse(0);
        if (mean <= 0) return NEUTRAL;
        double variance = counts.values().stream()
                .mapToDouble(c -> (c - mean) * (c - mean))
                .sum() / counts.size();
        return ClockTimeUtils.clamp01(1.0 - Math.sqrt(variance) / mean);
    }
}
