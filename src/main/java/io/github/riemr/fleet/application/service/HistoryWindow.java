package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.domain.model.HistoryEntry;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 履歴を直近 memoryWeeks 週に絞る。日付不明の履歴は残す。
 */
@Service
public class HistoryWindow {

    public List<HistoryEntry> apply(List<HistoryEntry> history, int memoryWeeks, LocalDate referenceDate) {
        if (history == null || history.isEmpty()) return List.of();
        LocalDate cutoff = referenceDate.minusDays(memoryWeeks * 7L);
        return history.stream()
                .filter(h -> h.getServiceDate() == null || !h.getServiceDate().isBefore(cutoff))
                .toList();
    }

    public Map<String, List<HistoryEntry>> applyAll(Map<String, List<HistoryEntry>> histories, int memoryWeeks,
                                                    LocalDate referenceDate) {
        Map<String, List<HistoryEntry>> out = new LinkedHashMap<>();
        if (histories == null) return out;
        histories.forEach((driverId, h) -> out.put(driverId, apply(h, memoryWeeks, referenceDate)));
        return out;
    }
}
