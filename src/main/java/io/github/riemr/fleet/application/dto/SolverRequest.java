package io.github.riemr.fleet.application.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * 組合せ最適化への入力。scoreMatrix は slotId -> (driverId -> score)。
 * scoreMatrix に現れない組合せは割当不可。
 */
public record SolverRequest(List<SolverSlot> slots, List<SolverDriver> drivers,
                            Map<String, Map<String, Double>> scoreMatrix, int minDaysPerDriver) {

    public record SolverSlot(String slotId, LocalDate serviceDate) {
    }

    /** maxNewDays: 今週追加できる稼働日数（上限 - 既存日数） */
    public record SolverDriver(String driverId, int maxNewDays) {
    }
}
