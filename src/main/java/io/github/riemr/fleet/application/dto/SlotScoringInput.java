package io.github.riemr.fleet.application.dto;

import io.github.riemr.fleet.domain.model.HistoryEntry;
import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.SlotDistribution;
import io.github.riemr.fleet.oracle.OwnershipPrediction;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 1 枠分のスコアリング入力。oracle の結果は呼び出し側で取得済みのものを渡す。
 */
@Value
@Builder
public class SlotScoringInput {
    Slot slot;
    List<String> driverIds;
    Map<String, List<HistoryEntry>> histories;
    double predictability;
    SlotDistribution distribution;
    OwnershipPrediction ownerPrediction;
    // driverId -> 可用性。欠損は既定値
    Map<String, Double> availability;
    // driverId -> 今週の稼働日数（ローテーション枠の公平性に使う）
    Map<String, Integer> weekDayCounts;
}
