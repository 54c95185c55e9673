package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.dto.ScoredSlot;
import io.github.riemr.fleet.application.dto.SlotScoringInput;
import io.github.riemr.fleet.application.util.ConsistencyMetrics;
import io.github.riemr.fleet.domain.model.AssignmentMethod;
import io.github.riemr.fleet.domain.model.DriverScore;
import io.github.riemr.fleet.domain.model.SlotClassification;
import io.github.riemr.fleet.oracle.RankedDriver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 枠ごとの候補スコア算出。
 *
 * <pre>
 * base  = ownership * p + availability * (1 - p)
 * (ROTATING) base = 0.7 * fairness + 0.3 * (base + 0.3 * share)
 * score = base * (0.8 + 0.2 * consistency)
 * </pre>
 * 所有者の可用性が 0.5 未満の場合、所有者は 0.05 に落とし、バックアップ順位付けを要求する。
 */
@Service
@Slf4j
public class CandidateScorer {

    public ScoredSlot score(SlotScoringInput in) {
        var slot = in.getSlot();
        var dist = in.getDistribution();
        var prediction = in.getOwnerPrediction();
        String ownerId = prediction == null ? null : prediction.ownerId();
        double ownerConfidence = prediction == null ? 0.0 : prediction.confidence();
        Map<String, Double> avail = in.getAvailability() == null ? Map.of() : in.getAvailability();
        Map<String, Integer> dayCounts = in.getWeekDayCounts() == null ? Map.of() : in.getWeekDayCounts();
        double p = in.getPredictability();

        String unavailableOwner = null;
        if (ownerId != null && in.getDriverIds().contains(ownerId)
                && avail.getOrDefault(ownerId, ScoringPolicy.DEFAULT_AVAILABILITY) < ScoringPolicy.OWNER_UNAVAILABLE_THRESHOLD) {
            unavailableOwner = ownerId;
        }

        boolean useFairness = dist.getClassification() == SlotClassification.ROTATING && !dayCounts.isEmpty();
        int maxDays = Math.max(1, Collections.max(dayCounts.isEmpty() ? List.of(0) : dayCounts.values()));
        int minDays = dayCounts.isEmpty() ? 0 : Collections.min(dayCounts.values());

        List<DriverScore> scores = new ArrayList<>(in.getDriverIds().size());
        for (String driverId : in.getDriverIds()) {
            double availability = avail.getOrDefault(driverId, ScoringPolicy.DEFAULT_AVAILABILITY);
            boolean isOwner = driverId.equals(ownerId);
            double ownership = isOwner ? ownerConfidence : ScoringPolicy.NON_OWNER_OWNERSHIP;
            double base = ownership * p + availability * (1 - p);

            String reason;
            if (useFairness) {
                int myDays = dayCounts.getOrDefault(driverId, 0);
                double fairness = maxDays > minDays
                        ? ScoringPolicy.FAIRNESS_FLOOR + ScoringPolicy.FAIRNESS_SPAN * (maxDays - myDays) / (double) (maxDays - minDays)
                        : ScoringPolicy.FAIRNESS_EQUAL;
                base = ScoringPolicy.FAIRNESS_WEIGHT * fairness
                        + (1 - ScoringPolicy.FAIRNESS_WEIGHT) * (base + ScoringPolicy.SHARE_BONUS * dist.shareOf(driverId));
                reason = String.format("Rotating slot: %d days this week, share %.0f%%", myDays, dist.shareOf(driverId) * 100);
            } else if (isOwner) {
                reason = String.format("Predicted owner (%.0f%% confidence)", ownerConfidence * 100);
            } else {
                reason = String.format("Availability %.0f%%", availability * 100);
            }

            double consistency = ConsistencyMetrics.consistency(
                    in.getHistories() == null ? List.of() : in.getHistories().getOrDefault(driverId, List.of()));
            double score = base * (ScoringPolicy.CONSISTENCY_BASE + ScoringPolicy.CONSISTENCY_WEIGHT * consistency);

            if (driverId.equals(unavailableOwner)) {
                score = ScoringPolicy.UNAVAILABLE_OWNER_SCORE;
                reason = String.format("Owner unavailable (%.0f%% availability)", availability * 100);
            }

            scores.add(DriverScore.builder()
                    .driverId(driverId)
                    .score(Math.max(0.0, score))
                    .ownershipComponent(ownership)
                    .method(AssignmentMethod.DIRECT)
                    .reason(reason)
                    .build());
        }
        scores.sort(DriverScore.RANKING);
        if (unavailableOwner != null) {
            log.debug("Slot {}: owner {} unavailable, backup ranking required", slot.getSlotId(), unavailableOwner);
        }
        return new ScoredSlot(slot, dist, scores, unavailableOwner);
    }

    /**
     * バックアップ順位を [0.3, 0.9] に正規化して候補スコアを置き換える。所有者は 0.05 のまま。
     * 順位付けが空（失敗）の場合は元のスコアを維持する。
     */
    public ScoredSlot applyBackupRanking(ScoredSlot scored, List<RankedDriver> rankings) {
        if (!scored.needsBackupRanking() || rankings == null || rankings.isEmpty()) return scored;
        double min = rankings.stream().mapToDouble(RankedDriver::score).min().orElse(0);
        double max = rankings.stream().mapToDouble(RankedDriver::score).max().orElse(0);
        double range = max - min;
        if (range == 0) range = 1;

        Map<String, Double> normalized = new HashMap<>();
        for (var r : rankings) {
            normalized.put(r.driverId(), ScoringPolicy.BACKUP_FLOOR + ScoringPolicy.BACKUP_SPAN * (r.score() - min) / range);
        }

        List<DriverScore> out = new ArrayList<>(scored.candidates().size());
        for (var c : scored.candidates()) {
            if (c.getDriverId().equals(scored.unavailableOwnerId())) {
                out.add(c.toBuilder().score(ScoringPolicy.UNAVAILABLE_OWNER_SCORE).build());
                continue;
            }
            Double n = normalized.get(c.getDriverId());
            out.add(n == null ? c : c.toBuilder()
                    .score(n)
                    .reason(String.format("Backup ranking (owner %s unavailable)", scored.unavailableOwnerId()))
                    .build());
        }
        out.sort(DriverScore.RANKING);
        return scored.withCandidates(out);
    }
}
