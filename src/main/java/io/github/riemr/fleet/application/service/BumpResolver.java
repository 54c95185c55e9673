package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.dto.BumpCandidate;
import io.github.riemr.fleet.application.dto.BumpContext;
import io.github.riemr.fleet.application.dto.ScoredSlot;
import io.github.riemr.fleet.application.util.ClockTimeUtils;
import io.github.riemr.fleet.domain.model.AssignmentMethod;
import io.github.riemr.fleet.domain.model.DriverScore;
import io.github.riemr.fleet.domain.model.SlotClassification;
import io.github.riemr.fleet.domain.model.Slot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 枠が既に確保されている場合の候補調整。
 * <ul>
 *   <li>確保しているドライバー本人は候補から外す</li>
 *   <li>所有者（またはシェア 30% 超）は ±H 時間内の空き枠へ bump し、距離と競合でペナルティ</li>
 *   <li>それ以外は score × 0.5 のフォールバック</li>
 * </ul>
 */
@Service
@Slf4j
public class BumpResolver {

    private static final Comparator<BumpCandidate> PREFERENCE =
            Comparator.comparing((BumpCandidate b) -> !b.open())
                    .thenComparingDouble(BumpCandidate::totalPenalty)
                    .thenComparingInt(b -> Math.abs(b.offsetMinutes()))
                    .thenComparing(b -> b.slot().slotKey());

    public List<DriverScore> resolve(ScoredSlot scored, BumpContext ctx, int timeFlexibilityHours) {
        Slot home = scored.slot();
        String holder = ctx.takenSlots().get(home.slotKey());
        if (holder == null) return scored.candidates();

        var dist = scored.distribution();
        List<DriverScore> out = new ArrayList<>();
        for (var c : scored.candidates()) {
            String driverId = c.getDriverId();
            if (driverId.equals(holder)) continue;

            boolean eligible = driverId.equals(dist.getOwnerId())
                    || dist.shareOf(driverId) > ScoringPolicy.BUMP_ELIGIBLE_SHARE;
            if (eligible && timeFlexibilityHours > 0) {
                out.add(bump(home, c, timeFlexibilityHours, ctx));
            } else {
                out.add(c.toBuilder()
                        .score(c.getScore() * ScoringPolicy.NON_OWNER_TAKEN_FACTOR)
                        .bumpPenalty(ScoringPolicy.NON_OWNER_TAKEN_FACTOR)
                        .method(AssignmentMethod.FALLBACK)
                        .reason("Non-owner, slot taken")
                        .build());
            }
        }
        out.sort(DriverScore.RANKING);
        return out;
    }

    /**
     * 最良の空き枠へ bump したスコアを返す。空き枠が無い場合は score × 0.3 のフォールバック。
     */
    public DriverScore bump(Slot home, DriverScore base, int timeFlexibilityHours, BumpContext ctx) {
        var candidates = findCandidates(home, base.getDriverId(), timeFlexibilityHours, ctx);
        var best = candidates.stream().filter(BumpCandidate::open).findFirst().orElse(null);
        if (best == null) {
            return base.toBuilder()
                    .score(base.getScore() * ScoringPolicy.NO_BUMP_SCORE_FACTOR)
                    .bumpPenalty(ScoringPolicy.NO_BUMP_PENALTY)
                    .bumpMinutes(0)
                    .method(AssignmentMethod.FALLBACK)
                    .reason("No bump slots available within ±" + timeFlexibilityHours + "h")
                    .build();
        }

        var targetDist = ctx.distributionOf(best.slot().slotKey());
        String reason = String.format("Bumped %s%dmin to %s", best.offsetMinutes() > 0 ? "+" : "",
                best.offsetMinutes(), ClockTimeUtils.format(best.slot().getCanonicalStartTime()));
        if (targetDist.getClassification() == SlotClassification.ROTATING) {
            reason += " (rotating slot)";
        } else if (best.conflictPenalty() > 0 && targetDist.getOwnerId() != null) {
            reason += " (conflicts with " + targetDist.getOwnerId() + "'s slot)";
        }
        log.debug("Driver {} bumped from {} to {} (penalty {})", base.getDriverId(), home.slotKey(),
                best.slot().slotKey(), best.totalPenalty());

        return base.toBuilder()
                .score(Math.max(0.0, base.getScore() - best.totalPenalty()))
                .bumpPenalty(best.totalPenalty())
                .bumpMinutes(best.offsetMinutes())
                .method(AssignmentMethod.BUMPED)
                .reason(reason)
                .bumpTargetSlotKey(best.slot().slotKey())
                .build();
    }

    /**
     * 同じ契約区分・曜日で ±H 時間以内の枠を列挙する。
     * 並び順: 空き枠優先 → 合計ペナルティ昇順 → |オフセット| 昇順。
     */
    public List<BumpCandidate> findCandidates(Slot home, String driverId, int timeFlexibilityHours, BumpContext ctx) {
        int window = timeFlexibilityHours * 60;
        String homeKey = home.slotKey();
        List<BumpCandidate> out = new ArrayList<>();
        java.util.Set<String> seen = new java.util.HashSet<>();
        for (var s : ctx.siblingSlots()) {
            String key = s.slotKey();
            if (key.equals(homeKey) || !seen.add(key)) continue;
            if (s.getContractClass() != home.getContractClass() || s.getDayOfWeek() != home.getDayOfWeek()) continue;

            int offset = ClockTimeUtils.signedOffsetMinutes(home.getCanonicalStartTime(), s.getCanonicalStartTime());
            if (Math.abs(offset) > window) continue;

            boolean open = !ctx.takenSlots().containsKey(key);
            var dist = ctx.distributionOf(key);
            double conflict;
            if (!open) {
                conflict = ScoringPolicy.TAKEN_CONFLICT_PENALTY;
            } else if (dist.getClassification() == SlotClassification.OWNED && !driverId.equals(dist.getOwnerId())) {
                conflict = ScoringPolicy.OWNED_CONFLICT_PENALTY;
            } else {
                conflict = 0.0;
            }
            double distance = Math.abs(offset) / 60.0 * ScoringPolicy.DISTANCE_PENALTY_PER_HOUR;
            out.add(new BumpCandidate(s, offset, open, distance, conflict));
        }
        out.sort(PREFERENCE);
        return out;
    }
}
