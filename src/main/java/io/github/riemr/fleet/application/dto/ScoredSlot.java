package io.github.riemr.fleet.application.dto;

import io.github.riemr.fleet.domain.model.DriverScore;
import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.SlotDistribution;

import java.util.List;

/**
 * @param candidates          スコア降順
 * @param unavailableOwnerId  所有者の可用性が閾値未満の場合のみ設定（バックアップ順位付けが必要）
 */
public record ScoredSlot(Slot slot, SlotDistribution distribution, List<DriverScore> candidates,
                         String unavailableOwnerId) {

    public boolean needsBackupRanking() {
        return unavailableOwnerId != null;
    }

    public ScoredSlot withCandidates(List<DriverScore> newCandidates) {
        return new ScoredSlot(slot, distribution, newCandidates, unavailableOwnerId);
    }
}
