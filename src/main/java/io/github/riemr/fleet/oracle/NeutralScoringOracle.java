package io.github.riemr.fleet.oracle;

import io.github.riemr.fleet.application.service.ScoringPolicy;
import io.github.riemr.fleet.domain.model.HistoryEntry;
import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.SlotDistribution;

import java.time.LocalDate;
import java.util.List;

/**
 * モデル未設定時の既定実装。すべて中立値を返す。
 */
public class NeutralScoringOracle implements ScoringOracle {

    @Override
    public OwnershipPrediction predictOwner(Slot slot) {
        return OwnershipPrediction.none();
    }

    @Override
    public SlotDistribution distribution(Slot slot) {
        return SlotDistribution.unknown(slot.slotKey());
    }

    @Override
    public double availability(String driverId, LocalDate date, List<HistoryEntry> history) {
        return ScoringPolicy.DEFAULT_AVAILABILITY;
    }

    @Override
    public DriverPattern pattern(String driverId) {
        return new DriverPattern(driverId, ScoringPolicy.FALLBACK_DAY_CAP, 0.0);
    }

    @Override
    public List<RankedDriver> rankBackups(Slot slot, List<String> candidateIds, String unavailableOwnerId) {
        return List.of();
    }
}
