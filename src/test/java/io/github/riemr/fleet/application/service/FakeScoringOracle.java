package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.domain.model.HistoryEntry;
import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.SlotDistribution;
import io.github.riemr.fleet.oracle.DriverPattern;
import io.github.riemr.fleet.oracle.OwnershipPrediction;
import io.github.riemr.fleet.oracle.RankedDriver;
import io.github.riemr.fleet.oracle.ScoringOracle;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 固定値を返すテスト用 oracle。未登録のキーには中立値を返す。
 */
class FakeScoringOracle implements ScoringOracle {

    final Map<String, OwnershipPrediction> owners = new ConcurrentHashMap<>();
    final Map<String, SlotDistribution> distributions = new ConcurrentHashMap<>();
    final Map<String, Double> availability = new ConcurrentHashMap<>();
    final Map<String, DriverPattern> patterns = new ConcurrentHashMap<>();
    final Map<String, List<RankedDriver>> rankings = new ConcurrentHashMap<>();

    @Override
    public OwnershipPrediction predictOwner(Slot slot) {
        return owners.getOrDefault(slot.slotKey(), OwnershipPrediction.none());
    }

    @Override
    public SlotDistribution distribution(Slot slot) {
        return distributions.getOrDefault(slot.slotKey(), SlotDistribution.unknown(slot.slotKey()));
    }

    @Override
    public double availability(String driverId, LocalDate date, List<HistoryEntry> history) {
        return availability.getOrDefault(driverId, 0.8);
    }

    @Override
    public DriverPattern pattern(String driverId) {
        return patterns.getOrDefault(driverId, DriverPattern.unknown(driverId));
    }

    @Override
    public List<RankedDriver> rankBackups(Slot slot, List<String> candidateIds, String unavailableOwnerId) {
        return rankings.getOrDefault(slot.slotKey(), List.of());
    }
}
