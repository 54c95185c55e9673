package io.github.riemr.fleet.oracle;

import io.github.riemr.fleet.domain.model.HistoryEntry;
import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.SlotDistribution;

import java.time.LocalDate;
import java.util.List;

/**
 * 学習済みモデル（所有者予測・分布・可用性・パターン・バックアップ順位付け）への入口。
 * 実装はブロッキング呼び出しでよい。タイムアウトやフォールバックは {@link OracleGateway} が担う。
 */
public interface ScoringOracle {

    OwnershipPrediction predictOwner(Slot slot);

    SlotDistribution distribution(Slot slot);

    /** 0..1 の出勤可能性 */
    double availability(String driverId, LocalDate date, List<HistoryEntry> history);

    DriverPattern pattern(String driverId);

    /** 所有者不在の枠について候補を順位付けする。score の大小のみ意味を持つ。 */
    List<RankedDriver> rankBackups(Slot slot, List<String> candidateIds, String unavailableOwnerId);
}
