package io.github.riemr.fleet.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * ある枠に対するドライバー候補のスコア。score は 0 以上（輪番枠では 1 を超えうる）。
 */
@Value
@Builder(toBuilder = true)
public class DriverScore {

    /** score 降順、同点は driverId 昇順 */
    public static final Comparator<DriverScore> RANKING =
            Comparator.comparingDouble(DriverScore::getScore).reversed()
                    .thenComparing(DriverScore::getDriverId);

    String driverId;
    double score;
    double ownershipComponent;
    double bumpPenalty;
    int bumpMinutes;
    AssignmentMethod method;
    String reason;
    // bump 先（method == BUMPED の時のみ）
    String bumpTargetSlotKey;
}
