package io.github.riemr.fleet.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * コンプライアンス判定の共通入力。既存の割当も判定対象の割当も同じ形で扱う。
 */
@Value
@Builder
public class AssignmentSubject {
    @NonNull LocalDateTime startTimestamp;
    @NonNull LocalDateTime endTimestamp;
    double durationHours;
    @NonNull ContractClass contractClass;
    String cycleId;
    PatternGroup patternGroup;
}
