package io.github.riemr.fleet.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;

/**
 * ドライバー単位の保護ルール。違反は HOS 判定より優先されるハードストップ。
 * 空の集合は「制限なし」を意味する。
 */
@Value
@Builder
public class ProtectedRule {
    String ruleName;
    String driverId;
    @Singular Set<DayOfWeek> blockedDays;
    @Singular Set<DayOfWeek> allowedDays;
    @Singular Set<ContractClass> allowedContractClasses;
    @Singular Set<LocalTime> allowedStartTimes;
    LocalTime maxStartTime;
    LocalDate effectiveFrom;
    LocalDate effectiveTo;

    /** 適用期間（両端を含む）。未設定側は無制限。 */
    public boolean isEffectiveOn(LocalDate date) {
        if (effectiveFrom != null && date.isBefore(effectiveFrom)) return false;
        if (effectiveTo != null && date.isAfter(effectiveTo)) return false;
        return true;
    }

    public boolean appliesTo(String candidateDriverId) {
        return driverId == null || driverId.equals(candidateDriverId);
    }
}
