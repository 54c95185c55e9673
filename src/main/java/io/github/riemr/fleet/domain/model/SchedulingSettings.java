package io.github.riemr.fleet.domain.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * 1 回の計画パスの設定値。
 */
@Value
@Builder
public class SchedulingSettings {

    public static final Set<Integer> ALLOWED_MEMORY_WEEKS = Set.of(3, 5, 7, 9, 12);

    /** 所有者重視度。1.0 で所有者のみ、0.0 で可用性のみ。 */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    double predictability = 0.6;

    /** bump 許容幅（時間） */
    @Min(0)
    @Max(4)
    @Builder.Default
    int timeFlexibilityHours = 2;

    @Builder.Default
    int memoryWeeks = 7;
}
