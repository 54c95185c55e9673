package io.github.riemr.fleet.domain.model;

import io.github.riemr.fleet.application.util.ClockTimeUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Locale;

/**
 * 割当対象の枠。contractClass・resourceId・canonicalStartTime・dayOfWeek の組で
 * 週をまたいで同一の「スロット」として扱う。
 */
@Value
@Builder(toBuilder = true)
public class Slot {
    @NonNull String slotId;
    @NonNull ContractClass contractClass;
    @NonNull String resourceId;
    @NonNull LocalTime canonicalStartTime;
    @NonNull DayOfWeek dayOfWeek;
    @NonNull LocalDate serviceDate;

    /** 週をまたいで安定なキー: {@code contractClass_resourceId_HH:mm_dayOfWeek} */
    public String slotKey() {
        return contractClass.getCode() + "_" + resourceId + "_"
                + ClockTimeUtils.format(canonicalStartTime) + "_"
                + dayOfWeek.name().toLowerCase(Locale.ROOT);
    }

    public int startMinutes() {
        return ClockTimeUtils.toMinutes(canonicalStartTime);
    }
}
