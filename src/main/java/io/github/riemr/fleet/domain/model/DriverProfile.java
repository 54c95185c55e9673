package io.github.riemr.fleet.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DriverProfile {
    @NonNull String driverId;
    @NonNull ContractClass contractClass;
    // null の場合は oracle のパターン推定を使う
    Integer typicalDaysPerWeek;
    List<ShiftWindow> shiftsThisWeek;
}
