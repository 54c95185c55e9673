package io.github.riemr.fleet.application.dto;

import io.github.riemr.fleet.domain.model.DriverProfile;
import io.github.riemr.fleet.domain.model.HistoryEntry;
import io.github.riemr.fleet.domain.model.ProtectedRule;
import io.github.riemr.fleet.domain.model.SchedulingSettings;
import io.github.riemr.fleet.domain.model.Slot;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * 計画パスの入力。
 */
@Value
@Builder
public class PlanningPassInput {
    /** 割当対象の枠 */
    @Singular List<Slot> slots;
    @Singular List<DriverProfile> drivers;
    /** driverId -> 履歴 */
    @Singular Map<String, List<HistoryEntry>> histories;
    /** slotKey -> 既に確保しているドライバー */
    @Singular("assignedSlot") Map<String, String> assignedSlots;
    /** bump 先の候補となる枠。空の場合は slots を使う */
    @Singular List<Slot> siblingSlots;
    @Singular List<ProtectedRule> protectedRules;
    SchedulingSettings settings;
    /** 履歴の期間の基準日。null の場合は最も早い serviceDate */
    LocalDate referenceDate;
}
