package io.github.riemr.fleet.application.util;

import io.github.riemr.fleet.domain.model.AssignmentSubject;
import io.github.riemr.fleet.domain.model.ContractClass;
import io.github.riemr.fleet.domain.model.PatternGroup;
import io.github.riemr.fleet.domain.model.ShiftWindow;
import io.github.riemr.fleet.domain.model.Slot;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 各種入力から {@link AssignmentSubject} への変換。所要時間は小数 4 桁で丸める。
 */
public final class AssignmentSubjects {
    private AssignmentSubjects() {}

    public static AssignmentSubject fromShiftWindow(ShiftWindow w, ContractClass contractClass) {
        LocalDateTime start = w.getDate().atStartOfDay().plusMinutes(w.getStartMinutes());
        LocalDateTime end = w.getDate().atStartOfDay().plusMinutes(w.getEndMinutes());
        return of(start, end, contractClass, null, null);
    }

    public static AssignmentSubject fromSlot(Slot slot, int bumpMinutes, int shiftLengthMinutes) {
        LocalDateTime start = slot.getServiceDate().atTime(slot.getCanonicalStartTime()).plusMinutes(bumpMinutes);
        return of(start, start.plusMinutes(shiftLengthMinutes), slot.getContractClass(), null,
                patternGroupOf(slot));
    }

    /** 外部表記の契約区分（"Solo 1" など）を伴う入力用 */
    public static AssignmentSubject fromRaw(LocalDateTime start, LocalDateTime end, String rawContractClass,
                                            String cycleId) {
        return of(start, end, ContractClass.parse(rawContractClass), cycleId, null);
    }

    public static AssignmentSubject of(LocalDateTime start, LocalDateTime end, ContractClass contractClass,
                                       String cycleId, PatternGroup patternGroup) {
        if (end.isBefore(start)) throw new IllegalArgumentException("End precedes start: " + start + " > " + end);
        double hours = Duration.between(start, end).toMinutes() / 60.0;
        return AssignmentSubject.builder()
                .startTimestamp(start)
                .endTimestamp(end)
                .durationHours(ClockTimeUtils.round(hours, 4))
                .contractClass(contractClass)
                .cycleId(cycleId)
                .patternGroup(patternGroup)
                .build();
    }

    /** 日〜火は前半、木〜土は後半。水曜は両群の境界なので前半扱い。 */
    public static PatternGroup patternGroupOf(Slot slot) {
        switch (slot.getDayOfWeek()) {
            case THURSDAY:
            case FRIDAY:
            case SATURDAY:
                return PatternGroup.WED_SAT;
            default:
                return PatternGroup.SUN_WED;
        }
    }
}
