package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.util.ClockTimeUtils;
import io.github.riemr.fleet.domain.model.DriverConstraints;
import io.github.riemr.fleet.domain.model.FilterResult;
import io.github.riemr.fleet.domain.model.ShiftWindow;
import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.ViolationKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * 候補ごとのハード制約チェック。判定順は 契約区分 → 週の日数上限 → 重複 → 休息。
 * 最初に失敗した制約の理由を返し、例外は投げない。
 */
@Service
public class ConstraintFilter {

    private static final int DAY = ClockTimeUtils.MINUTES_PER_DAY;

    private final int shiftLengthMinutes;
    private final double minRestHours;

    public ConstraintFilter(@Value("${fleet.planner.shift-length-minutes:480}") int shiftLengthMinutes,
                            @Value("${fleet.planner.min-rest-hours:10}") double minRestHours) {
        this.shiftLengthMinutes = shiftLengthMinutes;
        this.minRestHours = minRestHours;
    }

    /** 枠の正規開始時刻（bump 分ずらす）から勤務時間帯を作る */
    public ShiftWindow windowFor(Slot slot, int bumpMinutes) {
        return ShiftWindow.ofLength(slot.getServiceDate(), slot.startMinutes() + bumpMinutes, shiftLengthMinutes);
    }

    public FilterResult check(DriverConstraints driver, Slot slot) {
        return check(driver, slot, windowFor(slot, 0), minRestHours);
    }

    public FilterResult check(DriverConstraints driver, Slot slot, ShiftWindow proposed) {
        return check(driver, slot, proposed, minRestHours);
    }

    public FilterResult check(DriverConstraints driver, Slot slot, ShiftWindow proposed, double minRest) {
        if (driver.getContractClass() != slot.getContractClass()) {
            return FilterResult.reject(ViolationKind.CONTRACT_MISMATCH,
                    "Contract mismatch: driver is " + driver.getContractClass() + ", slot is " + slot.getContractClass());
        }

        int cap = ScoringPolicy.dayCap(driver.getTypicalDaysPerWeek());
        var days = driver.getDaysAssignedThisWeek();
        int daysAfter = days.size() + (days.contains(proposed.getDate()) ? 0 : 1);
        if (daysAfter > cap) {
            return FilterResult.reject(ViolationKind.DAY_CAP,
                    "Day limit: driver already works " + days.size() + " days this week (cap " + cap + ")");
        }

        LocalDate date = proposed.getDate();
        for (var e : driver.getShiftsThisWeek()) {
            if (overlaps(e, proposed)) {
                return FilterResult.reject(ViolationKind.DOUBLE_BOOKING,
                        "Double-booking: overlaps existing shift " + e);
            }
        }

        double minRestMinutes = minRest * 60.0;
        for (var e : driver.getShiftsThisWeek()) {
            Integer restMinutes = null;
            if (e.getDate().equals(date.minusDays(1))) {
                restMinutes = DAY + proposed.getStartMinutes() - e.getEndMinutes();
            } else if (e.getDate().equals(date.plusDays(1))) {
                restMinutes = DAY + e.getStartMinutes() - proposed.getEndMinutes();
            }
            if (restMinutes != null && restMinutes >= 0 && restMinutes < minRestMinutes) {
                return FilterResult.reject(ViolationKind.REST,
                        String.format("Rest violation: %.1fh between %s and proposed %s (requires %.0fh)",
                                restMinutes / 60.0, e, proposed, minRest));
            }
        }
        return FilterResult.ok();
    }

    /**
     * 同日・前日（深夜またぎ）・翌日（提案側の深夜またぎ）の重なりを判定する。
     */
    private static boolean overlaps(ShiftWindow existing, ShiftWindow proposed) {
        long dayDiff = existing.getDate().toEpochDay() - proposed.getDate().toEpochDay();
        if (dayDiff < -1 || dayDiff > 1) return false;
        int offset = (int) dayDiff * DAY;
        int es = existing.getStartMinutes() + offset;
        int ee = existing.getEndMinutes() + offset;
        return proposed.getStartMinutes() < ee && proposed.getEndMinutes() > es;
    }
}
