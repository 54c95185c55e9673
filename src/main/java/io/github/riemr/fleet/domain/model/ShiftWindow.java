package io.github.riemr.fleet.domain.model;

import io.github.riemr.fleet.application.util.ClockTimeUtils;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 1 日分の勤務。分単位で保持し、日付をまたぐ場合 endMinutes は 1440 を超える。
 */
@Value
public class ShiftWindow {
    LocalDate date;
    int startMinutes;
    int endMinutes;

    public static ShiftWindow of(LocalDate date, LocalTime start, LocalTime end) {
        int s = ClockTimeUtils.toMinutes(start);
        int e = ClockTimeUtils.toMinutes(end);
        if (e <= s) e += ClockTimeUtils.MINUTES_PER_DAY;
        return new ShiftWindow(date, s, e);
    }

    public static ShiftWindow ofLength(LocalDate date, int startMinutes, int lengthMinutes) {
        return new ShiftWindow(date, startMinutes, startMinutes + lengthMinutes);
    }

    public boolean crossesMidnight() {
        return endMinutes > ClockTimeUtils.MINUTES_PER_DAY;
    }

    public double durationHours() {
        return (endMinutes - startMinutes) / 60.0;
    }

    @Override
    public String toString() {
        return date + " " + ClockTimeUtils.format(ClockTimeUtils.fromMinutes(startMinutes))
                + "-" + ClockTimeUtils.format(ClockTimeUtils.fromMinutes(endMinutes))
                + (crossesMidnight() ? "(+1)" : "");
    }
}
