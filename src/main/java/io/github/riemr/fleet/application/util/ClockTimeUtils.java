package io.github.riemr.fleet.application.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * 時刻（分）計算のユーティリティ。日付をまたぐ比較は 1 日 = 1440 分で扱う。
 */
public final class ClockTimeUtils {
    private ClockTimeUtils() {}

    public static final int MINUTES_PER_DAY = 24 * 60;
    private static final int HALF_DAY = MINUTES_PER_DAY / 2;
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public static int toMinutes(LocalTime t) {
        return t.getHour() * 60 + t.getMinute();
    }

    /** 1440 以上・負値は 1 日で折り返す */
    public static LocalTime fromMinutes(int minutes) {
        int m = Math.floorMod(minutes, MINUTES_PER_DAY);
        return LocalTime.of(m / 60, m % 60);
    }

    public static LocalTime parse(String hhmm) {
        if (hhmm == null || hhmm.isBlank()) throw new IllegalArgumentException("Time is required");
        return LocalTime.parse(hhmm.trim().length() == 4 ? "0" + hhmm.trim() : hhmm.trim(), HH_MM);
    }

    public static String format(LocalTime t) {
        return t.format(HH_MM);
    }

    /**
     * from から to への符号付きオフセット（分）。
     * 差が ±12 時間を超える場合は日付をまたいだ近い方向に補正する（23:30 → 00:30 は +60）。
     */
    public static int signedOffsetMinutes(LocalTime from, LocalTime to) {
        int diff = toMinutes(to) - toMinutes(from);
        if (diff > HALF_DAY) diff -= MINUTES_PER_DAY;
        else if (diff < -HALF_DAY) diff += MINUTES_PER_DAY;
        return diff;
    }

    public static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
