package io.github.riemr.fleet.oracle;

/**
 * ドライバーの勤務パターン推定。typicalDaysPerWeek が null なら不明。
 */
public record DriverPattern(String driverId, Integer typicalDaysPerWeek, double confidence) {

    public static DriverPattern unknown(String driverId) {
        return new DriverPattern(driverId, null, 0.0);
    }
}
