package io.github.riemr.fleet.domain.model;

/**
 * 週の稼働日数による負荷区分。宣言順が優先度（少ないほど割当候補として優先）。
 */
public enum WorkloadLevel {
    UNDERUTILIZED,
    IDEAL,
    WARNING,
    CRITICAL;

    public static WorkloadLevel of(int daysWorked) {
        if (daysWorked == 4) return IDEAL;
        if (daysWorked == 5) return WARNING;
        if (daysWorked >= 6) return CRITICAL;
        return UNDERUTILIZED;
    }
}
