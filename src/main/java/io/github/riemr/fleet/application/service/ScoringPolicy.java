package io.github.riemr.fleet.application.service;

/**
 * スコアリング・bump・制約判定で使う定数。
 */
public final class ScoringPolicy {
    private ScoringPolicy() {}

    // ---- Candidate scoring ----
    public static final double NON_OWNER_OWNERSHIP = 0.1;
    public static final double DEFAULT_AVAILABILITY = 0.5;
    public static final double OWNER_UNAVAILABLE_THRESHOLD = 0.5;
    public static final double UNAVAILABLE_OWNER_SCORE = 0.05;
    public static final double CONSISTENCY_BASE = 0.8;
    public static final double CONSISTENCY_WEIGHT = 0.2;

    // rotating slot fairness
    public static final double FAIRNESS_WEIGHT = 0.7;
    public static final double FAIRNESS_FLOOR = 0.2;
    public static final double FAIRNESS_SPAN = 0.8;
    public static final double FAIRNESS_EQUAL = 0.6;
    public static final double SHARE_BONUS = 0.3;

    // backup ranking normalization: [0.3, 0.9]
    public static final double BACKUP_FLOOR = 0.3;
    public static final double BACKUP_SPAN = 0.6;

    // ---- Bump ----
    public static final double BUMP_ELIGIBLE_SHARE = 0.3;
    public static final double DISTANCE_PENALTY_PER_HOUR = 0.1;
    public static final double TAKEN_CONFLICT_PENALTY = 0.5;
    public static final double OWNED_CONFLICT_PENALTY = 0.2;
    public static final double NO_BUMP_SCORE_FACTOR = 0.3;
    public static final double NO_BUMP_PENALTY = 0.7;
    public static final double NON_OWNER_TAKEN_FACTOR = 0.5;

    // ---- Day cap ----
    public static final int DEFAULT_TYPICAL_DAYS = 4;
    public static final int MIN_DAY_CAP = 4;
    public static final int MAX_DAY_CAP = 6;
    // oracle からパターンが得られない場合の上限
    public static final int FALLBACK_DAY_CAP = 6;

    // ---- HOS ----
    public static final double HOS_WARNING_RATIO = 0.9;
    public static final double REST_WARNING_MARGIN_HOURS = 1.0;

    // ---- Solver ----
    public static final long SCORE_SCALE = 10_000L;

    public static int dayCap(Integer typicalDaysPerWeek) {
        int typical = typicalDaysPerWeek == null ? DEFAULT_TYPICAL_DAYS : typicalDaysPerWeek;
        return Math.max(MIN_DAY_CAP, Math.min(MAX_DAY_CAP, typical));
    }
}
