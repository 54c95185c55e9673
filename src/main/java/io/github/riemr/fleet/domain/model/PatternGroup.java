package io.github.riemr.fleet.domain.model;

/**
 * 勤務パターン群。週の前半（日〜水）と後半（水〜土）の 2 系統。
 */
public enum PatternGroup {
    SUN_WED,
    WED_SAT;

    public PatternGroup other() {
        return this == SUN_WED ? WED_SAT : SUN_WED;
    }
}
