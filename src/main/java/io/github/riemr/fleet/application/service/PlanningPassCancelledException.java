package io.github.riemr.fleet.application.service;

/**
 * 計画パスが呼び出し側によって中断された。
 */
public class PlanningPassCancelledException extends RuntimeException {
    private final String passId;

    public PlanningPassCancelledException(String passId, String stage) {
        super("Planning pass " + passId + " cancelled during " + stage);
        this.passId = passId;
    }

    public String getPassId() {
        return passId;
    }
}
