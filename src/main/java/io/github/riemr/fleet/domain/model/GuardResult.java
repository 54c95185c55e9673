package io.github.riemr.fleet.domain.model;

import lombok.Value;

import java.util.List;

/**
 * 割当可否の総合判定。protectedRuleViolations が空でない場合はハードストップ。
 */
@Value
public class GuardResult {
    boolean canAssign;
    List<String> protectedRuleViolations;
    ValidationResult compliance;

    public boolean isHardStop() {
        return !protectedRuleViolations.isEmpty();
    }
}
