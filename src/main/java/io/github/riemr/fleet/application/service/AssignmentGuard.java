package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.domain.model.AssignmentSubject;
import io.github.riemr.fleet.domain.model.GuardResult;
import io.github.riemr.fleet.domain.model.ProtectedRule;
import io.github.riemr.fleet.domain.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 割当可否の判定順序: 既割当 → 保護ルール（ハードストップ） → 休息 → HOS。
 * 休息の WARNING は HOS の結果にマージする。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssignmentGuard {

    private final ProtectedRuleEvaluator protectedRuleEvaluator;
    private final ComplianceValidator complianceValidator;

    public GuardResult validate(String driverId, AssignmentSubject proposed, List<AssignmentSubject> existing,
                             List<ProtectedRule> rules, boolean alreadyAssigned) {
        if (alreadyAssigned) {
            return new GuardResult(false, List.of(),
                    ValidationResult.violation("Block is already assigned to another driver"));
        }

        var ruleViolations = protectedRuleEvaluator.evaluate(driverId, proposed, rules);
        if (!ruleViolations.isEmpty()) {
            log.debug("Protected rule hard stop for driver {}: {}", driverId, ruleViolations);
            return new GuardResult(false, List.copyOf(ruleViolations),
                    ValidationResult.violation("Protected rule violation"));
        }

        var rest = complianceValidator.validateRestRule(proposed, existing);
        if (!rest.isValid()) {
            return new GuardResult(false, List.of(), rest);
        }

        var rolling = complianceValidator.validateRollingHos(proposed, existing);
        var merged = rest.getMessages().isEmpty() ? rolling : rolling.merge(rest);
        return new GuardResult(merged.isValid(), List.of(), merged);
    }
}
