package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.util.AssignmentSubjects;
import io.github.riemr.fleet.domain.model.AssignmentSubject;
import io.github.riemr.fleet.domain.model.ContractClass;
import io.github.riemr.fleet.domain.model.ProtectedRule;
import io.github.riemr.fleet.domain.model.ValidationStatus;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AssignmentGuardTest {

    private static final LocalDateTime T = LocalDateTime.of(2025, 6, 9, 7, 0); // Monday

    private final AssignmentGuard guard =
            new AssignmentGuard(new ProtectedRuleEvaluator(), new ComplianceValidator(10));

    private static AssignmentSubject shift(LocalDateTime start, int hours) {
        return AssignmentSubjects.of(start, start.plusHours(hours), ContractClass.CLASS_A, null, null);
    }

    @Test
    void alreadyAssigned_isRejectedBeforeAnythingElse() {
        var r = guard.validate("D1", shift(T, 8), List.of(), List.of(), true);
        assertThat(r.isCanAssign()).isFalse();
        assertThat(r.isHardStop()).isFalse();
        assertThat(r.getCompliance().getMessages()).containsExactly("Block is already assigned to another driver");
    }

    @Test
    void protectedRule_takesPrecedenceOverHos() {
        var rule = ProtectedRule.builder().ruleName("No Mondays").driverId("D1").blockedDay(DayOfWeek.MONDAY).build();
        // HOS も超過しているが、保護ルールの結果だけが返る
        var existing = List.of(shift(T.minusHours(12), 10));
        var r = guard.validate("D1", shift(T, 8), existing, List.of(rule), false);

        assertThat(r.isCanAssign()).isFalse();
        assertThat(r.isHardStop()).isTrue();
        assertThat(r.getProtectedRuleViolations()).containsExactly("Rule \"No Mondays\": driver cannot work on Monday");
        assertThat(r.getCompliance().getMessages()).containsExactly("Protected rule violation");
    }

    @Test
    void restViolation_shortCircuits() {
        var existing = List.of(shift(T.minusHours(17), 8)); // 9h rest
        var r = guard.validate("D1", shift(T, 4), existing, List.of(), false);
        assertThat(r.isCanAssign()).isFalse();
        assertThat(r.getCompliance().getMetrics()).containsKey(ComplianceValidator.METRIC_REST_HOURS)
                .doesNotContainKey(ComplianceValidator.METRIC_TOTAL_HOURS);
    }

    @Test
    void restWarning_isMergedIntoHosResult() {
        var existing = List.of(shift(T.minusHours(14).minusMinutes(30), 4)); // 10.5h rest, 4h in window
        var r = guard.validate("D1", shift(T, 8), existing, List.of(), false);

        assertThat(r.isCanAssign()).isTrue();
        assertThat(r.getCompliance().getStatus()).isEqualTo(ValidationStatus.WARNING);
        assertThat(r.getCompliance().getMessages()).anyMatch(m -> m.startsWith("Rest warning"));
        assertThat(r.getCompliance().getMetrics()).containsKeys(ComplianceValidator.METRIC_TOTAL_HOURS,
                ComplianceValidator.METRIC_REST_HOURS);
    }

    @Test
    void hosViolation_blocksAssignment() {
        var existing = List.of(shift(T.minusHours(23), 11)); // ends 12h before
        var r = guard.validate("D1", shift(T, 4), existing, List.of(), false);
        assertThat(r.isCanAssign()).isFalse();
        assertThat(r.getCompliance().getStatus()).isEqualTo(ValidationStatus.VIOLATION);
        assertThat(r.getCompliance().getMessages().get(0)).startsWith("HOS violation");
    }
}
