package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.util.AssignmentSubjects;
import io.github.riemr.fleet.domain.model.AssignmentSubject;
import io.github.riemr.fleet.domain.model.ContractClass;
import io.github.riemr.fleet.domain.model.ProtectedRule;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProtectedRuleEvaluatorTest {

    // 2025-06-09 は月曜
    private static final LocalDateTime MONDAY_0700 = LocalDateTime.of(2025, 6, 9, 7, 0);

    private final ProtectedRuleEvaluator evaluator = new ProtectedRuleEvaluator();

    private static AssignmentSubject subject(LocalDateTime start, ContractClass cc) {
        return AssignmentSubjects.of(start, start.plusHours(8), cc, null, null);
    }

    @Test
    void blockedDay() {
        var rule = ProtectedRule.builder().ruleName("No Mondays").driverId("D1").blockedDay(DayOfWeek.MONDAY).build();
        var v = evaluator.evaluate("D1", subject(MONDAY_0700, ContractClass.CLASS_A), List.of(rule));
        assertThat(v).containsExactly("Rule \"No Mondays\": driver cannot work on Monday");
    }

    @Test
    void allowedDaysAndContractAndStartTimes() {
        var rule = ProtectedRule.builder().ruleName("Weekend only").driverId("D1")
                .allowedDay(DayOfWeek.SATURDAY).allowedDay(DayOfWeek.SUNDAY)
                .allowedContractClass(ContractClass.CLASS_B)
                .allowedStartTime(LocalTime.of(16, 30))
                .build();
        var v = evaluator.evaluate("D1", subject(MONDAY_0700, ContractClass.CLASS_A), List.of(rule));
        assertThat(v).hasSize(3);
        assertThat(v.get(0)).startsWith("Rule \"Weekend only\": driver can only work on");
        assertThat(v.get(1)).isEqualTo("Rule \"Weekend only\": driver cannot work classA blocks");
        assertThat(v.get(2)).isEqualTo("Rule \"Weekend only\": start time 07:00 not in allowed times 16:30");
    }

    @Test
    void maxStartTime() {
        var rule = ProtectedRule.builder().ruleName("Early").driverId("D1").maxStartTime(LocalTime.of(6, 0)).build();
        var v = evaluator.evaluate("D1", subject(MONDAY_0700, ContractClass.CLASS_A), List.of(rule));
        assertThat(v).containsExactly("Rule \"Early\": start time 07:00 is after max 06:00");
    }

    @Test
    void rulesOutsideEffectiveRange_orForOtherDrivers_areIgnored() {
        var expired = ProtectedRule.builder().ruleName("Old").driverId("D1").blockedDay(DayOfWeek.MONDAY)
                .effectiveTo(LocalDate.of(2025, 6, 8)).build();
        var future = ProtectedRule.builder().ruleName("Later").driverId("D1").blockedDay(DayOfWeek.MONDAY)
                .effectiveFrom(LocalDate.of(2025, 6, 10)).build();
        var other = ProtectedRule.builder().ruleName("Other").driverId("D2").blockedDay(DayOfWeek.MONDAY).build();

        assertThat(evaluator.evaluate("D1", subject(MONDAY_0700, ContractClass.CLASS_A), List.of(expired, future, other)))
                .isEmpty();
    }

    @Test
    void effectiveRangeIsInclusive() {
        var rule = ProtectedRule.builder().ruleName("Today").driverId("D1").blockedDay(DayOfWeek.MONDAY)
                .effectiveFrom(LocalDate.of(2025, 6, 9)).effectiveTo(LocalDate.of(2025, 6, 9)).build();
        assertThat(evaluator.evaluate("D1", subject(MONDAY_0700, ContractClass.CLASS_A), List.of(rule))).hasSize(1);
    }
}
