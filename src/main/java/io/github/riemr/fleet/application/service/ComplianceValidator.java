package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.util.ClockTimeUtils;
import io.github.riemr.fleet.domain.model.AssignmentSubject;
import io.github.riemr.fleet.domain.model.ValidationResult;
import io.github.riemr.fleet.domain.model.ValidationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 乗務時間（HOS）のローリング窓判定と休息時間判定。
 *
 * <ul>
 *   <li>classA: 直前 24 時間で 14 時間まで</li>
 *   <li>classB: 直前 48 時間で 38 時間まで</li>
 * </ul>
 * 上限の 90% 以上は WARNING、上限超過は VIOLATION。
 */
@Service
@Slf4j
public class ComplianceValidator {

    public static final String METRIC_DUTY_HOURS = "dutyHoursInWindow";
    public static final String METRIC_PROPOSED_HOURS = "proposedHours";
    public static final String METRIC_TOTAL_HOURS = "totalHours";
    public static final String METRIC_LIMIT_HOURS = "limitHours";
    public static final String METRIC_LOOKBACK_HOURS = "lookbackHours";
    public static final String METRIC_REST_HOURS = "restHours";

    private final double minRestHours;

    public ComplianceValidator(@Value("${fleet.planner.min-rest-hours:10}") double minRestHours) {
        this.minRestHours = minRestHours;
    }

    /**
     * [windowStart, windowEnd) に重なる勤務時間の合計（小数 4 桁）。
     */
    public double dutyHours(List<AssignmentSubject> assignments, LocalDateTime windowStart, LocalDateTime windowEnd) {
        long minutes = 0;
        for (var a : assignments) {
            LocalDateTime s = a.getStartTimestamp().isAfter(windowStart) ? a.getStartTimestamp() : windowStart;
            LocalDateTime e = a.getEndTimestamp().isBefore(windowEnd) ? a.getEndTimestamp() : windowEnd;
            if (e.isAfter(s)) minutes += Duration.between(s, e).toMinutes();
        }
        return ClockTimeUtils.round(minutes / 60.0, 4);
    }

    public ValidationResult validateRollingHos(AssignmentSubject proposed, List<AssignmentSubject> existing) {
        var contract = proposed.getContractClass();
        LocalDateTime anchor = proposed.getStartTimestamp();
        double inWindow = dutyHours(existing, anchor.minusHours(contract.getLookbackHours()), anchor);
        double total = ClockTimeUtils.round(inWindow + proposed.getDurationHours(), 4);
        double limit = contract.getLimitHours();

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(METRIC_DUTY_HOURS, inWindow);
        metrics.put(METRIC_PROPOSED_HOURS, proposed.getDurationHours());
        metrics.put(METRIC_TOTAL_HOURS, total);
        metrics.put(METRIC_LIMIT_HOURS, limit);
        metrics.put(METRIC_LOOKBACK_HOURS, (double) contract.getLookbackHours());

        List<String> messages = new ArrayList<>();
        ValidationStatus status;
        if (total > limit) {
            status = ValidationStatus.VIOLATION;
            messages.add(String.format("HOS violation: %.2fh in %dh window exceeds %.0fh limit for %s",
                    total, contract.getLookbackHours(), limit, contract));
        } else if (total >= limit * ScoringPolicy.HOS_WARNING_RATIO) {
            status = ValidationStatus.WARNING;
            messages.add(String.format("HOS warning: %.2fh in %dh window is within 10%% of %.0fh limit for %s",
                    total, contract.getLookbackHours(), limit, contract));
        } else {
            status = ValidationStatus.VALID;
        }
        return ValidationResult.of(status, messages, metrics);
    }

    public ValidationResult validateRestRule(AssignmentSubject proposed, List<AssignmentSubject> existing) {
        return validateRestRule(proposed, existing, minRestHours);
    }

    /**
     * 提案開始時刻以前に終了した直近の勤務との間隔を判定する。
     * 最低休息未満は VIOLATION、最低休息 + 1 時間未満は WARNING。
     */
    public ValidationResult validateRestRule(AssignmentSubject proposed, List<AssignmentSubject> existing,
                                             double minRest) {
        LocalDateTime start = proposed.getStartTimestamp();
        LocalDateTime latestEnd = null;
        for (var a : existing) {
            var end = a.getEndTimestamp();
            if (end.isAfter(start)) continue;
            if (latestEnd == null || end.isAfter(latestEnd)) latestEnd = end;
        }
        if (latestEnd == null) return ValidationResult.valid();

        double rest = ClockTimeUtils.round(Duration.between(latestEnd, start).toMinutes() / 60.0, 4);
        Map<String, Double> metrics = Map.of(METRIC_REST_HOURS, rest);
        if (rest < minRest) {
            return ValidationResult.of(ValidationStatus.VIOLATION,
                    List.of(String.format("Rest violation: only %.1fh since previous shift (requires %.0fh)", rest, minRest)),
                    metrics);
        }
        if (rest < minRest + ScoringPolicy.REST_WARNING_MARGIN_HOURS) {
            return ValidationResult.of(ValidationStatus.WARNING,
                    List.of(String.format("Rest warning: %.1fh since previous shift is close to %.0fh minimum", rest, minRest)),
                    metrics);
        }
        return ValidationResult.of(ValidationStatus.VALID, List.of(), metrics);
    }
}
