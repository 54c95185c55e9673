package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.util.ClockTimeUtils;
import io.github.riemr.fleet.domain.model.AssignmentSubject;
import io.github.riemr.fleet.domain.model.ProtectedRule;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Service
public class ProtectedRuleEvaluator {

    /**
     * 適用期間内のルールについて違反メッセージを返す。空リストなら違反なし。
     */
    public List<String> evaluate(String driverId, AssignmentSubject subject, List<ProtectedRule> rules) {
        if (rules == null || rules.isEmpty()) return List.of();
        LocalDate date = subject.getStartTimestamp().toLocalDate();
        DayOfWeek dow = date.getDayOfWeek();
        LocalTime start = subject.getStartTimestamp().toLocalTime();
        List<String> violations = new ArrayList<>();

        for (var rule : rules) {
            if (!rule.appliesTo(driverId) || !rule.isEffectiveOn(date)) continue;
            String prefix = "Rule \"" + rule.getRuleName() + "\": ";

            if (rule.getBlockedDays().contains(dow)) {
                violations.add(prefix + "driver cannot work on " + dayName(dow));
            }
            if (!rule.getAllowedDays().isEmpty() && !rule.getAllowedDays().contains(dow)) {
                violations.add(prefix + "driver can only work on " + rule.getAllowedDays().stream()
                        .sorted().map(ProtectedRuleEvaluator::dayName).collect(Collectors.joining(", ")));
            }
            if (!rule.getAllowedContractClasses().isEmpty()
                    && !rule.getAllowedContractClasses().contains(subject.getContractClass())) {
                violations.add(prefix + "driver cannot work " + subject.getContractClass() + " blocks");
            }
            LocalTime hhmm = start.withSecond(0).withNano(0);
            if (!rule.getAllowedStartTimes().isEmpty() && !rule.getAllowedStartTimes().contains(hhmm)) {
                violations.add(prefix + "start time " + ClockTimeUtils.format(hhmm) + " not in allowed times "
                        + rule.getAllowedStartTimes().stream().sorted().map(ClockTimeUtils::format)
                        .collect(Collectors.joining(", ")));
            }
            if (rule.getMaxStartTime() != null && hhmm.isAfter(rule.getMaxStartTime())) {
                violations.add(prefix + "start time " + ClockTimeUtils.format(hhmm) + " is after max "
                        + ClockTimeUtils.format(rule.getMaxStartTime()));
            }
        }
        return violations;
    }

    private static String dayName(DayOfWeek d) {
        return d.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
