package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.dto.DriverAssignment;
import io.github.riemr.fleet.application.dto.SwapCandidate;
import io.github.riemr.fleet.application.dto.WorkloadSummary;
import io.github.riemr.fleet.application.util.ClockTimeUtils;
import io.github.riemr.fleet.domain.model.AssignmentSubject;
import io.github.riemr.fleet.domain.model.ProtectedRule;
import io.github.riemr.fleet.domain.model.ValidationStatus;
import io.github.riemr.fleet.domain.model.WorkloadLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 週（日曜〜土曜）単位の稼働状況と、枠の差し替え候補の抽出。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkloadService {

    private static final Comparator<SwapCandidate> SWAP_ORDER =
            Comparator.comparing(SwapCandidate::complianceStatus)
                    .thenComparing(c -> c.workload().workloadLevel())
                    .thenComparingInt(c -> c.workload().daysWorked())
                    .thenComparing(SwapCandidate::driverId);

    private final AssignmentGuard assignmentGuard;

    public WorkloadSummary summary(String driverId, LocalDate weekDate, List<DriverAssignment> assignments) {
        LocalDate weekStart = weekDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
        LocalDate weekEnd = weekStart.plusDays(6);
        Set<LocalDate> days = new HashSet<>();
        double hours = 0;
        List<String> slots = new ArrayList<>();
        for (var a : assignments) {
            if (!driverId.equals(a.driverId())) continue;
            LocalDate d = a.subject().getStartTimestamp().toLocalDate();
            if (d.isBefore(weekStart) || d.isAfter(weekEnd)) continue;
            days.add(d);
            hours += a.subject().getDurationHours();
            slots.add(a.slotId());
        }
        return new WorkloadSummary(driverId, days.size(), WorkloadLevel.of(days.size()),
                ClockTimeUtils.round(hours, 4), slots);
    }

    /**
     * 提案された枠を引き受けられるドライバーを列挙する。
     * 当日すでに勤務のあるドライバーは除外し、判定結果（VALID < WARNING < VIOLATION）→ 負荷区分 → 稼働日数 の順に並べる。
     */
    public List<SwapCandidate> findSwapCandidates(AssignmentSubject proposed, List<String> driverIds,
                                                  List<DriverAssignment> allAssignments, List<ProtectedRule> rules) {
        LocalDate date = proposed.getStartTimestamp().toLocalDate();
        List<SwapCandidate> out = new ArrayList<>();
        for (String driverId : driverIds) {
            boolean workingThatDay = allAssignments.stream()
                    .anyMatch(a -> driverId.equals(a.driverId())
                            && a.subject().getStartTimestamp().toLocalDate().equals(date));
            if (workingThatDay) continue;

            List<AssignmentSubject> existing = allAssignments.stream()
                    .filter(a -> driverId.equals(a.driverId()))
                    .map(DriverAssignment::subject)
                    .toList();
            List<ProtectedRule> driverRules = rules == null ? List.of()
                    : rules.stream().filter(r -> r.appliesTo(driverId)).toList();

            var guard = assignmentGuard.validate(driverId, proposed, existing, driverRules, false);
            List<String> messages = new ArrayList<>(guard.getCompliance().getMessages());
            messages.addAll(guard.getProtectedRuleViolations());
            ValidationStatus status = guard.isHardStop() ? ValidationStatus.VIOLATION : guard.getCompliance().getStatus();

            out.add(new SwapCandidate(driverId, summary(driverId, date, allAssignments), status, messages,
                    guard.getCompliance().getMetrics()));
        }
        out.sort(SWAP_ORDER);
        log.debug("Swap candidates for {}: {}", proposed.getStartTimestamp(), out.size());
        return out;
    }
}
