package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.dto.BumpContext;
import io.github.riemr.fleet.application.dto.FilterViolation;
import io.github.riemr.fleet.application.dto.HardStop;
import io.github.riemr.fleet.application.dto.PassStats;
import io.github.riemr.fleet.application.dto.PlannedAssignment;
import io.github.riemr.fleet.application.dto.PlanningPassInput;
import io.github.riemr.fleet.application.dto.PlanningPassOutput;
import io.github.riemr.fleet.application.dto.SlotScoringInput;
import io.github.riemr.fleet.application.dto.SolverRequest;
import io.github.riemr.fleet.application.dto.SolverResponse;
import io.github.riemr.fleet.application.util.AssignmentSubjects;
import io.github.riemr.fleet.domain.model.AssignmentSubject;
import io.github.riemr.fleet.domain.model.DriverConstraints;
import io.github.riemr.fleet.domain.model.DriverProfile;
import io.github.riemr.fleet.domain.model.DriverScore;
import io.github.riemr.fleet.domain.model.HistoryEntry;
import io.github.riemr.fleet.domain.model.ProtectedRule;
import io.github.riemr.fleet.domain.model.SchedulingSettings;
import io.github.riemr.fleet.domain.model.ShiftWindow;
import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.SlotClassification;
import io.github.riemr.fleet.domain.model.SlotDistribution;
import io.github.riemr.fleet.domain.model.ViolationKind;
import io.github.riemr.fleet.oracle.DriverPattern;
import io.github.riemr.fleet.oracle.OracleGateway;
import io.github.riemr.fleet.oracle.OracleGateway.AvailabilityKey;
import io.github.riemr.fleet.oracle.OwnershipPrediction;
import io.github.riemr.fleet.optimization.service.SolverGateway;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 計画パスの実行。
 * <ol>
 *   <li>履歴を memoryWeeks に絞り、oracle から分布・所有者・可用性・パターンを取得</li>
 *   <li>枠ごとに候補スコア算出 → bump 調整 → 保護ルール・制約で候補を絞る</li>
 *   <li>残った候補のスコア行列をソルバーへ渡す</li>
 *   <li>ソルバーの結果を枠の順に再検証しながら確定する</li>
 * </ol>
 * パス間で状態は持たない。
 */
@Service
@Slf4j
public class PlanningPipelineService {

    private static final Comparator<Slot> SLOT_ORDER =
            Comparator.comparing(Slot::getServiceDate).thenComparing(Slot::getSlotId);

    private final HistoryWindow historyWindow;
    private final CandidateScorer candidateScorer;
    private final BumpResolver bumpResolver;
    private final ConstraintFilter constraintFilter;
    private final ProtectedRuleEvaluator protectedRuleEvaluator;
    private final OracleGateway oracleGateway;
    private final SolverGateway solverGateway;
    private final Validator validator;
    private final int minDaysPerDriver;

    public PlanningPipelineService(HistoryWindow historyWindow,
                                   CandidateScorer candidateScorer,
                                   BumpResolver bumpResolver,
                                   ConstraintFilter constraintFilter,
                                   ProtectedRuleEvaluator protectedRuleEvaluator,
                                   OracleGateway oracleGateway,
                                   SolverGateway solverGateway,
                                   Validator validator,
                                   @Value("${fleet.planner.min-days-per-driver:3}") int minDaysPerDriver) {
        this.historyWindow = historyWindow;
        this.candidateScorer = candidateScorer;
        this.bumpResolver = bumpResolver;
        this.constraintFilter = constraintFilter;
        this.protectedRuleEvaluator = protectedRuleEvaluator;
        this.oracleGateway = oracleGateway;
        this.solverGateway = solverGateway;
        this.validator = validator;
        this.minDaysPerDriver = minDaysPerDriver;
    }

    public PlanningPassOutput run(PlanningPassInput input) {
        return run(input, new PlanningPass());
    }

    public PlanningPassOutput run(PlanningPassInput input, PlanningPass pass) {
        SchedulingSettings settings = validateSettings(input.getSettings());
        List<Slot> slots = input.getSlots().stream().sorted(SLOT_ORDER).toList();
        List<DriverProfile> drivers = input.getDrivers().stream()
                .sorted(Comparator.comparing(DriverProfile::getDriverId))
                .toList();
        List<String> driverIds = drivers.stream().map(DriverProfile::getDriverId).toList();

        PassStats stats = new PassStats();
        stats.setTotalSlots(slots.size());
        stats.setTotalDrivers(drivers.size());
        log.info("Planning pass {} started: {} slots, {} drivers, predictability={}, flexibility={}h, memory={}w",
                pass.getPassId(), slots.size(), drivers.size(), settings.getPredictability(),
                settings.getTimeFlexibilityHours(), settings.getMemoryWeeks());

        LocalDate referenceDate = input.getReferenceDate() != null ? input.getReferenceDate()
                : slots.stream().map(Slot::getServiceDate).min(LocalDate::compareTo).orElse(LocalDate.now());
        Map<String, List<HistoryEntry>> histories =
                historyWindow.applyAll(input.getHistories(), settings.getMemoryWeeks(), referenceDate);

        // ---- oracle ----
        pass.checkNotCancelled("oracle");
        List<Slot> siblings = input.getSiblingSlots().isEmpty() ? slots : input.getSiblingSlots();
        List<Slot> distributionTargets = new ArrayList<>(slots);
        distributionTargets.addAll(siblings);
        Map<String, SlotDistribution> distributions = oracleGateway.distributions(distributionTargets, pass);
        Map<String, OwnershipPrediction> owners = oracleGateway.owners(slots, pass);

        Set<LocalDate> dates = slots.stream().map(Slot::getServiceDate).collect(Collectors.toCollection(LinkedHashSet::new));
        List<AvailabilityKey> availabilityKeys = new ArrayList<>();
        for (String d : driverIds) {
            for (LocalDate date : dates) availabilityKeys.add(new AvailabilityKey(d, date));
        }
        Map<AvailabilityKey, Double> availability = oracleGateway.availability(availabilityKeys, histories, pass);

        List<String> needPattern = drivers.stream()
                .filter(d -> d.getTypicalDaysPerWeek() == null)
                .map(DriverProfile::getDriverId)
                .toList();
        Map<String, DriverPattern> patterns = needPattern.isEmpty() ? Map.of() : oracleGateway.patterns(needPattern, pass);
        pass.checkNotCancelled("oracle");

        Map<String, DriverConstraints> snapshot = buildConstraints(drivers, patterns);
        Map<String, Integer> weekDayCounts = new LinkedHashMap<>();
        snapshot.forEach((id, c) -> weekDayCounts.put(id, c.getDaysAssignedThisWeek().size()));
        BumpContext bumpContext = new BumpContext(siblings, input.getAssignedSlots(), distributions);

        // ---- scoring / bump / filtering ----
        List<HardStop> hardStops = new ArrayList<>();
        List<FilterViolation> violations = new ArrayList<>();
        Map<String, List<DriverScore>> survivors = new LinkedHashMap<>();
        for (Slot slot : slots) {
            pass.checkNotCancelled("scoring");
            try {
                SlotDistribution dist = distributions.getOrDefault(slot.slotKey(), SlotDistribution.unknown(slot.slotKey()));
                if (dist.getClassification() == SlotClassification.OWNED) stats.setOwnedSlots(stats.getOwnedSlots() + 1);
                else if (dist.getClassification() == SlotClassification.ROTATING) stats.setRotatingSlots(stats.getRotatingSlots() + 1);

                List<DriverScore> candidates = scoreSlot(slot, dist, driverIds, histories, owners, availability,
                        weekDayCounts, settings, bumpContext, stats, pass);
                survivors.put(slot.getSlotId(), filterCandidates(slot, candidates, snapshot,
                        input.getProtectedRules(), hardStops, violations, stats));
            } catch (PlanningPassCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Evaluation of slot {} failed, leaving it unassigned", slot.getSlotId(), e);
                stats.getFailedSlots().add(slot.getSlotId());
            }
        }

        // ---- solver ----
        pass.checkNotCancelled("solver");
        SolverRequest request = buildSolverRequest(slots, snapshot, survivors);
        SolverResponse response = solverGateway.solve(request, pass);
        pass.checkNotCancelled("solver");

        // ---- commit ----
        Map<String, DriverConstraints> working = new LinkedHashMap<>();
        snapshot.forEach((id, c) -> working.put(id, c.copy()));
        List<PlannedAssignment> assignments = new ArrayList<>();
        List<String> unassigned = new ArrayList<>();
        for (Slot slot : slots) {
            String driverId = response.assignments().get(slot.getSlotId());
            PlannedAssignment committed = driverId == null ? null
                    : commit(slot, driverId, survivors.getOrDefault(slot.getSlotId(), List.of()), working,
                    violations, stats);
            if (committed != null) assignments.add(committed);
            else unassigned.add(slot.getSlotId());
        }

        stats.setAssigned(assignments.size());
        stats.setUnassigned(unassigned.size());
        stats.setHardStops(hardStops.size());
        stats.setOracleFallbacks(pass.getOracleFallbacks());
        log.info("Planning pass {} finished: assigned={}, unassigned={}, filtered={}, hardStops={}, failedSlots={}",
                pass.getPassId(), assignments.size(), unassigned.size(), stats.getFilteredCandidates(),
                hardStops.size(), stats.getFailedSlots().size());

        return PlanningPassOutput.builder()
                .passId(pass.getPassId())
                .assignments(assignments)
                .unassigned(unassigned)
                .hardStops(hardStops)
                .violations(violations)
                .stats(stats)
                .build();
    }

    private List<DriverScore> scoreSlot(Slot slot, SlotDistribution dist, List<String> driverIds,
                                        Map<String, List<HistoryEntry>> histories,
                                        Map<String, OwnershipPrediction> owners,
                                        Map<AvailabilityKey, Double> availability,
                                        Map<String, Integer> weekDayCounts,
                                        SchedulingSettings settings, BumpContext bumpContext,
                                        PassStats stats, PlanningPass pass) {
        Map<String, Double> slotAvailability = new LinkedHashMap<>();
        for (String d : driverIds) {
            Double a = availability.get(new AvailabilityKey(d, slot.getServiceDate()));
            if (a != null) slotAvailability.put(d, a);
        }
        var scored = candidateScorer.score(SlotScoringInput.builder()
                .slot(slot)
                .driverIds(driverIds)
                .histories(histories)
                .predictability(settings.getPredictability())
                .distribution(dist)
                .ownerPrediction(owners.getOrDefault(slot.slotKey(), OwnershipPrediction.none()))
                .availability(slotAvailability)
                .weekDayCounts(weekDayCounts)
                .build());

        if (scored.needsBackupRanking()) {
            String ownerId = scored.unavailableOwnerId();
            List<String> others = driverIds.stream().filter(d -> !d.equals(ownerId)).toList();
            var rankings = oracleGateway.rankBackups(slot, others, ownerId, pass);
            scored = candidateScorer.applyBackupRanking(scored, rankings);
            stats.setBackupRankedSlots(stats.getBackupRankedSlots() + 1);
        }

        List<DriverScore> resolved = bumpResolver.resolve(scored, bumpContext, settings.getTimeFlexibilityHours());
        resolved.forEach(c -> stats.countCandidate(c.getMethod()));
        return resolved;
    }

    /**
     * スナップショットに対して候補を判定する。保護ルール違反はハードストップとして別に記録する。
     */
    private List<DriverScore> filterCandidates(Slot slot, List<DriverScore> candidates,
                                               Map<String, DriverConstraints> snapshot, List<ProtectedRule> rules,
                                               List<HardStop> hardStops, List<FilterViolation> violations,
                                               PassStats stats) {
        List<DriverScore> out = new ArrayList<>();
        for (var c : candidates) {
            DriverConstraints constraints = snapshot.get(c.getDriverId());
            if (constraints == null) continue;
            ShiftWindow window = constraintFilter.windowFor(slot, c.getBumpMinutes());
            AssignmentSubject subject = AssignmentSubjects.fromShiftWindow(window, slot.getContractClass());

            List<String> ruleViolations = protectedRuleEvaluator.evaluate(c.getDriverId(), subject, rules);
            if (!ruleViolations.isEmpty()) {
                hardStops.add(new HardStop(slot.getSlotId(), c.getDriverId(), ruleViolations));
                stats.countViolation(ViolationKind.PROTECTED_RULE);
                continue;
            }
            var result = constraintFilter.check(constraints, slot, window);
            if (!result.isValid()) {
                violations.add(new FilterViolation(slot.getSlotId(), c.getDriverId(), result.getKind(), result.getReason()));
                stats.countViolation(result.getKind());
                continue;
            }
            out.add(c);
        }
        if (log.isDebugEnabled()) {
            log.debug("Slot {} ({}): {} of {} candidates survive, top {}", slot.getSlotId(), slot.slotKey(),
                    out.size(), candidates.size(),
                    out.stream().limit(3).map(s -> s.getDriverId() + "=" + String.format("%.3f", s.getScore()))
                            .collect(Collectors.joining(", ")));
        }
        return out;
    }

    /**
     * ソルバーの選択を確定する。確定済みの割当で更新した状態に対して再検証し、通らなければ null。
     */
    private PlannedAssignment commit(Slot slot, String driverId, List<DriverScore> candidates,
                                     Map<String, DriverConstraints> working,
                                     List<FilterViolation> violations, PassStats stats) {
        DriverScore chosen = candidates.stream().filter(c -> c.getDriverId().equals(driverId)).findFirst().orElse(null);
        DriverConstraints constraints = working.get(driverId);
        if (chosen == null || constraints == null) {
            log.warn("Solver assigned {} to slot {} outside its candidate list, ignoring", driverId, slot.getSlotId());
            return null;
        }
        ShiftWindow window = constraintFilter.windowFor(slot, chosen.getBumpMinutes());
        var result = constraintFilter.check(constraints, slot, window);
        if (!result.isValid()) {
            log.debug("Slot {}: solver choice {} rejected on re-validation: {}", slot.getSlotId(), driverId,
                    result.getReason());
            violations.add(new FilterViolation(slot.getSlotId(), driverId, result.getKind(),
                    "Re-validation: " + result.getReason()));
            stats.countViolation(result.getKind());
            return null;
        }
        constraints.accept(window);
        return new PlannedAssignment(slot.getSlotId(), driverId, chosen.getScore(), chosen.getMethod(),
                chosen.getBumpMinutes(), chosen.getReason());
    }

    private SolverRequest buildSolverRequest(List<Slot> slots, Map<String, DriverConstraints> snapshot,
                                             Map<String, List<DriverScore>> survivors) {
        List<SolverRequest.SolverSlot> solverSlots = slots.stream()
                .map(s -> new SolverRequest.SolverSlot(s.getSlotId(), s.getServiceDate()))
                .toList();
        List<SolverRequest.SolverDriver> solverDrivers = new ArrayList<>();
        snapshot.forEach((id, c) -> solverDrivers.add(new SolverRequest.SolverDriver(id,
                Math.max(0, ScoringPolicy.dayCap(c.getTypicalDaysPerWeek()) - c.getDaysAssignedThisWeek().size()))));
        Map<String, Map<String, Double>> matrix = new LinkedHashMap<>();
        survivors.forEach((slotId, candidates) -> {
            Map<String, Double> row = new TreeMap<>();
            for (var c : candidates) row.put(c.getDriverId(), c.getScore());
            matrix.put(slotId, row);
        });
        return new SolverRequest(solverSlots, solverDrivers, matrix, minDaysPerDriver);
    }

    private static Map<String, DriverConstraints> buildConstraints(List<DriverProfile> drivers,
                                                                   Map<String, DriverPattern> patterns) {
        Map<String, DriverConstraints> out = new LinkedHashMap<>();
        for (var d : drivers) {
            Integer typical = d.getTypicalDaysPerWeek();
            if (typical == null) {
                DriverPattern p = patterns.get(d.getDriverId());
                typical = p == null ? null : p.typicalDaysPerWeek();
            }
            out.put(d.getDriverId(), new DriverConstraints(d.getDriverId(), d.getContractClass(), typical,
                    d.getShiftsThisWeek()));
        }
        return out;
    }

    private SchedulingSettings validateSettings(SchedulingSettings settings) {
        if (settings == null) return SchedulingSettings.builder().build();
        Set<ConstraintViolation<SchedulingSettings>> errors = validator.validate(settings);
        if (!errors.isEmpty()) {
            String msg = errors.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid scheduling settings: " + msg);
        }
        if (!SchedulingSettings.ALLOWED_MEMORY_WEEKS.contains(settings.getMemoryWeeks())) {
            throw new IllegalArgumentException("Invalid scheduling settings: memoryWeeks must be one of "
                    + new java.util.TreeSet<>(SchedulingSettings.ALLOWED_MEMORY_WEEKS) + " but was "
                    + settings.getMemoryWeeks());
        }
        return settings;
    }
}
