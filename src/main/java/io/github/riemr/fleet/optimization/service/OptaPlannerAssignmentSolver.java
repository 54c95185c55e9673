package io.github.riemr.fleet.optimization.service;

import io.github.riemr.fleet.application.dto.SolverRequest;
import io.github.riemr.fleet.application.dto.SolverResponse;
import io.github.riemr.fleet.application.service.ScoringPolicy;
import io.github.riemr.fleet.optimization.entity.AssignmentParameters;
import io.github.riemr.fleet.optimization.entity.DriverCapacity;
import io.github.riemr.fleet.optimization.entity.SlotAssignmentPlanningEntity;
import io.github.riemr.fleet.optimization.solution.BlockAssignmentSolution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.optaplanner.core.api.solver.SolverManager;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * OptaPlanner による枠割当。スコアは {@link ScoringPolicy#SCORE_SCALE} 倍の整数で扱う。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OptaPlannerAssignmentSolver implements AssignmentSolver {

    private final SolverManager<BlockAssignmentSolution, String> solverManager;

    @Override
    public CompletableFuture<SolverResponse> solve(String problemId, SolverRequest request) {
        if (request.slots().isEmpty()) return CompletableFuture.completedFuture(SolverResponse.empty());

        BlockAssignmentSolution problem = toProblem(problemId, request);
        CompletableFuture<SolverResponse> result = new CompletableFuture<>();
        log.info("Solving {}: {} slots, {} drivers", problemId, problem.getAssignmentList().size(),
                problem.getDriverCapacityList().size());
        solverManager.solve(problemId, problem,
                best -> result.complete(toResponse(best)),
                (id, ex) -> result.completeExceptionally(ex));
        return result;
    }

    @Override
    public void terminate(String problemId) {
        solverManager.terminateEarly(problemId);
    }

    BlockAssignmentSolution toProblem(String problemId, SolverRequest request) {
        List<SlotAssignmentPlanningEntity> entities = new ArrayList<>();
        for (var slot : request.slots()) {
            Map<String, Long> scaled = new TreeMap<>();
            request.scoreMatrix().getOrDefault(slot.slotId(), Map.of())
                    .forEach((driverId, score) -> scaled.put(driverId, Math.round(score * ScoringPolicy.SCORE_SCALE)));
            entities.add(new SlotAssignmentPlanningEntity(slot.slotId(), slot.serviceDate(), scaled));
        }
        List<DriverCapacity> capacities = request.drivers().stream()
                .map(d -> new DriverCapacity(d.driverId(), d.maxNewDays()))
                .toList();
        return new BlockAssignmentSolution(problemId, capacities,
                new AssignmentParameters(request.minDaysPerDriver()), entities);
    }

    private SolverResponse toResponse(BlockAssignmentSolution best) {
        if (best.getScore() != null && !best.getScore().isFeasible()) {
            log.warn("Solver {} finished with infeasible score {}", best.getProblemId(), best.getScore());
        } else {
            log.info("Solver {} finished with score {}", best.getProblemId(), best.getScore());
        }
        Map<String, String> assignments = new LinkedHashMap<>();
        for (var e : best.getAssignmentList()) {
            if (e.getAssignedDriverId() != null) assignments.put(e.getSlotId(), e.getAssignedDriverId());
        }
        return new SolverResponse(assignments);
    }
}
