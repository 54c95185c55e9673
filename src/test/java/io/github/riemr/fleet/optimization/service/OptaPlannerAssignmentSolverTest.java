package io.github.riemr.fleet.optimization.service;

import io.github.riemr.fleet.application.dto.SolverRequest;
import io.github.riemr.fleet.application.dto.SolverRequest.SolverDriver;
import io.github.riemr.fleet.application.dto.SolverRequest.SolverSlot;
import io.github.riemr.fleet.application.dto.SolverResponse;
import io.github.riemr.fleet.optimization.config.OptaPlannerConfig;
import io.github.riemr.fleet.optimization.solution.BlockAssignmentSolution;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.optaplanner.core.api.solver.SolverFactory;
import org.optaplanner.core.api.solver.SolverManager;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OptaPlannerAssignmentSolverTest {

    private static final LocalDate MON = LocalDate.of(2025, 6, 9);

    private SolverManager<BlockAssignmentSolution, String> solverManager;
    private OptaPlannerAssignmentSolver solver;

    @BeforeEach
    void setUp() {
        SolverFactory<BlockAssignmentSolution> factory =
                SolverFactory.create(OptaPlannerConfig.solverConfig(Duration.ofSeconds(2), Duration.ofMillis(500), 100));
        solverManager = SolverManager.create(factory);
        solver = new OptaPlannerAssignmentSolver(solverManager);
    }

    @AfterEach
    void tearDown() {
        solverManager.close();
    }

    @Test
    void emptyRequest_completesImmediately() throws Exception {
        var response = solver.solve("p0", new SolverRequest(List.of(), List.of(), Map.of(), 0)).get();
        assertThat(response.assignments()).isEmpty();
    }

    @Test
    void toProblem_scalesScoresAndKeepsOnlyMatrixCandidates() {
        var request = new SolverRequest(
                List.of(new SolverSlot("S1", MON), new SolverSlot("S2", MON)),
                List.of(new SolverDriver("A", 3)),
                Map.of("S1", Map.of("A", 0.7741)),
                2);

        var problem = solver.toProblem("p1", request);

        assertThat(problem.getAssignmentList()).hasSize(2);
        var s1 = problem.getAssignmentList().get(0);
        assertThat(s1.getCandidateDrivers()).containsExactly("A");
        assertThat(s1.getCandidateScores()).containsEntry("A", 7741L);
        assertThat(problem.getAssignmentList().get(1).getCandidateDrivers()).isEmpty();
        assertThat(problem.getParameters().getMinDaysPerDriver()).isEqualTo(2);
        assertThat(problem.getDriverCapacityList()).hasSize(1);
        assertThat(problem.getDriverCapacityList().get(0).getMaxNewDays()).isEqualTo(3);
    }

    @Test
    void maximizesTotalScoreWithOneSlotPerDriverPerDay() throws Exception {
        var request = new SolverRequest(
                List.of(new SolverSlot("S1", MON), new SolverSlot("S2", MON)),
                List.of(new SolverDriver("A", 5), new SolverDriver("B", 5)),
                Map.of("S1", Map.of("A", 0.9, "B", 0.5),
                        "S2", Map.of("A", 0.8, "B", 0.1)),
                0);

        SolverResponse response = solver.solve("p2", request).get(30, TimeUnit.SECONDS);

        // A-S1 + B-S2 = 1.0 より A-S2 + B-S1 = 1.3 の方が良い
        assertThat(response.assignments()).containsEntry("S1", "B").containsEntry("S2", "A");
    }

    @Test
    void driverWithoutCapacity_leavesSlotUnassigned() throws Exception {
        var request = new SolverRequest(
                List.of(new SolverSlot("S1", MON), new SolverSlot("S2", MON.plusDays(1))),
                List.of(new SolverDriver("A", 1), new SolverDriver("C", 0)),
                Map.of("S1", Map.of("A", 0.9),
                        "S2", Map.of("A", 0.8, "C", 0.9)),
                0);

        SolverResponse response = solver.solve("p3", request).get(30, TimeUnit.SECONDS);

        assertThat(response.assignments()).hasSize(1);
        assertThat(response.assignments()).containsKey("S1").doesNotContainValue("C");
    }
}
