package io.github.riemr.fleet.optimization.service;

import io.github.riemr.fleet.application.dto.SolverRequest;
import io.github.riemr.fleet.application.dto.SolverResponse;
import io.github.riemr.fleet.application.service.PlanningPass;
import io.github.riemr.fleet.application.util.DurationParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ソルバー呼び出しのタイムアウトとフォールバック。失敗・タイムアウト時は空の割当を返す。
 */
@Service
@Slf4j
public class SolverGateway {

    private final AssignmentSolver solver;
    private final Duration timeout;

    public SolverGateway(AssignmentSolver solver,
                         @Value("${fleet.planner.solver.timeout:PT2M}") String timeout) {
        this.solver = solver;
        this.timeout = DurationParser.parseTolerant(timeout, Duration.ofMinutes(2));
    }

    public SolverResponse solve(SolverRequest request, PlanningPass pass) {
        String problemId = pass.getPassId();
        Runnable terminate = () -> solver.terminate(problemId);
        pass.onCancel(terminate);
        try {
            return pass.track(solver.solve(problemId, request))
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                log.warn("Solver {} timed out after {}, terminating", problemId, timeout);
                solver.terminate(problemId);
            } else if (cause instanceof CancellationException) {
                log.info("Solver {} cancelled", problemId);
            } else {
                log.error("Solver {} failed, continuing with no assignments", problemId, cause);
            }
            return SolverResponse.empty();
        } finally {
            pass.removeCancelHook(terminate);
        }
    }
}
