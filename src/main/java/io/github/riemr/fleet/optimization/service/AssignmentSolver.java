package io.github.riemr.fleet.optimization.service;

import io.github.riemr.fleet.application.dto.SolverRequest;
import io.github.riemr.fleet.application.dto.SolverResponse;

import java.util.concurrent.CompletableFuture;

/**
 * 候補スコア行列から割当を決めるソルバー。
 */
public interface AssignmentSolver {

    /** 非同期に求解する。失敗時は future を例外で完了させる。 */
    CompletableFuture<SolverResponse> solve(String problemId, SolverRequest request);

    /** 実行中の求解を打ち切る。未実行なら何もしない。 */
    void terminate(String problemId);
}
