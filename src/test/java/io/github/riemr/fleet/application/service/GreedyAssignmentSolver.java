package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.dto.SolverRequest;
import io.github.riemr.fleet.application.dto.SolverResponse;
import io.github.riemr.fleet.optimization.service.AssignmentSolver;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * テスト用の決定的なソルバー。枠の順に、1 日 1 枠・追加日数上限を守って最高スコアの候補を割り当てる。
 */
class GreedyAssignmentSolver implements AssignmentSolver {

    @Override
    public CompletableFuture<SolverResponse> solve(String problemId, SolverRequest request) {
        Map<String, Integer> remaining = new HashMap<>();
        request.drivers().forEach(d -> remaining.put(d.driverId(), d.maxNewDays()));
        Map<String, Set<LocalDate>> used = new HashMap<>();
        Map<String, String> out = new LinkedHashMap<>();

        for (var slot : request.slots()) {
            var row = request.scoreMatrix().getOrDefault(slot.slotId(), Map.of());
            var best = row.entrySet().stream()
                    .sorted(Map.Entry.<String, Double>comparingByValue().reversed()
                            .thenComparing(Map.Entry::getKey))
                    .map(Map.Entry::getKey)
                    .filter(d -> remaining.getOrDefault(d, 0) > 0)
                    .filter(d -> !used.getOrDefault(d, Set.of()).contains(slot.serviceDate()))
                    .findFirst();
            best.ifPresent(d -> {
                out.put(slot.slotId(), d);
                remaining.merge(d, -1, Integer::sum);
                used.computeIfAbsent(d, k -> new HashSet<>()).add(slot.serviceDate());
            });
        }
        return CompletableFuture.completedFuture(new SolverResponse(out));
    }

    @Override
    public void terminate(String problemId) {
    }
}
