package io.github.riemr.fleet.oracle;

import io.github.riemr.fleet.application.service.PlanningPass;
import io.github.riemr.fleet.application.service.ScoringPolicy;
import io.github.riemr.fleet.application.util.DurationParser;
import io.github.riemr.fleet.domain.model.HistoryEntry;
import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.SlotDistribution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * {@link ScoringOracle} 呼び出しの並列化・タイムアウト・フォールバックを担う。
 * 失敗した呼び出しは中立値に置き換え、パスは継続する。
 */
@Service
@Slf4j
public class OracleGateway {

    private final ScoringOracle oracle;
    private final ExecutorService executor;
    private final Duration timeout;
    private final int maxInFlight;

    public OracleGateway(ScoringOracle oracle,
                         @Qualifier("oracleExecutor") ExecutorService executor,
                         @Value("${fleet.planner.oracle.timeout:PT10S}") String timeout,
                         @Value("${fleet.planner.oracle.max-in-flight:10}") int maxInFlight) {
        this.oracle = oracle;
        this.executor = executor;
        this.timeout = DurationParser.parseTolerant(timeout, Duration.ofSeconds(10));
        this.maxInFlight = Math.max(1, maxInFlight);
    }

    public Map<String, SlotDistribution> distributions(Collection<Slot> slots, PlanningPass pass) {
        return callAll("distribution", bySlotKey(slots), oracle::distribution,
                s -> SlotDistribution.unknown(s.slotKey()), pass, Slot::slotKey);
    }

    public Map<String, OwnershipPrediction> owners(Collection<Slot> slots, PlanningPass pass) {
        return callAll("owner", bySlotKey(slots), oracle::predictOwner,
                s -> OwnershipPrediction.none(), pass, Slot::slotKey);
    }

    public Map<AvailabilityKey, Double> availability(Collection<AvailabilityKey> keys,
                                                     Map<String, List<HistoryEntry>> histories,
                                                     PlanningPass pass) {
        return callAll("availability", new ArrayList<>(new LinkedHashSet<>(keys)),
                k -> oracle.availability(k.driverId(), k.date(), histories.getOrDefault(k.driverId(), List.of())),
                k -> ScoringPolicy.DEFAULT_AVAILABILITY, pass, Function.identity());
    }

    public Map<String, DriverPattern> patterns(Collection<String> driverIds, PlanningPass pass) {
        return callAll("pattern", new ArrayList<>(new LinkedHashSet<>(driverIds)), oracle::pattern,
                id -> new DriverPattern(id, ScoringPolicy.FALLBACK_DAY_CAP, 0.0), pass, Function.identity());
    }

    public List<RankedDriver> rankBackups(Slot slot, List<String> candidateIds, String unavailableOwnerId,
                                          PlanningPass pass) {
        var result = callAll("rank", List.of(slot),
                s -> oracle.rankBackups(s, candidateIds, unavailableOwnerId),
                s -> List.<RankedDriver>of(), pass, Slot::slotKey);
        return result.getOrDefault(slot.slotKey(), List.of());
    }

    private static List<Slot> bySlotKey(Collection<Slot> slots) {
        Map<String, Slot> unique = new LinkedHashMap<>();
        for (var s : slots) unique.putIfAbsent(s.slotKey(), s);
        return new ArrayList<>(unique.values());
    }

    private <I, K, V> Map<K, V> callAll(String what, List<I> inputs, Function<I, V> call, Function<I, V> fallback,
                                        PlanningPass pass, Function<I, K> keyOf) {
        List<CompletableFuture<V>> futures = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            I input = inputs.get(i);
            // 待ち行列の分も含め、各呼び出しに timeout 1 回分の実行時間を確保する
            long deadlineMs = timeout.toMillis() * (1 + i / maxInFlight);
            CompletableFuture<V> f = pass.track(CompletableFuture.supplyAsync(() -> call.apply(input), executor))
                    .orTimeout(deadlineMs, TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> {
                        pass.recordOracleFallback();
                        log.warn("Oracle {} call for {} failed, using neutral default: {}", what, keyOf.apply(input),
                                ex.toString());
                        return fallback.apply(input);
                    });
            futures.add(f);
        }
        Map<K, V> out = new LinkedHashMap<>();
        for (int i = 0; i < inputs.size(); i++) {
            out.put(keyOf.apply(inputs.get(i)), futures.get(i).join());
        }
        log.debug("Oracle {}: {} calls completed", what, inputs.size());
        return out;
    }

    public record AvailabilityKey(String driverId, LocalDate date) {
    }
}
