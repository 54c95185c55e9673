package io.github.riemr.fleet.application.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 1 回の計画パスの実行コンテキスト。中断フラグと実行中の外部呼び出しを保持する。
 * {@link #cancel()} は登録済みのフック（ソルバーの早期終了など）を呼んでから、実行中の future を取り消す。
 */
@Slf4j
public class PlanningPass {

    @Getter
    private final String passId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();
    private final AtomicInteger oracleFallbacks = new AtomicInteger();

    public PlanningPass() {
        this(UUID.randomUUID().toString());
    }

    public PlanningPass(String passId) {
        this.passId = passId;
    }

    public <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        inFlight.add(future);
        future.whenComplete((r, e) -> inFlight.remove(future));
        if (cancelled.get()) future.cancel(true);
        return future;
    }

    public void onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (cancelled.get()) hook.run();
    }

    public void removeCancelHook(Runnable hook) {
        cancelHooks.remove(hook);
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        log.info("Cancelling planning pass {} ({} calls in flight)", passId, inFlight.size());
        for (var hook : cancelHooks) hook.run();
        for (var f : inFlight) f.cancel(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void checkNotCancelled(String stage) {
        if (cancelled.get()) throw new PlanningPassCancelledException(passId, stage);
    }

    public void recordOracleFallback() {
        oracleFallbacks.incrementAndGet();
    }

    public int getOracleFallbacks() {
        return oracleFallbacks.get();
    }
}
