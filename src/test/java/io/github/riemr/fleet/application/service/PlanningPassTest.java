package io.github.riemr.fleet.application.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanningPassTest {

    @Test
    void cancel_runsHooksAndCancelsTrackedFutures() {
        var pass = new PlanningPass("p");
        var hookCalls = new AtomicInteger();
        pass.onCancel(hookCalls::incrementAndGet);
        var pending = pass.track(new CompletableFuture<String>());

        pass.cancel();
        pass.cancel();

        assertThat(hookCalls).hasValue(1);
        assertThat(pending).isCancelled();
        assertThatThrownBy(() -> pass.checkNotCancelled("solver"))
                .isInstanceOf(PlanningPassCancelledException.class)
                .hasMessage("Planning pass p cancelled during solver");
    }

    @Test
    void removedHook_isNotCalled() {
        var pass = new PlanningPass();
        var hookCalls = new AtomicInteger();
        Runnable hook = hookCalls::incrementAndGet;
        pass.onCancel(hook);
        pass.removeCancelHook(hook);

        pass.cancel();

        assertThat(hookCalls).hasValue(0);
    }

    @Test
    void trackingAfterCancel_cancelsImmediately() {
        var pass = new PlanningPass();
        pass.cancel();
        assertThat(pass.track(new CompletableFuture<Void>())).isCancelled();
    }

    @Test
    void completedFuturesAreNoLongerTracked() {
        var pass = new PlanningPass();
        var f = pass.track(CompletableFuture.completedFuture("done"));
        pass.cancel();
        assertThat(f).isCompletedWithValue("done");
        assertThat(pass.getPassId()).isNotBlank();
    }
}
