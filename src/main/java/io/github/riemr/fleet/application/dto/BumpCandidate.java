package io.github.riemr.fleet.application.dto;

import io.github.riemr.fleet.domain.model.Slot;

/**
 * bump 先候補。offsetMinutes は元の枠からの符号付きオフセット（日付またぎ補正済み）。
 */
public record BumpCandidate(Slot slot, int offsetMinutes, boolean open, double distancePenalty,
                            double conflictPenalty) {

    public double totalPenalty() {
        return distancePenalty + conflictPenalty;
    }
}
