package io.github.riemr.fleet.application.dto;

import java.util.Map;

/**
 * @param assignments slotId -> driverId。割当のない枠は含まない。
 */
public record SolverResponse(Map<String, String> assignments) {

    public static SolverResponse empty() {
        return new SolverResponse(Map.of());
    }
}
