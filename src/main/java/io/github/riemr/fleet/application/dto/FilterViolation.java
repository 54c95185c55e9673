package io.github.riemr.fleet.application.dto;

import io.github.riemr.fleet.domain.model.ViolationKind;

public record FilterViolation(String slotId, String driverId, ViolationKind kind, String reason) {
}
