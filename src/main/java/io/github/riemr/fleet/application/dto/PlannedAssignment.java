package io.github.riemr.fleet.application.dto;

import io.github.riemr.fleet.domain.model.AssignmentMethod;

public record PlannedAssignment(String slotId, String driverId, double score, AssignmentMethod method,
                                int bumpMinutes, String reason) {
}
