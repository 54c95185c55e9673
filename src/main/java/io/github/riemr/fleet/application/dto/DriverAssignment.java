package io.github.riemr.fleet.application.dto;

import io.github.riemr.fleet.domain.model.AssignmentSubject;

/**
 * 確定済みの割当 1 件。
 */
public record DriverAssignment(String driverId, String slotId, AssignmentSubject subject) {
}
