package io.github.riemr.fleet.application.dto;

import io.github.riemr.fleet.domain.model.WorkloadLevel;

import java.util.List;

public record WorkloadSummary(String driverId, int daysWorked, WorkloadLevel workloadLevel, double totalHours,
                              List<String> slotsThisWeek) {
}
