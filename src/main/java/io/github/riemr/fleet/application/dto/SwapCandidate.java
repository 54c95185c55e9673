package io.github.riemr.fleet.application.dto;

import io.github.riemr.fleet.domain.model.ValidationStatus;

import java.util.List;
import java.util.Map;

public record SwapCandidate(String driverId, WorkloadSummary workload, ValidationStatus complianceStatus,
                            List<String> complianceMessages, Map<String, Double> complianceMetrics) {
}
