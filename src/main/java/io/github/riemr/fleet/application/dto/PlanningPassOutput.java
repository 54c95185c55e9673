package io.github.riemr.fleet.application.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 計画パスの結果。入力のすべての枠は assignments か unassigned のどちらかに必ず現れる。
 */
@Value
@Builder
public class PlanningPassOutput {
    String passId;
    List<PlannedAssignment> assignments;
    List<String> unassigned;
    List<HardStop> hardStops;
    List<FilterViolation> violations;
    PassStats stats;
}
