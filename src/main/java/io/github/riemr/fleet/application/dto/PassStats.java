package io.github.riemr.fleet.application.dto;

import io.github.riemr.fleet.domain.model.AssignmentMethod;
import io.github.riemr.fleet.domain.model.ViolationKind;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
public class PassStats {
    private int totalSlots;
    private int totalDrivers;
    private int assigned;
    private int unassigned;
    private int ownedSlots;
    private int rotatingSlots;
    private int directCandidates;
    private int bumpedCandidates;
    private int fallbackCandidates;
    private int backupRankedSlots;
    private int filteredCandidates;
    private int hardStops;
    private int oracleFallbacks;
    private Map<ViolationKind, Integer> violationsByKind = new EnumMap<>(ViolationKind.class);
    private List<String> failedSlots = new ArrayList<>();

    public void countCandidate(AssignmentMethod method) {
        switch (method) {
            case BUMPED:
                bumpedCandidates++;
                break;
            case FALLBACK:
                fallbackCandidates++;
                break;
            default:
                directCandidates++;
        }
    }

    public void countViolation(ViolationKind kind) {
        violationsByKind.merge(kind, 1, Integer::sum);
        filteredCandidates++;
    }
}
