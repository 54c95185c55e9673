package io.github.riemr.fleet.optimization.entity;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.optaplanner.core.api.domain.entity.PlanningEntity;
import org.optaplanner.core.api.domain.lookup.PlanningId;
import org.optaplanner.core.api.domain.valuerange.ValueRangeProvider;
import org.optaplanner.core.api.domain.variable.PlanningVariable;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 1 枠 = 1 エンティティ。assignedDriverId が null の場合は未割当。
 */
@PlanningEntity
@Getter
@Setter
@ToString(exclude = "candidateScores")
public class SlotAssignmentPlanningEntity {

    @PlanningId
    private String slotId;

    private LocalDate serviceDate;

    // driverId -> スケール済みスコア
    private Map<String, Long> candidateScores = Collections.emptyMap();

    private List<String> candidateDrivers = Collections.emptyList();

    @PlanningVariable(valueRangeProviderRefs = {"candidateDrivers"}, nullable = true)
    private String assignedDriverId;

    public SlotAssignmentPlanningEntity() {
    }

    public SlotAssignmentPlanningEntity(String slotId, LocalDate serviceDate, Map<String, Long> candidateScores) {
        this.slotId = slotId;
        this.serviceDate = serviceDate;
        this.candidateScores = candidateScores;
        this.candidateDrivers = candidateScores.keySet().stream().sorted().toList();
    }

    // エンティティ依存の候補レンジ（スコア行列に現れるドライバーのみ）
    @ValueRangeProvider(id = "candidateDrivers")
    public List<String> getCandidateDrivers() {
        return candidateDrivers == null ? Collections.emptyList() : candidateDrivers;
    }

    public long getAssignedScore() {
        if (assignedDriverId == null || candidateScores == null) return 0L;
        Long v = candidateScores.get(assignedDriverId);
        return v == null ? 0L : v;
    }
}
