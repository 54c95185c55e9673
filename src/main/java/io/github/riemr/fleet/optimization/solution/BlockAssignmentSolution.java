package io.github.riemr.fleet.optimization.solution;

import io.github.riemr.fleet.optimization.entity.AssignmentParameters;
import io.github.riemr.fleet.optimization.entity.DriverCapacity;
import io.github.riemr.fleet.optimization.entity.SlotAssignmentPlanningEntity;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.optaplanner.core.api.domain.solution.PlanningEntityCollectionProperty;
import org.optaplanner.core.api.domain.solution.PlanningScore;
import org.optaplanner.core.api.domain.solution.PlanningSolution;
import org.optaplanner.core.api.domain.solution.ProblemFactCollectionProperty;
import org.optaplanner.core.api.domain.solution.ProblemFactProperty;
import org.optaplanner.core.api.score.buildin.hardmediumsoftlong.HardMediumSoftLongScore;

import java.util.List;

/**
 * 枠割当の計画解。
 * <ul>
 *   <li>hard: 同一ドライバーの同日複数割当・週の日数上限超過</li>
 *   <li>medium: 割当済み枠数（多いほど良い）</li>
 *   <li>soft: 候補スコアの合計と最低稼働日数の不足</li>
 * </ul>
 */
@PlanningSolution
@Getter
@Setter
@NoArgsConstructor
public class BlockAssignmentSolution {

    private String problemId;

    /** 各ドライバーの追加可能日数 */
    @ProblemFactCollectionProperty
    private List<DriverCapacity> driverCapacityList;

    @ProblemFactProperty
    private AssignmentParameters parameters;

    @PlanningEntityCollectionProperty
    private List<SlotAssignmentPlanningEntity> assignmentList;

    @PlanningScore
    private HardMediumSoftLongScore score;

    public BlockAssignmentSolution(String problemId, List<DriverCapacity> driverCapacityList,
                                   AssignmentParameters parameters,
                                   List<SlotAssignmentPlanningEntity> assignmentList) {
        this.problemId = problemId;
        this.driverCapacityList = driverCapacityList;
        this.parameters = parameters;
        this.assignmentList = assignmentList;
    }
}
