package io.github.riemr.fleet.optimization.constraint;

import io.github.riemr.fleet.optimization.entity.AssignmentParameters;
import io.github.riemr.fleet.optimization.entity.DriverCapacity;
import io.github.riemr.fleet.optimization.entity.SlotAssignmentPlanningEntity;
import org.optaplanner.core.api.score.buildin.hardmediumsoftlong.HardMediumSoftLongScore;
import org.optaplanner.core.api.score.stream.Constraint;
import org.optaplanner.core.api.score.stream.ConstraintCollectors;
import org.optaplanner.core.api.score.stream.ConstraintFactory;
import org.optaplanner.core.api.score.stream.ConstraintProvider;
import org.optaplanner.core.api.score.stream.Joiners;

/**
 * 枠割当の制約定義。
 */
public class BlockAssignmentConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory factory) {
        return new Constraint[] {
            // Hard
            driverNotDoubleBookedOnDate(factory),
            driverWithinDayCapacity(factory),

            // Medium
            fillSlots(factory),

            // Soft
            preferHigherCandidateScore(factory),
            minimumDaysPerDriver(factory)
        };
    }

    /**
     * 同一ドライバーを同じ日に 2 枠以上割り当てない（ハード制約）
     */
    Constraint driverNotDoubleBookedOnDate(ConstraintFactory f) {
        return f.forEachUniquePair(SlotAssignmentPlanningEntity.class,
                        Joiners.equal(SlotAssignmentPlanningEntity::getAssignedDriverId),
                        Joiners.equal(SlotAssignmentPlanningEntity::getServiceDate))
                .penalize(HardMediumSoftLongScore.ONE_HARD)
                .asConstraint("Driver double-booked on date");
    }

    /**
     * 週の稼働日数上限（ハード制約）。超過日数分ペナルティ。
     */
    Constraint driverWithinDayCapacity(ConstraintFactory f) {
        return f.forEach(SlotAssignmentPlanningEntity.class)
                .groupBy(SlotAssignmentPlanningEntity::getAssignedDriverId,
                        ConstraintCollectors.countDistinct(SlotAssignmentPlanningEntity::getServiceDate))
                .join(DriverCapacity.class, Joiners.equal((driverId, days) -> driverId, DriverCapacity::getDriverId))
                .filter((driverId, days, cap) -> days > cap.getMaxNewDays())
                .penalize(HardMediumSoftLongScore.ONE_HARD, (driverId, days, cap) -> days - cap.getMaxNewDays())
                .asConstraint("Driver exceeds weekly day capacity");
    }

    Constraint fillSlots(ConstraintFactory f) {
        return f.forEach(SlotAssignmentPlanningEntity.class)
                .reward(HardMediumSoftLongScore.ONE_MEDIUM)
                .asConstraint("Fill slots");
    }

    Constraint preferHigherCandidateScore(ConstraintFactory f) {
        return f.forEach(SlotAssignmentPlanningEntity.class)
                .rewardLong(HardMediumSoftLongScore.ONE_SOFT, SlotAssignmentPlanningEntity::getAssignedScore)
                .asConstraint("Prefer higher candidate score");
    }

    /**
     * 稼働日数が最低日数に満たないドライバーへのペナルティ（割当 0 日のドライバーは対象外）
     */
    Constraint minimumDaysPerDriver(ConstraintFactory f) {
        return f.forEach(SlotAssignmentPlanningEntity.class)
                .groupBy(SlotAssignmentPlanningEntity::getAssignedDriverId,
                        ConstraintCollectors.countDistinct(SlotAssignmentPlanningEntity::getServiceDate))
                .join(AssignmentParameters.class)
                .filter((driverId, days, params) -> days < params.getMinDaysPerDriver())
                .penalize(HardMediumSoftLongScore.ofSoft(1_000L),
                        (driverId, days, params) -> params.getMinDaysPerDriver() - days)
                .asConstraint("Driver below minimum days");
    }
}
