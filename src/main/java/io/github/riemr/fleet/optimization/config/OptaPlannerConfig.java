package io.github.riemr.fleet.optimization.config;

import io.github.riemr.fleet.application.util.DurationParser;
import io.github.riemr.fleet.optimization.constraint.BlockAssignmentConstraintProvider;
import io.github.riemr.fleet.optimization.entity.SlotAssignmentPlanningEntity;
import io.github.riemr.fleet.optimization.solution.BlockAssignmentSolution;
import org.optaplanner.core.api.solver.SolverFactory;
import org.optaplanner.core.api.solver.SolverManager;
import org.optaplanner.core.config.constructionheuristic.ConstructionHeuristicPhaseConfig;
import org.optaplanner.core.config.constructionheuristic.ConstructionHeuristicType;
import org.optaplanner.core.config.heuristic.selector.common.SelectionOrder;
import org.optaplanner.core.config.heuristic.selector.entity.EntitySelectorConfig;
import org.optaplanner.core.config.heuristic.selector.move.composite.UnionMoveSelectorConfig;
import org.optaplanner.core.config.heuristic.selector.move.generic.ChangeMoveSelectorConfig;
import org.optaplanner.core.config.heuristic.selector.move.generic.SwapMoveSelectorConfig;
import org.optaplanner.core.config.heuristic.selector.value.ValueSelectorConfig;
import org.optaplanner.core.config.localsearch.LocalSearchPhaseConfig;
import org.optaplanner.core.config.localsearch.LocalSearchType;
import org.optaplanner.core.config.phase.PhaseConfig;
import org.optaplanner.core.config.score.director.ScoreDirectorFactoryConfig;
import org.optaplanner.core.config.solver.EnvironmentMode;
import org.optaplanner.core.config.solver.SolverConfig;
import org.optaplanner.core.config.solver.termination.TerminationConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@Configuration
public class OptaPlannerConfig {

    // 全体の上限
    @Value("${fleet.planner.solver.spent-limit:PT30S}")
    private String solverSpentLimit;
    // ベストスコア未更新での終了
    @Value("${fleet.planner.solver.unimproved-spent-limit:PT5S}")
    private String unimprovedSpentLimit;
    // 各 LS フェーズの終了条件（ステップ数基準なので同じ入力なら同じ結果）
    @Value("${fleet.planner.solver.unimproved-step-count-limit:200}")
    private int unimprovedStepCountLimit;

    @Bean
    public SolverFactory<BlockAssignmentSolution> blockAssignmentSolverFactory() {
        return SolverFactory.create(solverConfig(
                DurationParser.parseTolerant(solverSpentLimit, Duration.ofSeconds(30)),
                DurationParser.parseTolerant(unimprovedSpentLimit, Duration.ofSeconds(5)),
                unimprovedStepCountLimit));
    }

    @Bean
    public SolverManager<BlockAssignmentSolution, String> blockAssignmentSolverManager(
            SolverFactory<BlockAssignmentSolution> solverFactory) {
        return SolverManager.create(solverFactory);
    }

    /**
     * CH → LS(LATE_ACCEPTANCE, 多様化) → LS(TABU_SEARCH, 収束)
     * <p>
     * LS フェーズはベスト未更新のステップ数で終了する。時間制限は上限としてのみ効く。
     */
    public static SolverConfig solverConfig(Duration spentLimit, Duration unimprovedLimit, int unimprovedStepCountLimit) {
        SolverConfig solverConfig = new SolverConfig()
                .withSolutionClass(BlockAssignmentSolution.class)
                .withEntityClasses(SlotAssignmentPlanningEntity.class)
                .withEnvironmentMode(EnvironmentMode.REPRODUCIBLE)
                .withTerminationConfig(new TerminationConfig()
                        .withSpentLimit(spentLimit)
                        .withUnimprovedSpentLimit(unimprovedLimit));
        solverConfig.setScoreDirectorFactoryConfig(new ScoreDirectorFactoryConfig()
                .withConstraintProviderClass(BlockAssignmentConstraintProvider.class));

        ConstructionHeuristicPhaseConfig construction = new ConstructionHeuristicPhaseConfig();
        construction.setConstructionHeuristicType(ConstructionHeuristicType.FIRST_FIT_DECREASING);

        LocalSearchPhaseConfig diversify = new LocalSearchPhaseConfig();
        diversify.setLocalSearchType(LocalSearchType.LATE_ACCEPTANCE);
        diversify.setMoveSelectorConfig(changeAndSwap());
        // 後続フェーズがあるため、このフェーズ単体の終了条件を必須で設定
        diversify.setTerminationConfig(new TerminationConfig()
                .withUnimprovedStepCountLimit(unimprovedStepCountLimit)
                .withSpentLimit(spentLimit.dividedBy(2)));

        LocalSearchPhaseConfig converge = new LocalSearchPhaseConfig();
        converge.setLocalSearchType(LocalSearchType.TABU_SEARCH);
        converge.setMoveSelectorConfig(changeAndSwap());
        converge.setTerminationConfig(new TerminationConfig()
                .withUnimprovedStepCountLimit(unimprovedStepCountLimit));

        solverConfig.setPhaseConfigList(List.<PhaseConfig>of(construction, diversify, converge));
        return solverConfig;
    }

    private static UnionMoveSelectorConfig changeAndSwap() {
        ChangeMoveSelectorConfig change = new ChangeMoveSelectorConfig();
        change.setEntitySelectorConfig(new EntitySelectorConfig()
                .withEntityClass(SlotAssignmentPlanningEntity.class)
                .withSelectionOrder(SelectionOrder.RANDOM));
        change.setValueSelectorConfig(new ValueSelectorConfig()
                .withVariableName("assignedDriverId")
                .withSelectionOrder(SelectionOrder.RANDOM));
        SwapMoveSelectorConfig swap = new SwapMoveSelectorConfig();
        swap.setEntitySelectorConfig(new EntitySelectorConfig()
                .withEntityClass(SlotAssignmentPlanningEntity.class)
                .withSelectionOrder(SelectionOrder.RANDOM));
        UnionMoveSelectorConfig union = new UnionMoveSelectorConfig();
        union.setMoveSelectorList(Arrays.asList(change, swap));
        return union;
    }
}
