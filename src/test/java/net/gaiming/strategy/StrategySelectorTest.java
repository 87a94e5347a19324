package net.gaiming.strategy;

import static net.gaiming.strategy.StrategyFixtures.CLOCK;
import static net.gaiming.strategy.StrategyFixtures.NO_METRICS;
import static net.gaiming.strategy.StrategyFixtures.player;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.domain.repository.PlayerFeatureRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.strategy.ExperimentVariantResolver.VariantAssignment;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StrategySelectorTest {

    private ExperimentVariantResolver experiments;
    private UnitOfWorkFactory unitOfWorkFactory;
    private StrategySelector selector;

    @BeforeEach
    void setUp() {
        experiments = mock(ExperimentVariantResolver.class);
        unitOfWorkFactory = mock(UnitOfWorkFactory.class);
        when(experiments.findActiveVariant(anyLong(), anyString())).thenReturn(Optional.empty());
        selector = new StrategySelector(registry(NO_METRICS), unitOfWorkFactory, experiments,
            StrategySelectionProperties.defaults());
    }

    static StrategyRegistry registry(StrategyMetricsSource metrics) {
        CollaborativeFilteringStrategy collaborative = new CollaborativeFilteringStrategy(metrics, CLOCK);
        ContentBasedStrategy content = new ContentBasedStrategy(metrics, CLOCK);
        return StrategyRegistry.builder()
            .register(collaborative)
            .register(content)
            .register(new HybridStrategy(metrics, CLOCK, collaborative, content))
            .register(new PopularityBasedStrategy(metrics, CLOCK))
            .register(new BanditStrategy(metrics, CLOCK, 0.1, new Random(3)))
            .build();
    }

    private static RecommendationRequest request(String context, String algorithm) {
        return new RecommendationRequest(42, 10, context, algorithm, Set.of(), Map.of());
    }

    @Test
    void should_UseOverride_When_RequestNamesAlgorithm() {
        StrategySelection selection = selector.selectStrategy(request("lobby", "popularitybased"), null);

        assertThat(selection.strategyName()).isEqualTo("PopularityBased");
        assertThat(selection.source()).isEqualTo(SelectionSource.OVERRIDE);
        verifyNoInteractions(experiments);
    }

    @Test
    void should_FallBackToCollaborative_When_OverrideUnknown() {
        StrategySelection selection = selector.selectStrategy(request("lobby", "Quantum"), null);

        assertThat(selection.strategyName()).isEqualTo("CollaborativeFiltering");
    }

    @Test
    void should_UseExperimentVariant_When_PlayerAssigned() {
        when(experiments.findActiveVariant(42, "lobby"))
            .thenReturn(Optional.of(new VariantAssignment("AlgoTest", "B", "Hybrid")));

        StrategySelection selection = selector.selectStrategy(request("lobby", null), player(42, 0, 0));

        assertThat(selection.strategyName()).isEqualTo("Hybrid");
        assertThat(selection.source()).isEqualTo(SelectionSource.EXPERIMENT);
        assertThat(selection.experimentVariant()).isEqualTo("AlgoTest/B");
    }

    @Test
    void should_UseContentBased_When_PlayerIsColdStart() {
        StrategySelection selection = selector.selectStrategy(request("lobby", null), player(42, 2, 1));

        assertThat(selection.strategyName()).isEqualTo("ContentBased");
        assertThat(selection.source()).isEqualTo(SelectionSource.PLAYER_PROFILE);
    }

    @Test
    void should_UseCollaborative_When_PlayerIsExperienced() {
        StrategySelection selection = selector.selectStrategy(request("lobby", null), player(42, 120, 40));

        assertThat(selection.strategyName()).isEqualTo("CollaborativeFiltering");
        assertThat(selection.source()).isEqualTo(SelectionSource.PLAYER_PROFILE);
    }

    @Test
    void should_UseHybrid_When_PreferencesAreDiverse() {
        StrategySelection selection = selector.selectStrategy(request("game_end", null),
            player(42, 20, 5, "slots", "live", "table", "crash"));

        assertThat(selection.strategyName()).isEqualTo("Hybrid");
    }

    @Test
    void should_UseContextDefault_When_NoProfileRuleMatches() {
        StrategySelection lobby = selector.selectStrategy(request("LOBBY", null), player(42, 20, 5));
        StrategySelection promotion = selector.selectStrategy(request("promotion", null), player(42, 20, 5));
        StrategySelection unknown = selector.selectStrategy(request("search", null), player(42, 20, 5));

        assertThat(lobby.strategyName()).isEqualTo("Hybrid");
        assertThat(lobby.source()).isEqualTo(SelectionSource.CONTEXT_DEFAULT);
        assertThat(promotion.strategyName()).isEqualTo("PopularityBased");
        assertThat(unknown.strategyName()).isEqualTo("CollaborativeFiltering");
        assertThat(unknown.source()).isEqualTo(SelectionSource.FALLBACK);
    }

    @Test
    void should_FallBack_When_FeaturesMissing() {
        StrategySelection selection = selector.selectStrategy(request("lobby", null), null);

        assertThat(selection.strategyName()).isEqualTo("CollaborativeFiltering");
        assertThat(selection.source()).isEqualTo(SelectionSource.FALLBACK);
    }

    @Test
    void should_FallBack_When_ExperimentLookupThrows() {
        when(experiments.findActiveVariant(anyLong(), anyString())).thenThrow(new IllegalStateException("db down"));

        StrategySelection selection = selector.selectStrategy(request("lobby", null), player(42, 2, 1));

        assertThat(selection.source()).isEqualTo(SelectionSource.FALLBACK);
    }

    @Test
    void should_UseCollaborativeFallback_When_FeatureStoreLookupThrows() {
        UnitOfWork uow = mock(UnitOfWork.class);
        PlayerFeatureRepository features = mock(PlayerFeatureRepository.class);
        when(unitOfWorkFactory.create()).thenReturn(uow);
        when(uow.getRepository(PlayerFeatureRepository.class)).thenReturn(features);
        when(features.findById(42L)).thenThrow(new IllegalStateException("feature store unavailable"));

        StrategySelection selection = selector.selectStrategy(request("lobby", null));

        assertThat(selection.strategyName()).isEqualTo("CollaborativeFiltering");
        assertThat(selection.source()).isEqualTo(SelectionSource.FALLBACK);
        verify(uow).close();
    }

    @Test
    void should_UseCollaborativeFallback_When_UnitOfWorkCannotBeOpened() {
        when(unitOfWorkFactory.create()).thenThrow(new IllegalStateException("pool exhausted"));

        StrategySelection selection = selector.selectStrategy(42, "lobby");

        assertThat(selection.strategyName()).isEqualTo("CollaborativeFiltering");
        assertThat(selection.source()).isEqualTo(SelectionSource.FALLBACK);
    }

    @Test
    void should_UseStoredVariant_When_SelectingForExperiment() {
        when(experiments.getPlayerVariant(42, "AlgoTest"))
            .thenReturn(Optional.of(new VariantAssignment("AlgoTest", "A", "ContentBased")));

        StrategySelection selection = selector.selectStrategyForExperiment(42, "AlgoTest");

        assertThat(selection.strategyName()).isEqualTo("ContentBased");
        assertThat(selection.experimentVariant()).isEqualTo("AlgoTest/A");
    }

    @Test
    void should_RankStrategiesByOverallScore_When_MetricsAvailable() {
        StrategyMetricsSource metrics = (name, window, context) -> {
            double ctr = switch (name) {
                case "Hybrid" -> 0.5;
                case "ContentBased" -> 0.3;
                case "PopularityBased" -> 0.1;
                default -> -1;
            };
            if (ctr < 0) {
                return Result.failure(ErrorCode.NOT_FOUND, "none");
            }
            return Result.success(StrategyPerformanceMetrics.builder()
                .strategyName(name)
                .window(window)
                .totalRecommendations(100)
                .clickedRecommendations((long) (ctr * 100))
                .clickThroughRate(ctr)
                .build());
        };
        StrategySelector ranking = new StrategySelector(registry(metrics), unitOfWorkFactory, experiments,
            StrategySelectionProperties.defaults());

        List<StrategyRanking> ranked = ranking.getStrategyRanking(TimeWindow.lastDays(30, CLOCK), null);

        assertThat(ranked).extracting(StrategyRanking::strategyName)
            .containsExactly("Hybrid", "ContentBased", "PopularityBased");
        assertThat(ranked).extracting(StrategyRanking::rank).containsExactly(1, 2, 3);
    }
}
