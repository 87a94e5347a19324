package net.gaiming.application.recommendation.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.gaiming.application.cqrs.CommandMetadata;
import net.gaiming.application.recommendation.RecommendationCacheKeys;
import net.gaiming.application.recommendation.command.CreateGameRecommendationCommand;
import net.gaiming.application.recommendation.command.TrackRecommendationInteractionCommand;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.strategy.StrategyRanking;
import net.gaiming.strategy.TimeWindow;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;
import net.gaiming.test.EmbeddedEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RecommendationQueryHandlersTest {

    private EmbeddedEngine engine;

    @BeforeEach
    void setUp() {
        engine = new EmbeddedEngine();
        engine.player(5, true).player(6, true).player(8, false);
        String[] types = {"slots", "roulette", "blackjack"};
        for (int i = 1; i <= 9; i++) {
            engine.game(i, i, types[i % 3], 0.3 + i * 0.05);
        }
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private long create(long playerId, long gameId, String algorithm, String context) {
        long id = engine.dispatcher().dispatch(CreateGameRecommendationCommand.builder()
            .playerId(playerId)
            .gameId(gameId)
            .algorithm(algorithm)
            .score(0.5)
            .position(1)
            .context(context)
            .confidence(0.5)
            .commandMetadata(CommandMetadata.system(engine.clock()))
            .build()).getValue();
        engine.clock().advance(Duration.ofMinutes(1));
        return id;
    }

    private void click(long recommendationId, long playerId, long gameId) {
        engine.dispatcher().dispatch(TrackRecommendationInteractionCommand.builder()
            .recommendationId(recommendationId)
            .playerId(playerId)
            .gameId(gameId)
            .interactionType("click")
            .sessionId("s")
            .commandMetadata(CommandMetadata.system(engine.clock()))
            .build());
    }

    @Nested
    class History {

        @Test
        void should_PageNewestFirst_When_PlayerHasManyRecommendations() {
            long oldest = create(5, 1, "ContentBased", "lobby");
            create(5, 2, "ContentBased", "lobby");
            create(5, 3, "Hybrid", "lobby");
            long newest = create(5, 4, "Hybrid", "game_end");
            create(6, 5, "Hybrid", "lobby");

            PagedResult<Recommendation> first = engine.dispatcher().dispatch(GetRecommendationHistoryQuery.builder()
                .playerId(5L).page(1).pageSize(3).build()).getValue();
            PagedResult<Recommendation> second = engine.dispatcher().dispatch(GetRecommendationHistoryQuery.builder()
                .playerId(5L).page(2).pageSize(3).build()).getValue();

            assertThat(first.totalCount()).isEqualTo(4);
            assertThat(first.totalPages()).isEqualTo(2);
            assertThat(first.hasNext()).isTrue();
            assertThat(first.items()).hasSize(3);
            assertThat(first.items().get(0).getId()).isEqualTo(newest);
            assertThat(second.items()).extracting(Recommendation::getId).containsExactly(oldest);
            assertThat(second.hasNext()).isFalse();
        }

        @Test
        void should_CombineFilters_When_SeveralCriteriaGiven() {
            create(5, 1, "ContentBased", "lobby");
            long hybridLobby = create(5, 2, "Hybrid", "lobby");
            long clickedHybrid = create(5, 3, "Hybrid", "lobby");
            create(5, 4, "Hybrid", "game_end");
            click(clickedHybrid, 5, 3);

            PagedResult<Recommendation> unclicked = engine.dispatcher().dispatch(GetRecommendationHistoryQuery.builder()
                .playerId(5L).algorithm("hybrid").context("LOBBY").clicked(false).build()).getValue();

            assertThat(unclicked.items()).extracting(Recommendation::getId).containsExactly(hybridLobby);
        }

        @Test
        void should_RestrictToWindow_When_FromAndToGiven() {
            Instant before = engine.clock().instant();
            create(5, 1, "ContentBased", "lobby");
            long inside = create(5, 2, "ContentBased", "lobby");
            Instant after = engine.clock().instant();
            create(5, 3, "ContentBased", "lobby");

            PagedResult<Recommendation> window = engine.dispatcher().dispatch(GetRecommendationHistoryQuery.builder()
                .from(before.plus(Duration.ofSeconds(30))).to(after.minus(Duration.ofSeconds(1))).build()).getValue();

            assertThat(window.items()).extracting(Recommendation::getId).containsExactly(inside);
        }

        @Test
        void should_FailValidation_When_PageSizeTooLarge() {
            Result<PagedResult<Recommendation>> result = engine.dispatcher().dispatch(
                GetRecommendationHistoryQuery.builder().pageSize(GetRecommendationHistoryQuery.MAX_PAGE_SIZE + 1).build());

            assertThat(result.getError().code()).isEqualTo(ErrorCode.VALIDATION);
        }

        @Test
        void should_FailValidation_When_FromAfterTo() {
            Result<PagedResult<Recommendation>> result = engine.dispatcher().dispatch(GetRecommendationHistoryQuery
                .builder().from(EmbeddedEngine.START).to(EmbeddedEngine.START.minusSeconds(1)).build());

            assertThat(result.getError().code()).isEqualTo(ErrorCode.VALIDATION);
        }
    }

    @Nested
    class StrategyRankingQuery {

        @Test
        void should_RankByEngagementAndSkipStrategiesWithoutData_When_WindowHasActivity() {
            long first = create(5, 1, "ContentBased", "lobby");
            long second = create(5, 2, "ContentBased", "lobby");
            create(6, 3, "Hybrid", "lobby");
            create(6, 4, "Hybrid", "lobby");
            click(first, 5, 1);
            click(second, 5, 2);
            engine.jdbcTemplate().update("INSERT INTO strategy_metric_samples (algorithm, metric_name, metric_value, "
                + "measured_at, measurement_period) VALUES (?, ?, ?, ?, ?)",
                "PopularityBased", "diversity", 0.5, Timestamp.from(engine.clock().instant()), "daily");

            List<StrategyRanking> ranking = engine.dispatcher()
                .dispatch(new GetStrategyRankingQuery(TimeWindow.lastDays(7, engine.clock()), null))
                .getValue();

            assertThat(ranking).extracting(StrategyRanking::strategyName)
                .containsExactly("ContentBased", "PopularityBased", "Hybrid");
            assertThat(ranking).extracting(StrategyRanking::rank).containsExactly(1, 2, 3);
            assertThat(ranking.get(0).metrics().getClickThroughRate()).isEqualTo(1.0);
        }

        @Test
        void should_CountOnlyContext_When_ContextGiven() {
            create(5, 1, "ContentBased", "lobby");
            create(5, 2, "Hybrid", "promotion");

            List<StrategyRanking> ranking = engine.dispatcher()
                .dispatch(new GetStrategyRankingQuery(TimeWindow.lastDays(7, engine.clock()), "promotion"))
                .getValue();

            assertThat(ranking).extracting(StrategyRanking::strategyName).containsExactly("Hybrid");
        }

        @Test
        void should_FailValidation_When_WindowMissing() {
            assertThat(engine.dispatcher().dispatch(new GetStrategyRankingQuery(null, null)).getError().code())
                .isEqualTo(ErrorCode.VALIDATION);
        }
    }

    @Nested
    class Recommendations {

        private Result<List<Recommendation>> recommend(long playerId, int count, Set<Long> excluded) {
            return engine.dispatcher().dispatch(
                new GetRecommendationsQuery(playerId, count, "lobby", null, excluded, Map.of()));
        }

        @Test
        void should_ServeFromCache_When_SameQueryRepeated() {
            List<Recommendation> first = recommend(5, 4, Set.of()).getValue();
            engine.jdbcTemplate().update("UPDATE game_features SET is_active = FALSE");

            List<Recommendation> second = recommend(5, 4, Set.of()).getValue();

            assertThat(first).isNotEmpty();
            assertThat(second).isEqualTo(first);
            assertThat(engine.cache().exists(
                RecommendationCacheKeys.forQuery(5, null, "lobby", 4, Set.of()))).isTrue();
        }

        @Test
        void should_RunPipelineAgain_When_ExclusionsDiffer() {
            List<Recommendation> first = recommend(5, 4, Set.of()).getValue();
            long topGame = first.get(0).getGameId();

            List<Recommendation> second = recommend(5, 4, Set.of(topGame)).getValue();

            assertThat(second).extracting(Recommendation::getGameId).doesNotContain(topGame);
        }

        @Test
        void should_NeverReturnExcludedGames_When_ExclusionSetsShareStringHash() {
            Set<Long> first = Set.of(102L, 104L, 106L, 112L, 53956L);
            Set<Long> second = Set.of(101L, 107L, 108L, 110L, 71499L);
            String[] types = {"slots", "roulette", "blackjack", "poker"};
            for (long gameId = 101; gameId <= 112; gameId++) {
                engine.game(gameId, (int) gameId, types[(int) (gameId % 4)], 0.8 + gameId / 1000.0);
            }
            assertThat(recommend(5, 6, first).isSuccess()).isTrue();

            List<Recommendation> served = recommend(5, 6, second).getValue();

            assertThat(served).extracting(Recommendation::getGameId).doesNotContainAnyElementsOf(second);
        }

        @Test
        void should_FailWithoutCaching_When_PlayerInactive() {
            Result<List<Recommendation>> result = recommend(8, 4, Set.of());

            assertThat(result.getError().code()).isEqualTo(ErrorCode.VALIDATION);
            assertThat(engine.cache().exists(RecommendationCacheKeys.forQuery(8, null, "lobby", 4, Set.of())))
                .isFalse();
        }

        @Test
        void should_ReportNotFound_When_PlayerUnknown() {
            assertThat(recommend(404, 4, Set.of()).getError().code()).isEqualTo(ErrorCode.NOT_FOUND);
        }

        @Test
        void should_FailValidation_When_CountAboveMaximum() {
            assertThat(recommend(5, 101, Set.of()).getError().code()).isEqualTo(ErrorCode.VALIDATION);
        }
    }
}
