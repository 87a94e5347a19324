package net.gaiming;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.gaiming.application.cqrs.CommandMetadata;
import net.gaiming.application.cqrs.Dispatcher;
import net.gaiming.application.experiment.CreateExperimentCommand;
import net.gaiming.application.experiment.StartExperimentCommand;
import net.gaiming.application.recommendation.RecommendationCacheKeys;
import net.gaiming.application.recommendation.RecommendationProperties;
import net.gaiming.application.recommendation.query.GetRecommendationsQuery;
import net.gaiming.config.StrategyProperties;
import net.gaiming.domain.model.ExperimentVariant;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.support.cache.CacheService;
import net.gaiming.support.result.Result;
import net.gaiming.test.annotations.DbIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Smoke test of the wired application against the embedded database.
 */
@DbIntegrationTest
class GamingRecommendationEngineApplicationTest {

    @Autowired
    private Dispatcher dispatcher;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private CacheService cacheService;

    @Autowired
    private StrategyProperties strategyProperties;

    @Autowired
    private RecommendationProperties recommendationProperties;

    @Autowired
    private Clock clock;

    @Test
    void should_BindConfiguredDefaults_When_ContextLoads() {
        assertThat(strategyProperties.getContextDefaults())
            .containsEntry("lobby", "Hybrid")
            .containsEntry("promotion", "PopularityBased");
        assertThat(strategyProperties.getDeepLearningTimeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(recommendationProperties.pipelineTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(recommendationProperties.maxPerCategory()).isEqualTo(3);
    }

    @Test
    void should_ServeAndCacheRecommendations_When_DispatchedThroughContext() {
        Instant registered = clock.instant().minus(Duration.ofDays(3));
        jdbcTemplate.update("INSERT INTO players (id, username, is_active, registered_at) VALUES (?, ?, ?, ?)",
            9001L, "smoke", true, Timestamp.from(registered));
        for (int i = 1; i <= 4; i++) {
            jdbcTemplate.update("INSERT INTO game_features (game_id, game_name, provider_id, game_type_id, game_type, "
                    + "popularity_score, is_active) VALUES (?, ?, ?, ?, ?, ?, ?)",
                9100L + i, "Smoke " + i, i, i, "type" + i, 0.5, true);
        }

        Result<List<Recommendation>> result = dispatcher.dispatch(
            new GetRecommendationsQuery(9001, 3, "lobby", null, Set.of(), Map.of()));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).hasSize(3);
        assertThat(cacheService.exists(RecommendationCacheKeys.forQuery(9001, null, "lobby", 3, Set.of()))).isTrue();
    }

    @Test
    void should_EvictCachedListsThroughSpringEvents_When_ExperimentStarts() {
        cacheService.set(RecommendationCacheKeys.forPlayer(9002), List.of(), Duration.ofMinutes(5));
        CommandMetadata metadata = CommandMetadata.system(clock);
        dispatcher.dispatch(new CreateExperimentCommand("SmokeTest", null, List.of("promotion"),
            List.of(new ExperimentVariant("A", "PopularityBased", 1)), clock.instant(), null, metadata));

        Result<Boolean> started = dispatcher.dispatch(new StartExperimentCommand("SmokeTest", metadata));

        assertThat(started.getValue()).isTrue();
        assertThat(cacheService.exists(RecommendationCacheKeys.forPlayer(9002))).isFalse();
    }
}
