package net.gaiming.strategy;

import static net.gaiming.strategy.StrategyFixtures.CLOCK;
import static net.gaiming.strategy.StrategyFixtures.NO_METRICS;
import static net.gaiming.strategy.StrategyFixtures.game;
import static net.gaiming.strategy.StrategyFixtures.player;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class DeepLearningStrategyTest {

    private ModelServingClient modelClient;
    private DeepLearningStrategy strategy;

    private final List<GameFeatures> games = List.of(game(1, "slots", "NetEnt", 0.2), game(2, "live", "Evolution", 0.4));

    @BeforeEach
    void setUp() {
        modelClient = mock(ModelServingClient.class);
        when(modelClient.modelVersion()).thenReturn("recommendation_model.pb");
        strategy = new DeepLearningStrategy(NO_METRICS, CLOCK, modelClient, Duration.ofMillis(50));
    }

    @Test
    void should_RankByModelScores_When_ModelAnswers() {
        when(modelClient.score(any(PlayerFeatures.class), anyList())).thenReturn(Mono.just(Map.of(1L, 0.9, 2L, 0.3)));

        List<Recommendation> result = strategy
            .generateRecommendations(RecommendationRequest.of(7, 5, "lobby"), player(7, 10, 2), games)
            .getValue();

        assertThat(result).extracting(Recommendation::getGameId).containsExactly(1L, 2L);
        assertThat(result.get(0).getModelVersion()).isEqualTo("recommendation_model.pb");
    }

    @Test
    void should_FailTransient_When_ModelTimesOut() {
        when(modelClient.score(any(PlayerFeatures.class), anyList())).thenReturn(Mono.never());

        Result<List<Recommendation>> result =
            strategy.generateRecommendations(RecommendationRequest.of(7, 5, "lobby"), player(7, 10, 2), games);

        assertThat(result.getError().code()).isEqualTo(ErrorCode.TRANSIENT);
        assertThat(result.getError().cause()).isInstanceOf(TimeoutException.class);
    }

    @Test
    void should_FailTransient_When_ModelErrors() {
        when(modelClient.score(any(PlayerFeatures.class), anyList()))
            .thenReturn(Mono.error(new IllegalStateException("model not loaded")));

        Result<List<Recommendation>> result =
            strategy.generateRecommendations(RecommendationRequest.of(7, 5, "lobby"), player(7, 10, 2), games);

        assertThat(result.getError().code()).isEqualTo(ErrorCode.TRANSIENT);
        assertThat(result.getError().message()).contains("model not loaded");
    }

    @Test
    void should_NotSupportRealTime_When_Asked() {
        assertThat(strategy.supportsRealTime()).isFalse();
        assertThat(strategy.version()).isEqualTo("recommendation_model.pb");
    }

    @Test
    void should_ScoreByEmbeddingSimilarity_When_BothSidesHaveVectors() {
        EmbeddingModelServingClient client = new EmbeddingModelServingClient("models/recommendation_model.pb");
        PlayerFeatures player = player(7, 10, 2).toBuilder()
            .customFeature("emb_0", 1.0)
            .customFeature("emb_1", 0.0)
            .build();
        GameFeatures aligned = game(1, "slots", "NetEnt", 0.2).toBuilder()
            .feature("emb_0", 2.0).feature("emb_1", 0.0).build();
        GameFeatures opposite = game(2, "slots", "NetEnt", 0.2).toBuilder()
            .feature("emb_0", -1.0).feature("emb_1", 0.0).build();
        GameFeatures noVector = game(3, "slots", "NetEnt", 0.6);

        Map<Long, Double> scores = client.score(player, List.of(aligned, opposite, noVector)).block();

        assertThat(client.modelVersion()).isEqualTo("recommendation_model.pb");
        assertThat(scores).containsEntry(1L, 1.0).containsEntry(2L, 0.0).containsEntry(3L, 0.6);
    }
}
