package net.gaiming.strategy;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;
import reactor.core.Exceptions;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Delegates scoring to a served model. Every call is bounded by {@code timeout}; a slow or
 * failing model yields a {@code TRANSIENT} failure instead of a partial list.
 */
@Slf4j
public class DeepLearningStrategy extends AbstractRecommendationStrategy {

    private final ModelServingClient modelClient;
    private final Duration timeout;

    public DeepLearningStrategy(StrategyMetricsSource metricsSource, Clock clock,
                                ModelServingClient modelClient, Duration timeout) {
        super(metricsSource, clock);
        this.modelClient = Objects.requireNonNull(modelClient, "modelClient");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public String name() {
        return StrategyKind.DEEP_LEARNING.strategyName();
    }

    @Override
    public String version() {
        return modelClient.modelVersion();
    }

    @Override
    public String description() {
        return "Neural scoring through the model-serving client";
    }

    @Override
    public boolean supportsRealTime() {
        return false;
    }

    @Override
    public boolean requiresTraining() {
        return true;
    }

    @Override
    public double calculateScore(PlayerFeatures player, GameFeatures game, Map<String, Object> context) {
        Result<Map<Long, Double>> scored = scoreCandidates(player, List.of(game), context);
        if (scored.isFailure()) {
            return 0.0;
        }
        return clamp(scored.getValue().getOrDefault(game.getGameId(), 0.0));
    }

    @Override
    protected Result<Map<Long, Double>> scoreCandidates(PlayerFeatures player,
                                                        List<GameFeatures> candidates,
                                                        Map<String, Object> context) {
        try {
            Map<Long, Double> scores = modelClient.score(player, candidates)
                .timeout(timeout)
                .block();
            return Result.success(scores == null ? Map.of() : scores);
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (cause instanceof TimeoutException) {
                log.warn("Model {} did not answer within {} ms for player {}",
                    modelClient.modelVersion(), timeout.toMillis(), player.getPlayerId());
                return Result.failure(ErrorCode.TRANSIENT,
                    "Model serving timed out after " + timeout.toMillis() + " ms", cause);
            }
            log.warn("Model {} failed for player {}: {}", modelClient.modelVersion(), player.getPlayerId(),
                cause.getMessage());
            return Result.failure(ErrorCode.TRANSIENT, "Model serving failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    protected String reasonFor(PlayerFeatures player, GameFeatures game, double score) {
        return "Picked for you by our recommendation model";
    }
}
