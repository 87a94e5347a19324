package net.gaiming.strategy;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared generation template: validate, drop excluded and duplicate games, score, rank and
 * number the survivors. Subclasses provide the scoring.
 */
@Slf4j
public abstract class AbstractRecommendationStrategy implements RecommendationStrategy {

    public static final String CONTEXT_KEY = "context";

    private static final Comparator<ScoredGame> BY_SCORE_DESC = Comparator
        .comparingDouble(ScoredGame::score).reversed()
        .thenComparingLong(scored -> scored.game().getGameId());

    private final StrategyMetricsSource metricsSource;
    protected final Clock clock;

    protected AbstractRecommendationStrategy(StrategyMetricsSource metricsSource, Clock clock) {
        this.metricsSource = Objects.requireNonNull(metricsSource, "metricsSource");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String version() {
        return "1.0";
    }

    @Override
    public boolean supportsRealTime() {
        return true;
    }

    @Override
    public Result<Void> validateRequest(RecommendationRequest request) {
        if (request == null) {
            return Result.failure(ErrorCode.VALIDATION, "Recommendation request is required");
        }
        if (request.playerId() <= 0) {
            return Result.failure(ErrorCode.VALIDATION, "Invalid player ID");
        }
        if (request.count() < 1) {
            return Result.failure(ErrorCode.VALIDATION, "Count must be at least 1, was " + request.count());
        }
        return Result.success();
    }

    @Override
    public final Result<List<Recommendation>> generateRecommendations(RecommendationRequest request,
                                                                      PlayerFeatures player,
                                                                      List<GameFeatures> games) {
        Result<Void> validation = validateRequest(request);
        if (validation.isFailure()) {
            return validation.propagateFailure();
        }
        if (player == null) {
            return Result.failure(ErrorCode.VALIDATION, "Player features are required");
        }
        if (games == null || games.isEmpty()) {
            return Result.success(List.of());
        }

        Map<Long, GameFeatures> candidates = new LinkedHashMap<>();
        for (GameFeatures game : games) {
            if (game != null && !request.isExcluded(game.getGameId())) {
                candidates.putIfAbsent(game.getGameId(), game);
            }
        }
        if (candidates.isEmpty()) {
            return Result.success(List.of());
        }

        Map<String, Object> scoringContext = scoringContext(request);
        Result<Map<Long, Double>> scores;
        try {
            scores = scoreCandidates(player, List.copyOf(candidates.values()), scoringContext);
        } catch (RuntimeException ex) {
            log.error("Strategy {} failed scoring {} candidates for player {}", name(), candidates.size(),
                request.playerId(), ex);
            return Result.failure(ErrorCode.UNEXPECTED, "Strategy " + name() + " failed: " + ex.getMessage(), ex);
        }
        if (scores.isFailure()) {
            return scores.propagateFailure();
        }

        List<ScoredGame> ranked = new ArrayList<>(candidates.size());
        for (GameFeatures game : candidates.values()) {
            Double score = scores.getValue().get(game.getGameId());
            if (score != null) {
                ranked.add(new ScoredGame(game, clamp(score)));
            }
        }
        ranked.sort(BY_SCORE_DESC);

        Instant generatedAt = clock.instant();
        int limit = Math.min(request.count(), ranked.size());
        List<Recommendation> recommendations = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            ScoredGame scored = ranked.get(i);
            recommendations.add(toRecommendation(request, player, scored, i + 1, generatedAt));
        }
        log.debug("Strategy {} produced {} of {} requested recommendations for player {}",
            name(), recommendations.size(), request.count(), request.playerId());
        return Result.success(List.copyOf(recommendations));
    }

    @Override
    public Result<StrategyPerformanceMetrics> getPerformanceMetrics(TimeWindow window, @Nullable String context) {
        return metricsSource.metricsFor(name(), window, context);
    }

    /**
     * Scores every candidate. The default scores games one by one through
     * {@link #calculateScore}; strategies backed by a batch scorer override it.
     */
    protected Result<Map<Long, Double>> scoreCandidates(PlayerFeatures player,
                                                        List<GameFeatures> candidates,
                                                        Map<String, Object> context) {
        Map<Long, Double> scores = new HashMap<>();
        for (GameFeatures game : candidates) {
            scores.put(game.getGameId(), calculateScore(player, game, context));
        }
        return Result.success(scores);
    }

    protected abstract String reasonFor(PlayerFeatures player, GameFeatures game, double score);

    /**
     * Confidence reported with a recommendation. Defaults to the score itself.
     */
    protected double confidenceFor(PlayerFeatures player, GameFeatures game, double score) {
        return score;
    }

    protected Map<String, Object> scoringContext(RecommendationRequest request) {
        Map<String, Object> context = new HashMap<>(request.parameters());
        context.put(CONTEXT_KEY, request.context());
        return context;
    }

    protected static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private Recommendation toRecommendation(RecommendationRequest request, PlayerFeatures player,
                                            ScoredGame scored, int position, Instant generatedAt) {
        GameFeatures game = scored.game();
        return Recommendation.builder()
            .playerId(request.playerId())
            .gameId(game.getGameId())
            .algorithm(name())
            .score(scored.score())
            .position(position)
            .context(request.context())
            .category(game.getGameType() == null ? "" : game.getGameType())
            .reason(reasonFor(player, game, scored.score()))
            .confidence(clamp(confidenceFor(player, game, scored.score())))
            .modelVersion(version())
            .featureValue("popularity", game.getPopularityScore())
            .featureValue("rtp", game.getAverageRtp())
            .metadataEntry("providerId", game.getProviderId())
            .metadataEntry("gameName", game.getGameName() == null ? "" : game.getGameName())
            .generatedAt(generatedAt)
            .build();
    }

    private record ScoredGame(GameFeatures game, double score) {
    }
}
