package net.gaiming.strategy;

import jakarta.annotation.Nullable;
import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.support.result.Result;

import java.util.List;
import java.util.Map;

/**
 * One interchangeable recommendation algorithm.
 *
 * <p>Generated lists never exceed {@code request.count()}, never contain an excluded game or
 * the same game twice, and carry positions {@code 1..n} in descending score order.</p>
 */
public interface RecommendationStrategy {

    String name();

    String version();

    String description();

    boolean supportsRealTime();

    boolean requiresTraining();

    Result<Void> validateRequest(RecommendationRequest request);

    Result<List<Recommendation>> generateRecommendations(RecommendationRequest request,
                                                         PlayerFeatures player,
                                                         List<GameFeatures> games);

    /**
     * Relevance of one game for one player, clamped to {@code [0, 1]}.
     */
    double calculateScore(PlayerFeatures player, GameFeatures game, Map<String, Object> context);

    default Result<StrategyPerformanceMetrics> getPerformanceMetrics(TimeWindow window) {
        return getPerformanceMetrics(window, null);
    }

    /**
     * @param context restricts live counts to one serving context, {@code null} for all
     */
    Result<StrategyPerformanceMetrics> getPerformanceMetrics(TimeWindow window, @Nullable String context);
}
