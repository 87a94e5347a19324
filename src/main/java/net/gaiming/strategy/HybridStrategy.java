package net.gaiming.strategy;

import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Weighted blend of collaborative filtering, content matching and popularity.
 */
public class HybridStrategy extends AbstractRecommendationStrategy {

    private static final double COLLABORATIVE_WEIGHT = 0.5;
    private static final double CONTENT_WEIGHT = 0.3;
    private static final double POPULARITY_WEIGHT = 0.2;

    private final CollaborativeFilteringStrategy collaborative;
    private final ContentBasedStrategy content;

    public HybridStrategy(StrategyMetricsSource metricsSource, Clock clock,
                          CollaborativeFilteringStrategy collaborative, ContentBasedStrategy content) {
        super(metricsSource, clock);
        this.collaborative = Objects.requireNonNull(collaborative, "collaborative");
        this.content = Objects.requireNonNull(content, "content");
    }

    @Override
    public String name() {
        return StrategyKind.HYBRID.strategyName();
    }

    @Override
    public String description() {
        return "Blend of collaborative, content-based and popularity signals";
    }

    @Override
    public boolean requiresTraining() {
        return true;
    }

    @Override
    public double calculateScore(PlayerFeatures player, GameFeatures game, Map<String, Object> context) {
        return clamp(COLLABORATIVE_WEIGHT * collaborative.calculateScore(player, game, context)
            + CONTENT_WEIGHT * content.calculateScore(player, game, context)
            + POPULARITY_WEIGHT * game.getPopularityScore());
    }

    @Override
    protected String reasonFor(PlayerFeatures player, GameFeatures game, double score) {
        if (player.prefersGameType(game.getGameType())) {
            return "Popular with similar players and matches your taste in " + game.getGameType();
        }
        return "Recommended from your play history and similar players";
    }
}
