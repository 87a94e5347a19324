package net.gaiming.strategy;

import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;

import java.time.Clock;
import java.util.Map;

public class PopularityBasedStrategy extends AbstractRecommendationStrategy {

    private static final double POPULARITY_WEIGHT = 0.7;
    private static final double REVENUE_WEIGHT = 0.3;

    public PopularityBasedStrategy(StrategyMetricsSource metricsSource, Clock clock) {
        super(metricsSource, clock);
    }

    @Override
    public String name() {
        return StrategyKind.POPULARITY_BASED.strategyName();
    }

    @Override
    public String description() {
        return "Most played and highest earning games";
    }

    @Override
    public boolean requiresTraining() {
        return false;
    }

    @Override
    public double calculateScore(PlayerFeatures player, GameFeatures game, Map<String, Object> context) {
        return clamp(POPULARITY_WEIGHT * game.getPopularityScore() + REVENUE_WEIGHT * game.getRevenueScore());
    }

    @Override
    protected String reasonFor(PlayerFeatures player, GameFeatures game, double score) {
        return "Popular with players right now";
    }
}
