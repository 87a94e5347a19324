package net.gaiming.strategy;

import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;

import java.time.Clock;
import java.util.Map;

/**
 * Matches game attributes against the player's stated and observed preferences.
 * Needs no interaction history, so it serves cold-start players.
 */
public class ContentBasedStrategy extends AbstractRecommendationStrategy {

    private static final double TYPE_WEIGHT = 0.35;
    private static final double PROVIDER_WEIGHT = 0.25;
    private static final double RTP_WEIGHT = 0.2;
    private static final double VOLATILITY_WEIGHT = 0.2;
    private static final double NEUTRAL_CLOSENESS = 0.5;
    private static final double RTP_TOLERANCE = 10.0;
    private static final double VOLATILITY_TOLERANCE = 4.0;

    public ContentBasedStrategy(StrategyMetricsSource metricsSource, Clock clock) {
        super(metricsSource, clock);
    }

    @Override
    public String name() {
        return StrategyKind.CONTENT_BASED.strategyName();
    }

    @Override
    public String description() {
        return "Content-based filtering using game features";
    }

    @Override
    public boolean requiresTraining() {
        return false;
    }

    @Override
    public double calculateScore(PlayerFeatures player, GameFeatures game, Map<String, Object> context) {
        double typeMatch = player.prefersGameType(game.getGameType()) ? 1.0 : 0.0;
        double providerMatch = player.prefersProvider(game.getProviderName()) ? 1.0 : 0.0;
        double rtpCloseness = closeness(player.getPreferredRtp(), game.getAverageRtp(), RTP_TOLERANCE);
        double volatilityCloseness = closeness(player.getPreferredVolatility(), game.getVolatilityId(), VOLATILITY_TOLERANCE);
        return clamp(TYPE_WEIGHT * typeMatch
            + PROVIDER_WEIGHT * providerMatch
            + RTP_WEIGHT * rtpCloseness
            + VOLATILITY_WEIGHT * volatilityCloseness);
    }

    /**
     * 1 for an exact match, falling linearly to 0 at {@code tolerance}; neutral when the
     * player has no preference recorded.
     */
    static double closeness(double preferred, double actual, double tolerance) {
        if (preferred <= 0) {
            return NEUTRAL_CLOSENESS;
        }
        return 1.0 - Math.min(Math.abs(actual - preferred) / tolerance, 1.0);
    }

    @Override
    protected String reasonFor(PlayerFeatures player, GameFeatures game, double score) {
        if (player.prefersGameType(game.getGameType())) {
            return "Matches your favourite game type: " + game.getGameType();
        }
        if (player.prefersProvider(game.getProviderName())) {
            return "From a provider you play often: " + game.getProviderName();
        }
        return "Similar to games you might like";
    }
}
