package net.gaiming.strategy;

import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;

import java.time.Clock;
import java.util.Map;

/**
 * Neighbourhood affinity blended with popularity.
 *
 * <p>The affinity of a player for a game comes from the player's {@code affinity:<gameId>}
 * custom feature when the offline job computed one, otherwise from the game's aggregate
 * {@code neighbour_affinity} feature, otherwise from its popularity.</p>
 */
public class CollaborativeFilteringStrategy extends AbstractRecommendationStrategy {

    static final String PLAYER_AFFINITY_PREFIX = "affinity:";
    static final String GAME_AFFINITY_FEATURE = "neighbour_affinity";
    private static final double AFFINITY_WEIGHT = 0.7;
    private static final double POPULARITY_WEIGHT = 0.3;

    public CollaborativeFilteringStrategy(StrategyMetricsSource metricsSource, Clock clock) {
        super(metricsSource, clock);
    }

    @Override
    public String name() {
        return StrategyKind.COLLABORATIVE_FILTERING.strategyName();
    }

    @Override
    public String description() {
        return "Collaborative filtering based on player-game interactions";
    }

    @Override
    public boolean requiresTraining() {
        return true;
    }

    @Override
    public double calculateScore(PlayerFeatures player, GameFeatures game, Map<String, Object> context) {
        return clamp(AFFINITY_WEIGHT * affinity(player, game) + POPULARITY_WEIGHT * game.getPopularityScore());
    }

    double affinity(PlayerFeatures player, GameFeatures game) {
        Double personal = player.getCustomFeatures().get(PLAYER_AFFINITY_PREFIX + game.getGameId());
        if (personal != null) {
            return personal;
        }
        return game.feature(GAME_AFFINITY_FEATURE, game.getPopularityScore());
    }

    @Override
    protected String reasonFor(PlayerFeatures player, GameFeatures game, double score) {
        return "Players with similar history enjoyed this game";
    }
}
