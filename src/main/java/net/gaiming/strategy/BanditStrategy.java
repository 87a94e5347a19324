package net.gaiming.strategy;

import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Epsilon-greedy multi-armed bandit over the catalogue. With probability
 * {@code explorationRate} a game gets a random score; otherwise its estimated reward.
 */
public class BanditStrategy extends AbstractRecommendationStrategy {

    static final String REWARD_FEATURE = "bandit_reward";

    private final double explorationRate;
    private final Random random;

    public BanditStrategy(StrategyMetricsSource metricsSource, Clock clock, double explorationRate, Random random) {
        super(metricsSource, clock);
        if (explorationRate < 0 || explorationRate > 1) {
            throw new IllegalArgumentException("explorationRate must be within [0, 1]: " + explorationRate);
        }
        this.explorationRate = explorationRate;
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public String name() {
        return StrategyKind.BANDIT.strategyName();
    }

    @Override
    public String description() {
        return "Epsilon-greedy multi-armed bandit balancing exploration and exploitation";
    }

    @Override
    public boolean requiresTraining() {
        return true;
    }

    public double explorationRate() {
        return explorationRate;
    }

    @Override
    public double calculateScore(PlayerFeatures player, GameFeatures game, Map<String, Object> context) {
        if (random.nextDouble() < explorationRate) {
            return random.nextDouble();
        }
        return clamp(game.feature(REWARD_FEATURE, game.getPopularityScore()));
    }

    @Override
    protected String reasonFor(PlayerFeatures player, GameFeatures game, double score) {
        return "Picked by live engagement testing";
    }
}
