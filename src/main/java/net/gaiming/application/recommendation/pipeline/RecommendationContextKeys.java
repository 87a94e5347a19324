package net.gaiming.application.recommendation.pipeline;

import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.Player;
import net.gaiming.domain.model.PlayerFeatures;
import net.gaiming.pipeline.ContextKey;
import net.gaiming.strategy.StrategySelection;

import java.util.List;

/**
 * Properties the recommendation steps hand to each other through the pipeline context.
 */
public final class RecommendationContextKeys {

    public static final ContextKey<Long> PLAYER_ID = ContextKey.of("PlayerId", Long.class);
    public static final ContextKey<Player> PLAYER = ContextKey.of("Player", Player.class);
    public static final ContextKey<PlayerFeatures> PLAYER_FEATURES =
        ContextKey.of("PlayerFeatures", PlayerFeatures.class);
    /** Set when the feature store had no profile and defaults were used. */
    public static final ContextKey<Boolean> FEATURES_DEFAULTED = ContextKey.of("FeaturesDefaulted", Boolean.class);
    public static final ContextKey<List<GameFeatures>> GAME_FEATURES = ContextKey.named("GameFeatures");
    public static final ContextKey<StrategySelection> STRATEGY_SELECTION =
        ContextKey.of("StrategySelection", StrategySelection.class);
    public static final ContextKey<String> CACHE_KEY = ContextKey.of("CacheKey", String.class);

    private RecommendationContextKeys() {
    }
}
