package net.gaiming.strategy;

import java.util.Arrays;
import java.util.Optional;

/**
 * The built-in strategy families. Additional strategies can be registered under their own
 * names in {@link StrategyRegistry}.
 */
public enum StrategyKind {
    COLLABORATIVE_FILTERING("CollaborativeFiltering"),
    CONTENT_BASED("ContentBased"),
    HYBRID("Hybrid"),
    POPULARITY_BASED("PopularityBased"),
    BANDIT("Bandit"),
    DEEP_LEARNING("DeepLearning");

    private final String strategyName;

    StrategyKind(String strategyName) {
        this.strategyName = strategyName;
    }

    public String strategyName() {
        return strategyName;
    }

    public static Optional<StrategyKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(kind -> kind.strategyName.equalsIgnoreCase(name.trim()) || kind.name().equalsIgnoreCase(name.trim()))
            .findFirst();
    }
}
