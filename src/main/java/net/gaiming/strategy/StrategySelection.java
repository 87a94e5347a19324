package net.gaiming.strategy;

import jakarta.annotation.Nullable;

import java.util.Objects;

/**
 * @param experimentVariant {@code experiment/variant} when an A/B assignment decided, otherwise {@code null}
 */
public record StrategySelection(RecommendationStrategy strategy,
                                SelectionSource source,
                                @Nullable String experimentVariant) {

    public StrategySelection {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(source, "source");
    }

    public static StrategySelection of(RecommendationStrategy strategy, SelectionSource source) {
        return new StrategySelection(strategy, source, null);
    }

    public String strategyName() {
        return strategy.name();
    }
}
