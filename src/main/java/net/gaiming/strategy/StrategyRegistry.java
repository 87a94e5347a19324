package net.gaiming.strategy;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, case-insensitive lookup of strategies by name, built once at startup.
 * Unknown names resolve to collaborative filtering.
 */
@Slf4j
public final class StrategyRegistry {

    private final Map<String, RecommendationStrategy> strategies;
    private final RecommendationStrategy fallback;

    private StrategyRegistry(Map<String, RecommendationStrategy> strategies) {
        this.strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
        this.fallback = strategies.get(key(StrategyKind.COLLABORATIVE_FILTERING.strategyName()));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RecommendationStrategy> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(strategies.get(key(name)));
    }

    /**
     * Returns the named strategy, or collaborative filtering when the name is unknown.
     */
    public RecommendationStrategy resolve(String name) {
        Optional<RecommendationStrategy> found = find(name);
        if (found.isEmpty()) {
            log.warn("Strategy {} not found, falling back to {}", name, fallback.name());
            return fallback;
        }
        return found.get();
    }

    public RecommendationStrategy resolve(StrategyKind kind) {
        return resolve(kind.strategyName());
    }

    public RecommendationStrategy fallback() {
        return fallback;
    }

    /**
     * Every registered strategy in registration order.
     */
    public List<RecommendationStrategy> all() {
        return List.copyOf(strategies.values());
    }

    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (RecommendationStrategy strategy : strategies.values()) {
            names.add(strategy.name());
        }
        return names;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {

        private final Map<String, RecommendationStrategy> strategies = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a strategy under its own {@link RecommendationStrategy#name()}.
         *
         * @throws IllegalStateException when the name is already taken
         */
        public Builder register(RecommendationStrategy strategy) {
            String key = key(strategy.name());
            if (strategies.putIfAbsent(key, strategy) != null) {
                throw new IllegalStateException("Strategy already registered: " + strategy.name());
            }
            return this;
        }

        public StrategyRegistry build() {
            if (!strategies.containsKey(key(StrategyKind.COLLABORATIVE_FILTERING.strategyName()))) {
                throw new IllegalStateException("Registry needs the "
                    + StrategyKind.COLLABORATIVE_FILTERING.strategyName() + " strategy as its fallback");
            }
            StrategyRegistry registry = new StrategyRegistry(strategies);
            log.info("Registered {} recommendation strategies: {}", strategies.size(), registry.names());
            return registry;
        }
    }
}
