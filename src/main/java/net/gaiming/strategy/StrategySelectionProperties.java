package net.gaiming.strategy;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thresholds and context defaults driving profile-based selection.
 *
 * @param coldStartGamesThreshold players with fewer games played get content-based recommendations
 * @param experiencedGamesThreshold together with {@code experiencedSessionsThreshold}, players above it get collaborative filtering
 * @param diversePreferenceThreshold players with more preferred game types than this get the hybrid
 * @param contextDefaults strategy name per serving context, keys compared case-insensitively
 */
public record StrategySelectionProperties(int coldStartGamesThreshold,
                                          int experiencedGamesThreshold,
                                          int experiencedSessionsThreshold,
                                          int diversePreferenceThreshold,
                                          Map<String, String> contextDefaults) {

    public StrategySelectionProperties {
        contextDefaults = contextDefaults == null ? Map.of() : contextDefaults.entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(
                entry -> entry.getKey().toLowerCase(Locale.ROOT),
                Map.Entry::getValue));
    }

    public static StrategySelectionProperties defaults() {
        return new StrategySelectionProperties(5, 50, 20, 3, Map.of(
            "lobby", StrategyKind.HYBRID.strategyName(),
            "game_end", StrategyKind.CONTENT_BASED.strategyName(),
            "promotion", StrategyKind.POPULARITY_BASED.strategyName()));
    }

    public String contextDefault(String context) {
        return context == null ? null : contextDefaults.get(context.toLowerCase(Locale.ROOT));
    }
}
