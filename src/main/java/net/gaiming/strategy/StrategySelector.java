package net.gaiming.strategy;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.gaiming.domain.model.PlayerFeatures;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.domain.repository.PlayerFeatureRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.support.result.Result;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Picks the strategy for a request. Rules, first match wins:
 * <ol>
 *   <li>explicit algorithm on the request</li>
 *   <li>running experiment targeting the context (sticky per player)</li>
 *   <li>player profile: cold start, experienced, diverse preferences</li>
 *   <li>context default</li>
 *   <li>collaborative filtering</li>
 * </ol>
 * Missing features or any failure while deciding falls back to collaborative filtering.
 */
@Slf4j
public class StrategySelector {

    static final String AB_TEST_CONTEXT = "abtest";

    private final StrategyRegistry registry;
    private final UnitOfWorkFactory unitOfWorkFactory;
    private final ExperimentVariantResolver experiments;
    private final StrategySelectionProperties properties;

    public StrategySelector(StrategyRegistry registry,
                            UnitOfWorkFactory unitOfWorkFactory,
                            ExperimentVariantResolver experiments,
                            StrategySelectionProperties properties) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.unitOfWorkFactory = Objects.requireNonNull(unitOfWorkFactory, "unitOfWorkFactory");
        this.experiments = Objects.requireNonNull(experiments, "experiments");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public StrategySelection selectStrategy(long playerId, String context) {
        return selectStrategy(RecommendationRequest.of(playerId, RecommendationRequest.DEFAULT_COUNT, context));
    }

    /**
     * Selects for a request, loading the player's features when the profile rules are reached.
     */
    public StrategySelection selectStrategy(RecommendationRequest request) {
        return select(request, () -> loadFeatures(request.playerId()));
    }

    /**
     * Selects for a request whose player features are already known.
     */
    public StrategySelection selectStrategy(RecommendationRequest request, @Nullable PlayerFeatures features) {
        return select(request, () -> Optional.ofNullable(features));
    }

    public StrategySelection selectStrategyForExperiment(long playerId, String experimentName) {
        try {
            Optional<ExperimentVariantResolver.VariantAssignment> variant =
                experiments.getPlayerVariant(playerId, experimentName);
            if (variant.isPresent() && variant.get().algorithm() != null) {
                RecommendationStrategy strategy = registry.resolve(variant.get().algorithm());
                log.debug("Selected experiment strategy {} for player {} in {}", strategy.name(), playerId, experimentName);
                return new StrategySelection(strategy, SelectionSource.EXPERIMENT, label(variant.get()));
            }
        } catch (RuntimeException ex) {
            log.error("Error selecting experiment strategy for player {} in {}", playerId, experimentName, ex);
            return StrategySelection.of(registry.fallback(), SelectionSource.FALLBACK);
        }
        return selectStrategy(playerId, AB_TEST_CONTEXT);
    }

    /**
     * Ranks every registered strategy on its metrics over {@code window}. Strategies without
     * metrics are left out.
     */
    public List<StrategyRanking> getStrategyRanking(TimeWindow window, @Nullable String context) {
        List<StrategyRanking> unranked = new ArrayList<>();
        for (RecommendationStrategy strategy : registry.all()) {
            try {
                Result<StrategyPerformanceMetrics> metrics = strategy.getPerformanceMetrics(window, context);
                if (metrics.isFailure()) {
                    log.debug("Skipping {} in ranking: {}", strategy.name(), metrics.getError().message());
                    continue;
                }
                unranked.add(StrategyRanking.unranked(metrics.getValue()));
            } catch (RuntimeException ex) {
                log.error("Error getting performance metrics for strategy {}", strategy.name(), ex);
            }
        }
        unranked.sort(Comparator.comparingDouble(StrategyRanking::overallScore).reversed());
        List<StrategyRanking> ranked = new ArrayList<>(unranked.size());
        for (int i = 0; i < unranked.size(); i++) {
            ranked.add(unranked.get(i).withRank(i + 1));
        }
        log.debug("Ranked {} strategies for window {}", ranked.size(), window);
        return List.copyOf(ranked);
    }

    private StrategySelection select(RecommendationRequest request, Supplier<Optional<PlayerFeatures>> features) {
        if (request.hasAlgorithmOverride()) {
            return StrategySelection.of(registry.resolve(request.algorithm()), SelectionSource.OVERRIDE);
        }
        try {
            Optional<ExperimentVariantResolver.VariantAssignment> variant =
                experiments.findActiveVariant(request.playerId(), request.context());
            if (variant.isPresent()) {
                RecommendationStrategy strategy = registry.resolve(variant.get().algorithm());
                log.debug("Player {} is in {}; using {}", request.playerId(), label(variant.get()), strategy.name());
                return new StrategySelection(strategy, SelectionSource.EXPERIMENT, label(variant.get()));
            }

            Optional<PlayerFeatures> playerFeatures = features.get();
            if (playerFeatures.isEmpty()) {
                log.debug("No player features for player {}, using default strategy", request.playerId());
                return StrategySelection.of(registry.fallback(), SelectionSource.FALLBACK);
            }
            StrategySelection selection = selectByProfile(playerFeatures.get(), request.context());
            log.debug("Selected strategy {} ({}) for player {}", selection.strategyName(), selection.source(),
                request.playerId());
            return selection;
        } catch (RuntimeException ex) {
            log.error("Error selecting strategy for player {}", request.playerId(), ex);
            return StrategySelection.of(registry.fallback(), SelectionSource.FALLBACK);
        }
    }

    private StrategySelection selectByProfile(PlayerFeatures features, String context) {
        if (features.getTotalGamesPlayed() < properties.coldStartGamesThreshold()) {
            return StrategySelection.of(registry.resolve(StrategyKind.CONTENT_BASED), SelectionSource.PLAYER_PROFILE);
        }
        if (features.getTotalGamesPlayed() > properties.experiencedGamesThreshold()
            && features.getSessionCount() > properties.experiencedSessionsThreshold()) {
            return StrategySelection.of(registry.resolve(StrategyKind.COLLABORATIVE_FILTERING),
                SelectionSource.PLAYER_PROFILE);
        }
        if (features.getPreferredGameTypes().size() > properties.diversePreferenceThreshold()) {
            return StrategySelection.of(registry.resolve(StrategyKind.HYBRID), SelectionSource.PLAYER_PROFILE);
        }
        String contextDefault = properties.contextDefault(context);
        if (contextDefault != null) {
            return StrategySelection.of(registry.resolve(contextDefault), SelectionSource.CONTEXT_DEFAULT);
        }
        return StrategySelection.of(registry.fallback(), SelectionSource.FALLBACK);
    }

    private Optional<PlayerFeatures> loadFeatures(long playerId) {
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            return uow.getRepository(PlayerFeatureRepository.class).findById(playerId);
        }
    }

    private static String label(ExperimentVariantResolver.VariantAssignment variant) {
        return variant.experimentName() + "/" + variant.variantName();
    }
}
