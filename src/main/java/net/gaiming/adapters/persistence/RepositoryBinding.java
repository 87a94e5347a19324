package net.gaiming.adapters.persistence;

import net.gaiming.domain.repository.AbTestExperimentRepository;
import net.gaiming.domain.repository.ExperimentAssignmentRepository;
import net.gaiming.domain.repository.GameFeatureRepository;
import net.gaiming.domain.repository.GameManagementSettingsRepository;
import net.gaiming.domain.repository.GameRecommendationRepository;
import net.gaiming.domain.repository.PlayerFeatureRepository;
import net.gaiming.domain.repository.PlayerRepository;
import net.gaiming.domain.repository.RecommendationInteractionRepository;
import net.gaiming.domain.repository.StrategyMetricRepository;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Binds a repository port to the JDBC implementation a unit of work should create for it.
 */
public final class RepositoryBinding<R> {

    private final Class<R> portType;
    private final Function<JdbcRepositoryContext, ? extends R> constructor;

    private RepositoryBinding(Class<R> portType, Function<JdbcRepositoryContext, ? extends R> constructor) {
        this.portType = Objects.requireNonNull(portType, "portType");
        this.constructor = Objects.requireNonNull(constructor, "constructor");
    }

    static <R> RepositoryBinding<R> of(Class<R> portType, Function<JdbcRepositoryContext, ? extends R> constructor) {
        return new RepositoryBinding<>(portType, constructor);
    }

    public Class<R> portType() {
        return portType;
    }

    R create(JdbcRepositoryContext context) {
        return constructor.apply(context);
    }

    /**
     * Bindings for every repository port of the engine.
     */
    public static List<RepositoryBinding<?>> defaults() {
        return List.of(
            of(PlayerRepository.class, JdbcPlayerRepository::new),
            of(PlayerFeatureRepository.class, JdbcPlayerFeatureRepository::new),
            of(GameFeatureRepository.class, JdbcGameFeatureRepository::new),
            of(GameRecommendationRepository.class, JdbcGameRecommendationRepository::new),
            of(RecommendationInteractionRepository.class,
                JdbcRecommendationInteractionRepository::new),
            of(GameManagementSettingsRepository.class,
                JdbcGameManagementSettingsRepository::new),
            of(AbTestExperimentRepository.class, JdbcAbTestExperimentRepository::new),
            of(ExperimentAssignmentRepository.class,
                JdbcExperimentAssignmentRepository::new),
            of(StrategyMetricRepository.class, JdbcStrategyMetricRepository::new)
        );
    }
}
