package net.gaiming.application.experiment;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.domain.model.AbTestExperiment;
import net.gaiming.domain.model.ExperimentAssignment;
import net.gaiming.domain.model.ExperimentVariant;
import net.gaiming.domain.repository.AbTestExperimentRepository;
import net.gaiming.domain.repository.ExperimentAssignmentRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.strategy.ExperimentVariantResolver;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sticky A/B assignment of players to experiment variants.
 *
 * <p>The first request of a player in a running experiment places them in a variant chosen
 * by a weighted bucket over {@code hash(experimentName, playerId)} and persists that choice;
 * later requests read the stored assignment, so changing weights never moves existing players.</p>
 */
@Slf4j
public class ExperimentService implements ExperimentVariantResolver {

    private final UnitOfWorkFactory unitOfWorkFactory;
    private final Clock clock;

    public ExperimentService(UnitOfWorkFactory unitOfWorkFactory, Clock clock) {
        this.unitOfWorkFactory = unitOfWorkFactory;
        this.clock = clock;
    }

    @Override
    public Optional<VariantAssignment> findActiveVariant(long playerId, String context) {
        Instant now = clock.instant();
        Optional<AbTestExperiment> experiment;
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            experiment = uow.getRepository(AbTestExperimentRepository.class).findRunning().stream()
                .filter(candidate -> candidate.isActiveAt(now))
                .filter(candidate -> candidate.targetsContext(context))
                .min(Comparator.comparing(AbTestExperiment::getStartDate).thenComparing(AbTestExperiment::getId));
        }
        return experiment.flatMap(active -> assign(active, playerId));
    }

    @Override
    public Optional<VariantAssignment> getPlayerVariant(long playerId, String experimentName) {
        Optional<AbTestExperiment> experiment;
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            experiment = uow.getRepository(AbTestExperimentRepository.class).findByName(experimentName);
        }
        if (experiment.isEmpty() || !experiment.get().isActiveAt(clock.instant())) {
            return Optional.empty();
        }
        return assign(experiment.get(), playerId);
    }

    private Optional<VariantAssignment> assign(AbTestExperiment experiment, long playerId) {
        Optional<ExperimentAssignment> stored = findAssignment(experiment.getId(), playerId);
        if (stored.isPresent()) {
            return toAssignment(experiment, stored.get().getVariantName());
        }

        ExperimentVariant chosen = chooseVariant(experiment.getName(), playerId, experiment.getVariants());
        Result<ExperimentAssignment> saved = persist(experiment, playerId, chosen);
        if (saved.isSuccess()) {
            log.debug("Assigned player {} to {}/{}", playerId, experiment.getName(), chosen.name());
            return toAssignment(experiment, chosen.name());
        }
        if (saved.getError().code() == ErrorCode.CONFLICT) {
            // Another request assigned the player first.
            return findAssignment(experiment.getId(), playerId)
                .flatMap(winner -> toAssignment(experiment, winner.getVariantName()));
        }
        throw new IllegalStateException("Failed to persist assignment of player " + playerId + " in experiment "
            + experiment.getName() + ": " + saved.getError().message(), saved.getError().cause());
    }

    private Optional<ExperimentAssignment> findAssignment(long experimentId, long playerId) {
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            return uow.getRepository(ExperimentAssignmentRepository.class).findAssignment(experimentId, playerId);
        }
    }

    private Result<ExperimentAssignment> persist(AbTestExperiment experiment, long playerId, ExperimentVariant variant) {
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            ExperimentAssignment assignment =
                new ExperimentAssignment(experiment.getId(), playerId, variant.name(), clock.instant());
            Result<ExperimentAssignment> saved = uow.executeInTransaction(() -> {
                uow.getRepository(ExperimentAssignmentRepository.class).add(assignment);
                return uow.saveChanges().map(rows -> assignment);
            });
            if (saved.isFailure()) {
                return saved;
            }
            return uow.saveChangesAndDispatchEvents().map(ignored -> assignment);
        }
    }

    private static Optional<VariantAssignment> toAssignment(AbTestExperiment experiment, String variantName) {
        Optional<ExperimentVariant> variant = experiment.findVariant(variantName);
        if (variant.isEmpty()) {
            log.warn("Stored variant {} no longer exists in experiment {}", variantName, experiment.getName());
            return Optional.empty();
        }
        return Optional.of(new VariantAssignment(experiment.getName(), variantName, variant.get().algorithm()));
    }

    /**
     * Maps the player onto {@code [0, totalWeight)} and picks the variant whose cumulative
     * weight range contains that point.
     */
    static ExperimentVariant chooseVariant(String experimentName, long playerId, List<ExperimentVariant> variants) {
        double total = variants.stream().mapToDouble(ExperimentVariant::trafficWeight).sum();
        double point = bucket(experimentName, playerId) * total;
        double cumulative = 0.0;
        for (ExperimentVariant variant : variants) {
            cumulative += variant.trafficWeight();
            if (point < cumulative) {
                return variant;
            }
        }
        return variants.get(variants.size() - 1);
    }

    /**
     * Stable value in {@code [0, 1)} for an experiment and player.
     */
    static double bucket(String experimentName, long playerId) {
        UUID digest = UUID.nameUUIDFromBytes((experimentName + ":" + playerId).getBytes(StandardCharsets.UTF_8));
        return (digest.getMostSignificantBits() >>> 11) * 0x1.0p-53;
    }
}
