package net.gaiming.domain.model;

import jakarta.annotation.Nullable;
import lombok.Getter;
import net.gaiming.domain.event.AbTestCompletedEvent;
import net.gaiming.domain.event.AbTestStartedEvent;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A/B experiment comparing recommendation algorithms on a subset of contexts.
 */
@Getter
public class AbTestExperiment extends BaseEntity {

    private final String name;
    private final String description;
    private final List<String> targetContexts;
    private final List<ExperimentVariant> variants;
    private ExperimentStatus status;
    private Instant startDate;
    @Nullable
    private Instant endDate;
    @Nullable
    private String winningVariant;

    public AbTestExperiment(String name, String description, List<String> targetContexts,
                            List<ExperimentVariant> variants, Instant startDate, @Nullable Instant endDate,
                            Instant createdAt) {
        super(createdAt);
        this.name = Objects.requireNonNull(name, "name");
        this.description = description == null ? "" : description;
        this.targetContexts = targetContexts == null ? List.of() : List.copyOf(targetContexts);
        this.variants = List.copyOf(Objects.requireNonNull(variants, "variants"));
        if (this.variants.isEmpty()) {
            throw new IllegalArgumentException("Experiment " + name + " needs at least one variant");
        }
        this.status = ExperimentStatus.DRAFT;
        this.startDate = Objects.requireNonNull(startDate, "startDate");
        this.endDate = endDate;
    }

    public void restoreState(ExperimentStatus storedStatus, @Nullable String storedWinner) {
        this.status = storedStatus;
        this.winningVariant = storedWinner;
    }

    /**
     * Moves a draft or paused experiment to running.
     *
     * @return {@code false} if the experiment is not in a startable state
     */
    public boolean start(Instant at) {
        if (status != ExperimentStatus.DRAFT && status != ExperimentStatus.PAUSED) {
            return false;
        }
        status = ExperimentStatus.RUNNING;
        if (startDate.isAfter(at)) {
            startDate = at;
        }
        touch(at);
        raise(new AbTestStartedEvent(at, requireId(), name,
            variants.stream().map(ExperimentVariant::name).toList()));
        return true;
    }

    /**
     * Closes a running or paused experiment, optionally recording the winning variant.
     *
     * @return {@code false} if the experiment is not running or paused
     */
    public boolean complete(Instant at, @Nullable String winner) {
        if (status != ExperimentStatus.RUNNING && status != ExperimentStatus.PAUSED) {
            return false;
        }
        if (winner != null && findVariant(winner).isEmpty()) {
            throw new IllegalArgumentException("Unknown variant '" + winner + "' for experiment " + name);
        }
        status = ExperimentStatus.COMPLETED;
        endDate = at;
        winningVariant = winner;
        touch(at);
        raise(new AbTestCompletedEvent(at, requireId(), name, winner));
        return true;
    }

    public boolean isActiveAt(Instant at) {
        return status == ExperimentStatus.RUNNING
            && !startDate.isAfter(at)
            && (endDate == null || endDate.isAfter(at));
    }

    /**
     * An experiment without target contexts applies to every context.
     */
    public boolean targetsContext(String context) {
        if (targetContexts.isEmpty()) {
            return true;
        }
        String normalized = context == null ? "" : context.toLowerCase(Locale.ROOT);
        return targetContexts.stream().anyMatch(target -> target.toLowerCase(Locale.ROOT).equals(normalized));
    }

    public Optional<ExperimentVariant> findVariant(String variantName) {
        return variants.stream().filter(v -> v.name().equals(variantName)).findFirst();
    }
}
