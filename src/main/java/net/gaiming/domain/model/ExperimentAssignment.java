package net.gaiming.domain.model;

import lombok.Getter;
import net.gaiming.domain.event.ExperimentVariantAssignedEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * The variant a player was placed in for one experiment. Written once, never changed.
 */
@Getter
public class ExperimentAssignment extends BaseEntity {

    private final long experimentId;
    private final long playerId;
    private final String variantName;

    public ExperimentAssignment(long experimentId, long playerId, String variantName, Instant assignedAt) {
        super(assignedAt);
        this.experimentId = experimentId;
        this.playerId = playerId;
        this.variantName = Objects.requireNonNull(variantName, "variantName");
    }

    public Instant getAssignedAt() {
        return getCreatedAt();
    }

    @Override
    protected void onPersisted() {
        raise(new ExperimentVariantAssignedEvent(getAssignedAt(), experimentId, playerId, variantName));
    }
}
