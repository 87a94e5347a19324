package net.gaiming.strategy;

import java.util.Optional;

/**
 * Port to the A/B testing service as seen by strategy selection.
 */
public interface ExperimentVariantResolver {

    /**
     * Variant of the first running experiment that targets {@code context}, assigning the
     * player if this is their first request.
     */
    Optional<VariantAssignment> findActiveVariant(long playerId, String context);

    Optional<VariantAssignment> getPlayerVariant(long playerId, String experimentName);

    record VariantAssignment(String experimentName, String variantName, String algorithm) {
    }
}
