package net.gaiming.domain.repository;

import net.gaiming.domain.model.GameFeatures;

/**
 * Feature-store view of the game catalogue, keyed by game id.
 */
public interface GameFeatureRepository extends ReadOnlyRepository<GameFeatures, Long> {
}
