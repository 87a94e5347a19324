package net.gaiming.domain.repository;

import net.gaiming.domain.model.PlayerFeatures;

/**
 * Feature-store view of player profiles, keyed by player id.
 */
public interface PlayerFeatureRepository extends ReadOnlyRepository<PlayerFeatures, Long> {
}
