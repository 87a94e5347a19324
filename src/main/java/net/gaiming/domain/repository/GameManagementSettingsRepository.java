package net.gaiming.domain.repository;

import net.gaiming.domain.model.GameManagementSettings;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

public interface GameManagementSettingsRepository extends EntityRepository<GameManagementSettings> {

    Optional<GameManagementSettings> findByGameId(long gameId);

    Map<Long, GameManagementSettings> findByGameIds(Collection<Long> gameIds);
}
