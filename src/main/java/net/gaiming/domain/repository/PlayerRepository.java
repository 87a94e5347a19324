package net.gaiming.domain.repository;

import net.gaiming.domain.model.Player;

public interface PlayerRepository extends ReadOnlyRepository<Player, Long> {
}
