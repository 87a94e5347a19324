package net.gaiming.domain.model;

import java.time.Instant;

/**
 * Player account as seen by the recommendation core. Owned by the account system.
 */
public record Player(long playerId, String username, boolean active, String country, int vipLevel, Instant registeredAt) {
}
