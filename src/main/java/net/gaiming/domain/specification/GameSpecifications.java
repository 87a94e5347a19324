package net.gaiming.domain.specification;

import net.gaiming.domain.model.GameFeatures;
import net.gaiming.support.specification.Specification;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Reusable filters over the game catalogue.
 */
public final class GameSpecifications {

    public static final double HIGH_RTP_THRESHOLD = 96.0;

    private GameSpecifications() {
    }

    public static Specification<GameFeatures> active() {
        return Specification.where(GameFeatures::isActive);
    }

    public static Specification<GameFeatures> byProvider(int providerId) {
        return Specification.where(game -> game.getProviderId() == providerId);
    }

    public static Specification<GameFeatures> byType(int gameTypeId) {
        return Specification.where(game -> game.getGameTypeId() == gameTypeId);
    }

    public static Specification<GameFeatures> highRtp() {
        return Specification.where(game -> game.getAverageRtp() >= HIGH_RTP_THRESHOLD);
    }

    /**
     * Games whose release date falls within the last {@code days} days, today included.
     */
    public static Specification<GameFeatures> releasedWithin(int days, Clock clock) {
        LocalDate cutoff = LocalDate.now(clock).minusDays(days);
        return Specification.where(game -> game.getReleaseDate() != null && !game.getReleaseDate().isBefore(cutoff));
    }

    public static Specification<GameFeatures> mobile() {
        return Specification.where(GameFeatures::isMobile);
    }
}
