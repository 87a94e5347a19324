package net.gaiming.domain.specification;

import net.gaiming.domain.model.GameRecommendation;
import net.gaiming.support.specification.Specification;

import java.time.Instant;

public final class GameRecommendationSpecifications {

    private GameRecommendationSpecifications() {
    }

    public static Specification<GameRecommendation> byPlayer(long playerId) {
        return Specification.where(rec -> rec.getPlayerId() == playerId);
    }

    public static Specification<GameRecommendation> byGame(long gameId) {
        return Specification.where(rec -> rec.getGameId() == gameId);
    }

    public static Specification<GameRecommendation> byAlgorithm(String algorithm) {
        return Specification.where(rec -> rec.getAlgorithm().equalsIgnoreCase(algorithm));
    }

    public static Specification<GameRecommendation> byContext(String context) {
        return Specification.where(rec -> rec.getContext().equalsIgnoreCase(context));
    }

    /**
     * Half-open window {@code [from, to)}; either bound may be {@code null}.
     */
    public static Specification<GameRecommendation> createdBetween(Instant from, Instant to) {
        return Specification.where(rec -> {
            Instant createdAt = rec.getCreatedAt();
            if (createdAt == null) {
                return false;
            }
            return (from == null || !createdAt.isBefore(from)) && (to == null || createdAt.isBefore(to));
        });
    }

    public static Specification<GameRecommendation> clicked() {
        return Specification.where(GameRecommendation::isClicked);
    }

    public static Specification<GameRecommendation> played() {
        return Specification.where(GameRecommendation::isPlayed);
    }
}
