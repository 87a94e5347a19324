package net.gaiming.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Per-game attributes used for scoring. One record per recommendable game.
 */
@Value
@Builder(toBuilder = true)
public class GameFeatures {

    long gameId;
    String gameName;
    int providerId;
    String providerName;
    int gameTypeId;
    String gameType;
    int volatilityId;
    double averageRtp;
    BigDecimal minBet;
    BigDecimal maxBet;
    /** Normalized to 0..1 by the feature store. */
    double popularityScore;
    /** Normalized to 0..1 by the feature store. */
    double revenueScore;
    boolean mobile;
    boolean desktop;
    boolean active;
    LocalDate releaseDate;
    boolean newGame;

    @Singular
    Map<String, Double> features;

    public double feature(String name, double fallback) {
        Double value = features.get(name);
        return value == null ? fallback : value;
    }
}
