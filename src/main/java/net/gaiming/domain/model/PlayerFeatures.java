package net.gaiming.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Behavioural profile of a player, refreshed out of band by the feature store.
 * Read-only to the recommendation core.
 */
@Value
@Builder(toBuilder = true)
public class PlayerFeatures {

    private static final String DEFAULT_PLAY_STYLE = "casual";

    long playerId;
    int age;
    String country;
    int riskLevel;
    int vipLevel;

    // Monetary aggregates
    BigDecimal totalDeposits;
    BigDecimal totalBets;
    BigDecimal totalWins;
    BigDecimal averageBetSize;

    // Activity
    int totalGamesPlayed;
    int sessionCount;
    double averageSessionDuration;
    Instant lastPlayDate;
    int daysSinceLastPlay;

    // Preferences
    @Singular
    List<String> preferredGameTypes;
    @Singular
    List<String> preferredProviders;
    double preferredVolatility;
    double preferredRtp;
    String playStyle;

    // Derived
    double winRate;
    int consecutiveLosses;
    boolean newPlayer;

    @Singular
    Map<String, Double> customFeatures;

    /**
     * Profile used when the feature store has no row for the player yet.
     */
    public static PlayerFeatures newPlayer(long playerId) {
        return PlayerFeatures.builder()
            .playerId(playerId)
            .totalDeposits(BigDecimal.ZERO)
            .totalBets(BigDecimal.ZERO)
            .totalWins(BigDecimal.ZERO)
            .averageBetSize(BigDecimal.ZERO)
            .totalGamesPlayed(0)
            .sessionCount(0)
            .playStyle(DEFAULT_PLAY_STYLE)
            .newPlayer(true)
            .build();
    }

    public boolean prefersGameType(String gameType) {
        return gameType != null && preferredGameTypes.stream().anyMatch(gameType::equalsIgnoreCase);
    }

    public boolean prefersProvider(String provider) {
        return provider != null && preferredProviders.stream().anyMatch(provider::equalsIgnoreCase);
    }
}
