package net.gaiming.domain.repository;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Column filters a history lookup can narrow by before any in-memory evaluation. Every field is
 * optional; {@code from}/{@code to} form the half-open window {@code [from, to)}.
 */
@Value
@Builder
public class RecommendationHistoryCriteria {

    @Nullable Long playerId;
    @Nullable Long gameId;
    @Nullable String algorithm;
    @Nullable String context;
    @Nullable Instant from;
    @Nullable Instant to;
    @Nullable Boolean clicked;
    @Nullable Boolean played;
}
