package net.gaiming.application.recommendation.query;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Value;
import net.gaiming.application.cqrs.Query;
import net.gaiming.domain.model.Recommendation;

import java.time.Instant;

/**
 * Served recommendations filtered by any combination of criteria, newest first. Absent
 * criteria do not filter.
 */
@Value
@Builder
public class GetRecommendationHistoryQuery implements Query<PagedResult<Recommendation>> {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 200;

    @Nullable Long playerId;
    @Nullable Long gameId;
    @Nullable String algorithm;
    @Nullable String context;
    @Nullable Instant from;
    @Nullable Instant to;
    @Nullable Boolean clicked;
    @Nullable Boolean played;
    @Builder.Default
    int page = 1;
    @Builder.Default
    int pageSize = DEFAULT_PAGE_SIZE;
}
