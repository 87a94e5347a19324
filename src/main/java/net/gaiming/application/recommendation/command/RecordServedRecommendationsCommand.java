package net.gaiming.application.recommendation.command;

import jakarta.annotation.Nullable;
import net.gaiming.application.cqrs.Command;
import net.gaiming.application.cqrs.CommandMetadata;
import net.gaiming.domain.model.Recommendation;

import java.util.List;

/**
 * Persists a list exactly as it was served to one player, all rows or none.
 *
 * @return ids in the order of {@code served}
 */
public record RecordServedRecommendationsCommand(long playerId,
                                                 List<Recommendation> served,
                                                 @Nullable String sessionId,
                                                 @Nullable String platform,
                                                 CommandMetadata metadata) implements Command<List<Long>> {

    public RecordServedRecommendationsCommand {
        served = served == null ? List.of() : List.copyOf(served);
    }
}
