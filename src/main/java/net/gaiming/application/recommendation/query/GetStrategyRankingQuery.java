package net.gaiming.application.recommendation.query;

import jakarta.annotation.Nullable;
import net.gaiming.application.cqrs.Query;
import net.gaiming.strategy.StrategyRanking;
import net.gaiming.strategy.TimeWindow;

import java.util.List;

/**
 * @param context restricts live engagement counts to one serving context, {@code null} for all
 */
public record GetStrategyRankingQuery(TimeWindow window, @Nullable String context)
    implements Query<List<StrategyRanking>> {
}
