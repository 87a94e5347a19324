package net.gaiming.application.recommendation.query;

import net.gaiming.application.cqrs.RequestHandler;
import net.gaiming.strategy.StrategyRanking;
import net.gaiming.strategy.StrategySelector;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.util.List;

public class GetStrategyRankingHandler implements RequestHandler<GetStrategyRankingQuery, List<StrategyRanking>> {

    private final StrategySelector selector;

    public GetStrategyRankingHandler(StrategySelector selector) {
        this.selector = selector;
    }

    @Override
    public Class<GetStrategyRankingQuery> requestType() {
        return GetStrategyRankingQuery.class;
    }

    @Override
    public Result<List<StrategyRanking>> handle(GetStrategyRankingQuery query) {
        if (query.window() == null) {
            return Result.failure(ErrorCode.VALIDATION, "Time window is required");
        }
        return Result.success(selector.getStrategyRanking(query.window(), query.context()));
    }
}
