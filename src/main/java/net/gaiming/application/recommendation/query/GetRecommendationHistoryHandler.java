package net.gaiming.application.recommendation.query;

import net.gaiming.application.cqrs.RequestHandler;
import net.gaiming.domain.model.GameRecommendation;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.repository.GameRecommendationRepository;
import net.gaiming.domain.repository.RecommendationHistoryCriteria;
import net.gaiming.domain.specification.GameRecommendationSpecifications;
import net.gaiming.domain.specification.RecommendationHistorySpecification;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;
import net.gaiming.support.specification.Specification;
import net.gaiming.support.specification.SpecificationEvaluator;
import org.springframework.util.StringUtils;

import java.util.List;

public class GetRecommendationHistoryHandler
    implements RequestHandler<GetRecommendationHistoryQuery, PagedResult<Recommendation>> {

    private final UnitOfWorkFactory unitOfWorkFactory;

    public GetRecommendationHistoryHandler(UnitOfWorkFactory unitOfWorkFactory) {
        this.unitOfWorkFactory = unitOfWorkFactory;
    }

    @Override
    public Class<GetRecommendationHistoryQuery> requestType() {
        return GetRecommendationHistoryQuery.class;
    }

    @Override
    public Result<PagedResult<Recommendation>> handle(GetRecommendationHistoryQuery query) {
        if (query.getPage() < 1) {
            return Result.failure(ErrorCode.VALIDATION, "Page must be at least 1");
        }
        if (query.getPageSize() < 1 || query.getPageSize() > GetRecommendationHistoryQuery.MAX_PAGE_SIZE) {
            return Result.failure(ErrorCode.VALIDATION,
                "Page size must be between 1 and " + GetRecommendationHistoryQuery.MAX_PAGE_SIZE);
        }
        if (query.getFrom() != null && query.getTo() != null && query.getFrom().isAfter(query.getTo())) {
            return Result.failure(ErrorCode.VALIDATION, "'from' must not be after 'to'");
        }

        Specification<GameRecommendation> filter = filterOf(query);
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            GameRecommendationRepository repository = uow.getRepository(GameRecommendationRepository.class);
            List<GameRecommendation> candidates = repository.findHistory(criteriaOf(query));
            long total = SpecificationEvaluator.count(candidates, filter);
            List<Recommendation> page = SpecificationEvaluator
                .evaluate(candidates, new RecommendationHistorySpecification(filter, query.getPage(), query.getPageSize()))
                .stream()
                .map(GameRecommendation::toRecommendation)
                .toList();
            return Result.success(new PagedResult<>(page, query.getPage(), query.getPageSize(), total));
        }
    }

    static RecommendationHistoryCriteria criteriaOf(GetRecommendationHistoryQuery query) {
        return RecommendationHistoryCriteria.builder()
            .playerId(query.getPlayerId())
            .gameId(query.getGameId())
            .algorithm(StringUtils.hasText(query.getAlgorithm()) ? query.getAlgorithm() : null)
            .context(StringUtils.hasText(query.getContext()) ? query.getContext() : null)
            .from(query.getFrom())
            .to(query.getTo())
            .clicked(query.getClicked())
            .played(query.getPlayed())
            .build();
    }

    static Specification<GameRecommendation> filterOf(GetRecommendationHistoryQuery query) {
        Specification<GameRecommendation> filter = Specification.all();
        if (query.getPlayerId() != null) {
            filter = filter.and(GameRecommendationSpecifications.byPlayer(query.getPlayerId()));
        }
        if (query.getGameId() != null) {
            filter = filter.and(GameRecommendationSpecifications.byGame(query.getGameId()));
        }
        if (StringUtils.hasText(query.getAlgorithm())) {
            filter = filter.and(GameRecommendationSpecifications.byAlgorithm(query.getAlgorithm()));
        }
        if (StringUtils.hasText(query.getContext())) {
            filter = filter.and(GameRecommendationSpecifications.byContext(query.getContext()));
        }
        if (query.getFrom() != null || query.getTo() != null) {
            filter = filter.and(GameRecommendationSpecifications.createdBetween(query.getFrom(), query.getTo()));
        }
        if (query.getClicked() != null) {
            Specification<GameRecommendation> clicked = GameRecommendationSpecifications.clicked();
            filter = filter.and(query.getClicked() ? clicked : clicked.not());
        }
        if (query.getPlayed() != null) {
            Specification<GameRecommendation> played = GameRecommendationSpecifications.played();
            filter = filter.and(query.getPlayed() ? played : played.not());
        }
        return filter;
    }
}
