package net.gaiming.application.recommendation.pipeline;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.recommendation.RecommendationProperties;
import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.GameManagementSettings;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.domain.repository.GameManagementSettingsRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.pipeline.AbstractPipelineStep;
import net.gaiming.pipeline.PipelineContext;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drops candidates the platform must not show, in this order: excluded ids, scores at or
 * below the minimum, games switched off by an operator override, games hidden from the lobby
 * (lobby context only), and games past the per-provider cap.
 */
@Slf4j
public class ApplyBusinessRulesStep extends AbstractPipelineStep<CandidateSet, CandidateSet> {

    public static final String NAME = "ApplyBusinessRules";
    static final String LOBBY_CONTEXT = RecommendationRequest.DEFAULT_CONTEXT;

    private final UnitOfWorkFactory unitOfWorkFactory;
    private final RecommendationProperties properties;

    public ApplyBusinessRulesStep(UnitOfWorkFactory unitOfWorkFactory, RecommendationProperties properties) {
        super(NAME, 5, CandidateSet.class, CandidateSet.class);
        this.unitOfWorkFactory = unitOfWorkFactory;
        this.properties = properties;
    }

    @Override
    public Result<CandidateSet> execute(CandidateSet input, PipelineContext context) {
        RecommendationRequest request = input.request();
        List<Recommendation> eligible = input.recommendations().stream()
            .filter(r -> !request.isExcluded(r.getGameId()))
            .filter(r -> r.getScore() > properties.minimumScore())
            .toList();

        Map<Long, GameManagementSettings> overrides = loadOverrides(eligible);
        boolean lobby = LOBBY_CONTEXT.equalsIgnoreCase(request.context());
        Map<Long, Integer> providerByGame = providersByGame(context);

        Map<Integer, Integer> perProvider = new HashMap<>();
        List<Recommendation> kept = new ArrayList<>(eligible.size());
        for (Recommendation candidate : eligible) {
            GameManagementSettings settings = overrides.get(candidate.getGameId());
            if (settings != null && settings.isDeactivated()) {
                continue;
            }
            if (lobby && settings != null && settings.isHiddenInLobby()) {
                continue;
            }
            Integer provider = providerByGame.getOrDefault(candidate.getGameId(), providerOf(candidate));
            if (provider != null && perProvider.merge(provider, 1, Integer::sum) > properties.maxPerProvider()) {
                continue;
            }
            kept.add(candidate);
        }
        if (kept.size() < input.size()) {
            log.debug("Business rules removed {} of {} candidate(s) for player {}",
                input.size() - kept.size(), input.size(), request.playerId());
        }
        return Result.success(input.withRecommendations(kept));
    }

    private Map<Long, GameManagementSettings> loadOverrides(List<Recommendation> candidates) {
        if (candidates.isEmpty()) {
            return Map.of();
        }
        Set<Long> gameIds = candidates.stream().map(Recommendation::getGameId).collect(Collectors.toSet());
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            return uow.getRepository(GameManagementSettingsRepository.class).findByGameIds(gameIds);
        }
    }

    private static Map<Long, Integer> providersByGame(PipelineContext context) {
        List<GameFeatures> games = context.getOrDefault(RecommendationContextKeys.GAME_FEATURES, List.of());
        Map<Long, Integer> providers = new HashMap<>(games.size() * 2);
        for (GameFeatures game : games) {
            providers.put(game.getGameId(), game.getProviderId());
        }
        return providers;
    }

    private static Integer providerOf(Recommendation recommendation) {
        Object provider = recommendation.getMetadata().get("providerId");
        return provider instanceof Number number ? number.intValue() : null;
    }

    @Override
    public Result<CandidateSet> handleFailure(CandidateSet input, PipelineContext context, Exception exception) {
        return Result.failure(ErrorCode.STEP_FAILED, "Business rules failed: " + exception.getMessage(), exception);
    }
}
