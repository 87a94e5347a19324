package net.gaiming.config;

import net.gaiming.application.cqrs.Dispatcher;
import net.gaiming.application.cqrs.HandlerRegistry;
import net.gaiming.application.cqrs.MediatorDispatcher;
import net.gaiming.application.cqrs.RequestHandler;
import net.gaiming.application.experiment.CompleteExperimentHandler;
import net.gaiming.application.experiment.CreateExperimentHandler;
import net.gaiming.application.experiment.ExperimentCacheInvalidator;
import net.gaiming.application.experiment.ExperimentService;
import net.gaiming.application.experiment.StartExperimentHandler;
import net.gaiming.application.recommendation.RecommendationProperties;
import net.gaiming.application.recommendation.command.CreateGameRecommendationHandler;
import net.gaiming.application.recommendation.command.RecordServedRecommendationsHandler;
import net.gaiming.application.recommendation.command.TrackRecommendationInteractionHandler;
import net.gaiming.application.recommendation.command.UpdateGameManagementSettingsHandler;
import net.gaiming.application.recommendation.pipeline.RecommendationPipelineFactory;
import net.gaiming.application.recommendation.pipeline.RecommendationPipelineService;
import net.gaiming.application.recommendation.query.GetRecommendationHistoryHandler;
import net.gaiming.application.recommendation.query.GetRecommendationsHandler;
import net.gaiming.application.recommendation.query.GetStrategyRankingHandler;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.strategy.BanditStrategy;
import net.gaiming.strategy.CollaborativeFilteringStrategy;
import net.gaiming.strategy.ContentBasedStrategy;
import net.gaiming.strategy.DeepLearningStrategy;
import net.gaiming.strategy.EmbeddingModelServingClient;
import net.gaiming.strategy.HybridStrategy;
import net.gaiming.strategy.PopularityBasedStrategy;
import net.gaiming.strategy.StrategyPerformanceService;
import net.gaiming.strategy.StrategyRegistry;
import net.gaiming.strategy.StrategySelector;
import net.gaiming.support.cache.CacheService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires strategies, the recommendation pipeline and the request handlers behind the {@link Dispatcher}.
 */
@Configuration
public class RecommendationEngineConfig {

    private final Duration transactionTimeout;

    public RecommendationEngineConfig(
        @Value("${gaiming.persistence.transaction-timeout:PT30S}") Duration transactionTimeout) {
        this.transactionTimeout = transactionTimeout;
    }

    @Bean
    public RecommendationProperties recommendationProperties(
        @Value("${gaiming.recommendation.default-count:10}") int defaultCount,
        @Value("${gaiming.recommendation.max-count:100}") int maxCount,
        @Value("${gaiming.recommendation.cache-ttl:PT5M}") Duration cacheTtl,
        @Value("${gaiming.recommendation.minimum-score:0.1}") double minimumScore,
        @Value("${gaiming.recommendation.max-per-provider:5}") int maxPerProvider,
        @Value("${gaiming.recommendation.max-per-category:3}") int maxPerCategory,
        @Value("${gaiming.recommendation.oversample-factor:3}") int oversampleFactor,
        @Value("${gaiming.recommendation.pipeline-timeout:PT5S}") Duration pipelineTimeout) {
        return new RecommendationProperties(defaultCount, maxCount, cacheTtl, minimumScore, maxPerProvider,
            maxPerCategory, oversampleFactor, pipelineTimeout);
    }

    // Strategies

    @Bean
    public StrategyPerformanceService strategyPerformanceService(UnitOfWorkFactory unitOfWorkFactory) {
        return new StrategyPerformanceService(unitOfWorkFactory);
    }

    @Bean
    public CollaborativeFilteringStrategy collaborativeFilteringStrategy(StrategyPerformanceService metrics,
                                                                         Clock clock) {
        return new CollaborativeFilteringStrategy(metrics, clock);
    }

    @Bean
    public ContentBasedStrategy contentBasedStrategy(StrategyPerformanceService metrics, Clock clock) {
        return new ContentBasedStrategy(metrics, clock);
    }

    @Bean
    public StrategyRegistry strategyRegistry(StrategyPerformanceService metrics,
                                             Clock clock,
                                             CollaborativeFilteringStrategy collaborative,
                                             ContentBasedStrategy content,
                                             StrategyProperties strategyProperties) {
        return StrategyRegistry.builder()
            .register(collaborative)
            .register(content)
            .register(new HybridStrategy(metrics, clock, collaborative, content))
            .register(new PopularityBasedStrategy(metrics, clock))
            .register(new BanditStrategy(metrics, clock, strategyProperties.getBanditExplorationRate(),
                new SecureRandom()))
            .register(new DeepLearningStrategy(metrics, clock,
                new EmbeddingModelServingClient(strategyProperties.getDeepLearningModelPath()),
                strategyProperties.getDeepLearningTimeout()))
            .build();
    }

    @Bean
    public ExperimentService experimentService(UnitOfWorkFactory unitOfWorkFactory, Clock clock) {
        return new ExperimentService(unitOfWorkFactory, clock);
    }

    @Bean
    public StrategySelector strategySelector(StrategyRegistry registry,
                                             UnitOfWorkFactory unitOfWorkFactory,
                                             ExperimentService experimentService,
                                             StrategyProperties strategyProperties) {
        return new StrategySelector(registry, unitOfWorkFactory, experimentService,
            strategyProperties.toSelectionProperties());
    }

    // Pipeline

    @Bean
    public RecommendationPipelineService recommendationPipelineService(UnitOfWorkFactory unitOfWorkFactory,
                                                                       StrategySelector selector,
                                                                       CacheService cacheService,
                                                                       RecommendationProperties properties,
                                                                       Clock clock) {
        RecommendationPipelineFactory factory =
            new RecommendationPipelineFactory(unitOfWorkFactory, selector, cacheService, properties);
        return new RecommendationPipelineService(factory.createRecommendationPipeline(), properties, clock);
    }

    // Handlers

    @Bean
    public GetRecommendationsHandler getRecommendationsHandler(RecommendationPipelineService pipelineService,
                                                               CacheService cacheService,
                                                               RecommendationProperties properties) {
        return new GetRecommendationsHandler(pipelineService, cacheService, properties);
    }

    @Bean
    public GetRecommendationHistoryHandler getRecommendationHistoryHandler(UnitOfWorkFactory unitOfWorkFactory) {
        return new GetRecommendationHistoryHandler(unitOfWorkFactory);
    }

    @Bean
    public GetStrategyRankingHandler getStrategyRankingHandler(StrategySelector selector) {
        return new GetStrategyRankingHandler(selector);
    }

    @Bean
    public CreateGameRecommendationHandler createGameRecommendationHandler(UnitOfWorkFactory unitOfWorkFactory,
                                                                           CacheService cacheService,
                                                                           Clock clock) {
        return new CreateGameRecommendationHandler(unitOfWorkFactory, cacheService, clock, transactionTimeout);
    }

    @Bean
    public RecordServedRecommendationsHandler recordServedRecommendationsHandler(UnitOfWorkFactory unitOfWorkFactory,
                                                                                 Clock clock) {
        return new RecordServedRecommendationsHandler(unitOfWorkFactory, clock, transactionTimeout);
    }

    @Bean
    public TrackRecommendationInteractionHandler trackRecommendationInteractionHandler(
        UnitOfWorkFactory unitOfWorkFactory, Clock clock) {
        return new TrackRecommendationInteractionHandler(unitOfWorkFactory, clock, transactionTimeout);
    }

    @Bean
    public UpdateGameManagementSettingsHandler updateGameManagementSettingsHandler(
        UnitOfWorkFactory unitOfWorkFactory, CacheService cacheService, Clock clock) {
        return new UpdateGameManagementSettingsHandler(unitOfWorkFactory, cacheService, clock, transactionTimeout);
    }

    @Bean
    public CreateExperimentHandler createExperimentHandler(UnitOfWorkFactory unitOfWorkFactory,
                                                           StrategyRegistry registry,
                                                           Clock clock) {
        return new CreateExperimentHandler(unitOfWorkFactory, registry, clock, transactionTimeout);
    }

    @Bean
    public StartExperimentHandler startExperimentHandler(UnitOfWorkFactory unitOfWorkFactory, Clock clock) {
        return new StartExperimentHandler(unitOfWorkFactory, clock, transactionTimeout);
    }

    @Bean
    public CompleteExperimentHandler completeExperimentHandler(UnitOfWorkFactory unitOfWorkFactory, Clock clock) {
        return new CompleteExperimentHandler(unitOfWorkFactory, clock, transactionTimeout);
    }

    @Bean
    public HandlerRegistry handlerRegistry(List<RequestHandler<?, ?>> handlers) {
        return HandlerRegistry.of(handlers);
    }

    @Bean
    public Dispatcher dispatcher(HandlerRegistry handlerRegistry) {
        return new MediatorDispatcher(handlerRegistry);
    }

    @Bean
    public ExperimentCacheInvalidator experimentCacheInvalidator(CacheService cacheService) {
        return new ExperimentCacheInvalidator(cacheService);
    }
}
