package net.gaiming.test;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import net.gaiming.application.cqrs.Dispatcher;
import net.gaiming.application.cqrs.HandlerRegistry;
import net.gaiming.application.cqrs.RequestHandler;
import net.gaiming.application.experiment.ExperimentCacheInvalidator;
import net.gaiming.application.experiment.ExperimentService;
import net.gaiming.application.recommendation.RecommendationProperties;
import net.gaiming.application.recommendation.pipeline.RecommendationPipelineService;
import net.gaiming.config.PersistenceConfig;
import net.gaiming.config.RecommendationEngineConfig;
import net.gaiming.config.StrategyProperties;
import net.gaiming.domain.event.AbTestCompletedEvent;
import net.gaiming.domain.event.AbTestStartedEvent;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.strategy.StrategyPerformanceService;
import net.gaiming.strategy.StrategyRegistry;
import net.gaiming.strategy.StrategySelector;
import net.gaiming.support.cache.CacheService;
import net.gaiming.support.cache.CaffeineCacheService;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

/**
 * The whole engine over a private in-memory H2 database, wired through the production
 * configuration classes without a Spring context.
 */
public final class EmbeddedEngine implements AutoCloseable {

    public static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private final DriverManagerDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final MutableClock clock = new MutableClock(START);
    private final RecordingEventPublisher events = new RecordingEventPublisher();
    private final CacheService cache = new CaffeineCacheService(10_000);
    private final UnitOfWorkFactory unitOfWorkFactory;
    private final RecommendationProperties properties;
    private final StrategyRegistry strategies;
    private final ExperimentService experimentService;
    private final StrategySelector selector;
    private final RecommendationPipelineService pipelineService;
    private final Dispatcher dispatcher;

    public EmbeddedEngine() {
        this(RecommendationProperties.defaults());
    }

    public EmbeddedEngine(RecommendationProperties properties) {
        this.properties = properties;
        this.dataSource = new DriverManagerDataSource("jdbc:h2:mem:gaiming-" + UUID.randomUUID()
            + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1", "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        this.jdbcTemplate = new JdbcTemplate(dataSource);

        PersistenceConfig persistence = new PersistenceConfig();
        this.unitOfWorkFactory = persistence.unitOfWorkFactory(jdbcTemplate,
            new DataSourceTransactionManager(dataSource), persistence.jsonColumns(), events, clock);

        RecommendationEngineConfig config = new RecommendationEngineConfig(Duration.ofSeconds(30));
        StrategyProperties strategyProperties = new StrategyProperties();
        StrategyPerformanceService metrics = config.strategyPerformanceService(unitOfWorkFactory);
        this.strategies = config.strategyRegistry(metrics, clock,
            config.collaborativeFilteringStrategy(metrics, clock),
            config.contentBasedStrategy(metrics, clock),
            strategyProperties);
        this.experimentService = config.experimentService(unitOfWorkFactory, clock);
        this.selector = config.strategySelector(strategies, unitOfWorkFactory, experimentService, strategyProperties);
        this.pipelineService = config.recommendationPipelineService(unitOfWorkFactory, selector, cache, properties, clock);

        List<RequestHandler<?, ?>> handlers = List.of(
            config.getRecommendationsHandler(pipelineService, cache, properties),
            config.getRecommendationHistoryHandler(unitOfWorkFactory),
            config.getStrategyRankingHandler(selector),
            config.createGameRecommendationHandler(unitOfWorkFactory, cache, clock),
            config.recordServedRecommendationsHandler(unitOfWorkFactory, clock),
            config.trackRecommendationInteractionHandler(unitOfWorkFactory, clock),
            config.updateGameManagementSettingsHandler(unitOfWorkFactory, cache, clock),
            config.createExperimentHandler(unitOfWorkFactory, strategies, clock),
            config.startExperimentHandler(unitOfWorkFactory, clock),
            config.completeExperimentHandler(unitOfWorkFactory, clock));
        HandlerRegistry registry = config.handlerRegistry(handlers);
        this.dispatcher = config.dispatcher(registry);

        ExperimentCacheInvalidator invalidator = config.experimentCacheInvalidator(cache);
        events.subscribe(event -> {
            if (event instanceof AbTestStartedEvent started) {
                invalidator.handleExperimentStarted(started);
            } else if (event instanceof AbTestCompletedEvent completed) {
                invalidator.handleExperimentCompleted(completed);
            }
        });
    }

    public EmbeddedEngine player(long playerId, boolean active) {
        jdbcTemplate.update("INSERT INTO players (id, username, is_active, country, vip_level, registered_at) "
                + "VALUES (?, ?, ?, ?, ?, ?)",
            playerId, "player" + playerId, active, "GB", 0, Timestamp.from(START.minus(Duration.ofDays(30))));
        return this;
    }

    /**
     * @param preferredTypesJson JSON array of game type names, or {@code null}
     */
    public EmbeddedEngine playerFeatures(long playerId, int gamesPlayed, int sessions, String preferredTypesJson) {
        jdbcTemplate.update("INSERT INTO player_features (player_id, total_games_played, session_count, "
                + "preferred_game_types, play_style, is_new_player) VALUES (?, ?, ?, ?, ?, ?)",
            playerId, gamesPlayed, sessions, preferredTypesJson, "casual", gamesPlayed == 0);
        return this;
    }

    public EmbeddedEngine game(long gameId, int providerId, String gameType, double popularity) {
        jdbcTemplate.update("INSERT INTO game_features (game_id, game_name, provider_id, provider_name, game_type_id, "
                + "game_type, volatility_id, average_rtp, popularity_score, revenue_score, is_active) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            gameId, "Game " + gameId, providerId, "Provider " + providerId, Math.abs(gameType.hashCode() % 100),
            gameType, 2, 96.0, popularity, popularity / 2, true);
        return this;
    }

    public int countRows(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    public MutableClock clock() {
        return clock;
    }

    public RecordingEventPublisher events() {
        return events;
    }

    public CacheService cache() {
        return cache;
    }

    public UnitOfWorkFactory unitOfWorkFactory() {
        return unitOfWorkFactory;
    }

    public RecommendationProperties properties() {
        return properties;
    }

    public StrategyRegistry strategies() {
        return strategies;
    }

    public ExperimentService experimentService() {
        return experimentService;
    }

    public StrategySelector selector() {
        return selector;
    }

    public RecommendationPipelineService pipelineService() {
        return pipelineService;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    @Override
    public void close() {
        jdbcTemplate.execute("SHUTDOWN");
    }
}
