package net.gaiming.application.experiment;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.recommendation.RecommendationCacheKeys;
import net.gaiming.domain.event.AbTestCompletedEvent;
import net.gaiming.domain.event.AbTestStartedEvent;
import net.gaiming.support.cache.CacheService;
import org.springframework.context.event.EventListener;

/**
 * Starting or completing an experiment changes which strategy serves the targeted players,
 * so every cached recommendation list is dropped.
 */
@Slf4j
public class ExperimentCacheInvalidator {

    private final CacheService cache;

    public ExperimentCacheInvalidator(CacheService cache) {
        this.cache = cache;
    }

    @EventListener
    public void handleExperimentStarted(AbTestStartedEvent event) {
        int evicted = RecommendationCacheKeys.evictAll(cache);
        log.info("Experiment {} started with variants {}; evicted {} cached list(s)",
            event.experimentName(), event.variantNames(), evicted);
    }

    @EventListener
    public void handleExperimentCompleted(AbTestCompletedEvent event) {
        int evicted = RecommendationCacheKeys.evictAll(cache);
        log.info("Experiment {} completed (winner {}); evicted {} cached list(s)",
            event.experimentName(), event.winningVariant(), evicted);
    }
}
