package net.gaiming.application.recommendation;

import java.time.Duration;

/**
 * Tunables of the recommendation pipeline and the recommendation query cache.
 *
 * @param minimumScore     candidates scoring at or below this are dropped by business rules
 * @param oversampleFactor strategies are asked for {@code count * oversampleFactor} candidates
 *                         so that filtering still leaves enough to fill the request
 * @param pipelineTimeout  overall deadline of one pipeline run; zero disables it
 */
public record RecommendationProperties(int defaultCount,
                                       int maxCount,
                                       Duration cacheTtl,
                                       double minimumScore,
                                       int maxPerProvider,
                                       int maxPerCategory,
                                       int oversampleFactor,
                                       Duration pipelineTimeout) {

    public RecommendationProperties {
        if (defaultCount < 1 || defaultCount > maxCount) {
            throw new IllegalArgumentException("defaultCount must be within 1.." + maxCount + ": " + defaultCount);
        }
        if (maxPerProvider < 1 || maxPerCategory < 1) {
            throw new IllegalArgumentException("Provider and category caps must be positive");
        }
        if (oversampleFactor < 1) {
            throw new IllegalArgumentException("oversampleFactor must be at least 1: " + oversampleFactor);
        }
        cacheTtl = cacheTtl == null ? Duration.ZERO : cacheTtl;
        pipelineTimeout = pipelineTimeout == null ? Duration.ZERO : pipelineTimeout;
    }

    public static RecommendationProperties defaults() {
        return new RecommendationProperties(10, 100, Duration.ofMinutes(5), 0.1, 5, 3, 3, Duration.ofSeconds(5));
    }

    public boolean isCountAllowed(int count) {
        return count >= 1 && count <= maxCount;
    }
}
