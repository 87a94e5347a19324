package net.gaiming.domain.model;

import java.time.Instant;

/**
 * One offline evaluation measurement for an algorithm (precision, recall, ndcg, response time, ...).
 */
public record StrategyMetricSample(String algorithm, String metricName, double metricValue,
                                   Instant measuredAt, String period) {
}
