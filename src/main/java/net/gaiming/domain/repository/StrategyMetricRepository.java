package net.gaiming.domain.repository;

import net.gaiming.domain.model.StrategyMetricSample;

import java.time.Instant;
import java.util.List;

/**
 * Offline evaluation samples written by the model-evaluation jobs.
 */
public interface StrategyMetricRepository {

    List<StrategyMetricSample> findByAlgorithm(String algorithm, Instant from, Instant to);
}
