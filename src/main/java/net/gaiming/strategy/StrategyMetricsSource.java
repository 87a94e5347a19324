package net.gaiming.strategy;

import jakarta.annotation.Nullable;
import net.gaiming.support.result.Result;

/**
 * Supplies the measured performance of a strategy by name.
 */
@FunctionalInterface
public interface StrategyMetricsSource {

    Result<StrategyPerformanceMetrics> metricsFor(String strategyName, TimeWindow window, @Nullable String context);
}
