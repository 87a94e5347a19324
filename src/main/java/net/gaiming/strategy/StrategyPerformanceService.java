package net.gaiming.strategy;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.gaiming.adapters.persistence.DataAccessFailures;
import net.gaiming.domain.model.GameRecommendation;
import net.gaiming.domain.model.StrategyMetricSample;
import net.gaiming.domain.repository.GameRecommendationRepository;
import net.gaiming.domain.repository.StrategyMetricRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Computes {@link StrategyPerformanceMetrics} from served recommendation history (live
 * engagement) and the offline evaluation samples of the model-evaluation jobs.
 */
@Slf4j
public class StrategyPerformanceService implements StrategyMetricsSource {

    static final String PRECISION = "precision";
    static final String RECALL = "recall";
    static final String NDCG = "ndcg";
    static final String COVERAGE = "coverage";
    static final String DIVERSITY = "diversity";
    static final String NOVELTY = "novelty";
    static final String REVENUE = "revenue";
    static final String RESPONSE_TIME_MS = "response_time_ms";

    private static final List<String> STANDARD_METRICS =
        List.of(PRECISION, RECALL, NDCG, COVERAGE, DIVERSITY, NOVELTY, REVENUE, RESPONSE_TIME_MS);

    private final UnitOfWorkFactory unitOfWorkFactory;

    public StrategyPerformanceService(UnitOfWorkFactory unitOfWorkFactory) {
        this.unitOfWorkFactory = unitOfWorkFactory;
    }

    @Override
    public Result<StrategyPerformanceMetrics> metricsFor(String strategyName, TimeWindow window,
                                                         @Nullable String context) {
        List<GameRecommendation> served;
        List<StrategyMetricSample> samples;
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            served = uow.getRepository(GameRecommendationRepository.class)
                .findByAlgorithm(strategyName, window.from(), window.to());
            samples = uow.getRepository(StrategyMetricRepository.class)
                .findByAlgorithm(strategyName, window.from(), window.to());
        } catch (RuntimeException ex) {
            log.warn("Failed to load performance data for strategy {}: {}", strategyName, ex.getMessage());
            return DataAccessFailures.toResult("Failed to load performance data for " + strategyName, ex);
        }

        if (context != null) {
            served = served.stream()
                .filter(rec -> rec.getContext().equalsIgnoreCase(context))
                .toList();
        }
        if (served.isEmpty() && samples.isEmpty()) {
            return Result.failure(ErrorCode.NOT_FOUND,
                "No performance data for strategy " + strategyName + " in " + window);
        }
        return Result.success(aggregate(strategyName, window, served, samples));
    }

    static StrategyPerformanceMetrics aggregate(String strategyName, TimeWindow window,
                                                List<GameRecommendation> served,
                                                List<StrategyMetricSample> samples) {
        long total = served.size();
        long clicked = served.stream().filter(GameRecommendation::isClicked).count();
        long played = served.stream().filter(GameRecommendation::isPlayed).count();
        double averageScore = served.stream().mapToDouble(GameRecommendation::getScore).average().orElse(0.0);

        Map<String, Double> averages = samples.stream().collect(Collectors.groupingBy(
            sample -> sample.metricName().toLowerCase(Locale.ROOT),
            LinkedHashMap::new,
            Collectors.averagingDouble(StrategyMetricSample::metricValue)));
        double revenue = samples.stream()
            .filter(sample -> REVENUE.equalsIgnoreCase(sample.metricName()))
            .mapToDouble(StrategyMetricSample::metricValue)
            .sum();
        double precision = averages.getOrDefault(PRECISION, 0.0);
        double recall = averages.getOrDefault(RECALL, 0.0);
        double f1 = precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;

        StrategyPerformanceMetrics.StrategyPerformanceMetricsBuilder builder = StrategyPerformanceMetrics.builder()
            .strategyName(strategyName)
            .window(window)
            .totalRecommendations(total)
            .clickedRecommendations(clicked)
            .playedRecommendations(played)
            .clickThroughRate(total > 0 ? (double) clicked / total : 0.0)
            .conversionRate(total > 0 ? (double) played / total : 0.0)
            .averageScore(averageScore)
            .revenue(revenue)
            .revenuePerRecommendation(total > 0 ? revenue / total : 0.0)
            .precision(precision)
            .recall(recall)
            .f1Score(f1)
            .ndcg(averages.getOrDefault(NDCG, 0.0))
            .coverage(averages.getOrDefault(COVERAGE, 0.0))
            .diversity(averages.getOrDefault(DIVERSITY, 0.0))
            .novelty(averages.getOrDefault(NOVELTY, 0.0))
            .averageResponseTimeMs(averages.getOrDefault(RESPONSE_TIME_MS, 0.0));
        averages.forEach((metric, value) -> {
            if (!STANDARD_METRICS.contains(metric)) {
                builder.customMetric(metric, value);
            }
        });
        return builder.build();
    }
}
