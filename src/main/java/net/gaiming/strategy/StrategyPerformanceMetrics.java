package net.gaiming.strategy;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Live engagement counts and offline quality measures of one strategy over one window.
 */
@Value
@Builder
public class StrategyPerformanceMetrics {

    String strategyName;
    TimeWindow window;

    long totalRecommendations;
    long clickedRecommendations;
    long playedRecommendations;
    double clickThroughRate;
    double conversionRate;
    double averageScore;

    double revenue;
    double revenuePerRecommendation;

    double precision;
    double recall;
    double f1Score;
    double ndcg;
    double coverage;
    double diversity;
    double novelty;
    double averageResponseTimeMs;

    @Singular
    Map<String, Double> customMetrics;

    /**
     * Share of recommendations that were clicked, 0 when nothing was served.
     */
    public double successRate() {
        return totalRecommendations > 0 ? (double) clickedRecommendations / totalRecommendations : 0.0;
    }
}
