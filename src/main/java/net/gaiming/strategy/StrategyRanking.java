package net.gaiming.strategy;

/**
 * Position of one strategy in a ranking, with the component scores it was ranked by.
 */
public record StrategyRanking(String strategyName,
                              double overallScore,
                              double performanceScore,
                              double efficiencyScore,
                              double reliabilityScore,
                              int rank,
                              StrategyPerformanceMetrics metrics) {

    private static final double CONVERSION_WEIGHT = 0.4;
    private static final double CTR_WEIGHT = 0.3;
    private static final double REVENUE_WEIGHT = 0.2;
    private static final double DIVERSITY_WEIGHT = 0.1;
    private static final double REVENUE_PER_RECOMMENDATION_CAP = 10.0;
    private static final double RESPONSE_TIME_BUDGET_MS = 1000.0;

    /**
     * Scores the metrics; the rank is assigned later by the caller.
     */
    public static StrategyRanking unranked(StrategyPerformanceMetrics metrics) {
        return new StrategyRanking(metrics.getStrategyName(),
            computeOverallScore(metrics),
            computePerformanceScore(metrics),
            computeEfficiencyScore(metrics),
            computeReliabilityScore(metrics),
            0,
            metrics);
    }

    public StrategyRanking withRank(int newRank) {
        return new StrategyRanking(strategyName, overallScore, performanceScore, efficiencyScore,
            reliabilityScore, newRank, metrics);
    }

    static double computeOverallScore(StrategyPerformanceMetrics m) {
        return m.getConversionRate() * CONVERSION_WEIGHT
            + m.getClickThroughRate() * CTR_WEIGHT
            + Math.min(m.getRevenuePerRecommendation() / REVENUE_PER_RECOMMENDATION_CAP, 1.0) * REVENUE_WEIGHT
            + m.getDiversity() * DIVERSITY_WEIGHT;
    }

    static double computePerformanceScore(StrategyPerformanceMetrics m) {
        return (m.getConversionRate() + m.getClickThroughRate() + m.getF1Score()) / 3.0;
    }

    static double computeEfficiencyScore(StrategyPerformanceMetrics m) {
        double responseScore = Math.max(0.0, 1.0 - m.getAverageResponseTimeMs() / RESPONSE_TIME_BUDGET_MS);
        return (responseScore + m.getCoverage()) / 2.0;
    }

    static double computeReliabilityScore(StrategyPerformanceMetrics m) {
        return (m.successRate() + m.getPrecision() + m.getRecall()) / 3.0;
    }
}
