package net.gaiming.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class StrategyRankingTest {

    private static final StrategyPerformanceMetrics METRICS = StrategyPerformanceMetrics.builder()
        .strategyName("Hybrid")
        .totalRecommendations(200)
        .clickedRecommendations(50)
        .playedRecommendations(20)
        .clickThroughRate(0.25)
        .conversionRate(0.1)
        .revenuePerRecommendation(25.0)
        .diversity(0.6)
        .f1Score(0.4)
        .precision(0.5)
        .recall(0.3)
        .coverage(0.8)
        .averageResponseTimeMs(250)
        .build();

    @Test
    void should_WeightConversionClicksRevenueAndDiversity_When_ComputingOverallScore() {
        // revenue per recommendation is capped at 10
        double expected = 0.1 * 0.4 + 0.25 * 0.3 + 1.0 * 0.2 + 0.6 * 0.1;

        assertThat(StrategyRanking.computeOverallScore(METRICS)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void should_ComputeComponentScores_When_Unranked() {
        StrategyRanking ranking = StrategyRanking.unranked(METRICS);

        assertThat(ranking.rank()).isZero();
        assertThat(ranking.performanceScore()).isCloseTo((0.1 + 0.25 + 0.4) / 3, within(1e-9));
        assertThat(ranking.efficiencyScore()).isCloseTo((0.75 + 0.8) / 2, within(1e-9));
        assertThat(ranking.reliabilityScore()).isCloseTo((0.25 + 0.5 + 0.3) / 3, within(1e-9));
    }

    @Test
    void should_FloorResponseScoreAtZero_When_SlowerThanBudget() {
        StrategyPerformanceMetrics slow = StrategyPerformanceMetrics.builder()
            .strategyName("DeepLearning")
            .averageResponseTimeMs(5_000)
            .coverage(0.4)
            .build();

        assertThat(StrategyRanking.computeEfficiencyScore(slow)).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void should_KeepScores_When_RankAssigned() {
        StrategyRanking ranked = StrategyRanking.unranked(METRICS).withRank(2);

        assertThat(ranked.rank()).isEqualTo(2);
        assertThat(ranked.overallScore()).isEqualTo(StrategyRanking.computeOverallScore(METRICS));
    }

    @Test
    void should_ReportZeroSuccessRate_When_NothingServed() {
        assertThat(StrategyPerformanceMetrics.builder().strategyName("Bandit").build().successRate()).isZero();
    }
}
