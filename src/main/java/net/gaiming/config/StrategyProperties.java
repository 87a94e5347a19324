package net.gaiming.config;

import jakarta.annotation.PostConstruct;
import net.gaiming.strategy.StrategySelectionProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strongly typed configuration for strategy selection and the individual strategies.
 */
@Component
@ConfigurationProperties(prefix = "gaiming.strategy")
public class StrategyProperties {

    /**
     * Players with fewer games than this are treated as cold start (content based).
     */
    private int coldStartGamesThreshold = 5;

    /**
     * Players above both experience thresholds get collaborative filtering.
     */
    private int experiencedGamesThreshold = 50;

    private int experiencedSessionsThreshold = 20;

    /**
     * More preferred game types than this selects the hybrid strategy.
     */
    private int diversePreferenceThreshold = 3;

    /**
     * Strategy per serving context when no profile rule matched.
     */
    private Map<String, String> contextDefaults = new LinkedHashMap<>(StrategySelectionProperties.defaults().contextDefaults());

    /**
     * Share of bandit requests that explore instead of exploiting the best known reward.
     */
    private double banditExplorationRate = 0.1;

    private String deepLearningModelPath = "models/recommendation_model.pb";

    /**
     * Upper bound for one model-serving call.
     */
    private Duration deepLearningTimeout = Duration.ofMillis(500);

    @PostConstruct
    void validate() {
        Assert.isTrue(coldStartGamesThreshold >= 0, "gaiming.strategy.cold-start-games-threshold must be non-negative");
        Assert.isTrue(banditExplorationRate >= 0.0 && banditExplorationRate <= 1.0,
            "gaiming.strategy.bandit-exploration-rate must be within 0..1");
        Assert.isTrue(!deepLearningTimeout.isNegative() && !deepLearningTimeout.isZero(),
            "gaiming.strategy.deep-learning-timeout must be positive");
        Assert.hasText(deepLearningModelPath, "gaiming.strategy.deep-learning-model-path must be set");
    }

    public StrategySelectionProperties toSelectionProperties() {
        return new StrategySelectionProperties(coldStartGamesThreshold, experiencedGamesThreshold,
            experiencedSessionsThreshold, diversePreferenceThreshold, contextDefaults);
    }

    public int getColdStartGamesThreshold() {
        return coldStartGamesThreshold;
    }

    public void setColdStartGamesThreshold(int coldStartGamesThreshold) {
        this.coldStartGamesThreshold = coldStartGamesThreshold;
    }

    public int getExperiencedGamesThreshold() {
        return experiencedGamesThreshold;
    }

    public void setExperiencedGamesThreshold(int experiencedGamesThreshold) {
        this.experiencedGamesThreshold = experiencedGamesThreshold;
    }

    public int getExperiencedSessionsThreshold() {
        return experiencedSessionsThreshold;
    }

    public void setExperiencedSessionsThreshold(int experiencedSessionsThreshold) {
        this.experiencedSessionsThreshold = experiencedSessionsThreshold;
    }

    public int getDiversePreferenceThreshold() {
        return diversePreferenceThreshold;
    }

    public void setDiversePreferenceThreshold(int diversePreferenceThreshold) {
        this.diversePreferenceThreshold = diversePreferenceThreshold;
    }

    public Map<String, String> getContextDefaults() {
        return contextDefaults;
    }

    public void setContextDefaults(Map<String, String> contextDefaults) {
        this.contextDefaults = contextDefaults;
    }

    public double getBanditExplorationRate() {
        return banditExplorationRate;
    }

    public void setBanditExplorationRate(double banditExplorationRate) {
        this.banditExplorationRate = banditExplorationRate;
    }

    public String getDeepLearningModelPath() {
        return deepLearningModelPath;
    }

    public void setDeepLearningModelPath(String deepLearningModelPath) {
        this.deepLearningModelPath = deepLearningModelPath;
    }

    public Duration getDeepLearningTimeout() {
        return deepLearningTimeout;
    }

    public void setDeepLearningTimeout(Duration deepLearningTimeout) {
        this.deepLearningTimeout = deepLearningTimeout;
    }
}
