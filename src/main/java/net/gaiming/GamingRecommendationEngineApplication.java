package net.gaiming;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Recommendation orchestration engine for the GAIming platform.
 */
@SpringBootApplication
public class GamingRecommendationEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(GamingRecommendationEngineApplication.class, args);
    }
}
