package net.gaiming.application.recommendation.pipeline;

import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.model.RecommendationRequest;

import java.util.List;
import java.util.Objects;

/**
 * Scored candidates flowing between generation and the terminal caching step, ordered by
 * descending score.
 */
public record CandidateSet(RecommendationRequest request, List<Recommendation> recommendations) {

    public CandidateSet {
        Objects.requireNonNull(request, "request");
        recommendations = List.copyOf(recommendations);
    }

    public CandidateSet withRecommendations(List<Recommendation> replacement) {
        return new CandidateSet(request, replacement);
    }

    public int size() {
        return recommendations.size();
    }
}
