package net.gaiming.application.recommendation.pipeline;

import net.gaiming.application.recommendation.RecommendationProperties;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.pipeline.AbstractPipelineStep;
import net.gaiming.pipeline.PipelineContext;
import net.gaiming.support.result.Result;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

/**
 * Keeps at most {@code maxPerCategory} candidates per game category, preserving score order.
 */
public class DiversifyRecommendationsStep extends AbstractPipelineStep<CandidateSet, CandidateSet> {

    public static final String NAME = "DiversifyRecommendations";

    private final int maxPerCategory;

    public DiversifyRecommendationsStep(RecommendationProperties properties) {
        super(NAME, 6, CandidateSet.class, CandidateSet.class);
        this.maxPerCategory = properties.maxPerCategory();
    }

    /**
     * Diversifying only matters once there are more candidates than one category may hold.
     */
    public BiPredicate<CandidateSet, PipelineContext> whenWorthDiversifying() {
        return (candidates, context) -> candidates.size() > maxPerCategory;
    }

    @Override
    public Result<CandidateSet> execute(CandidateSet input, PipelineContext context) {
        Map<String, Integer> perCategory = new HashMap<>();
        List<Recommendation> kept = new ArrayList<>(input.size());
        for (Recommendation candidate : input.recommendations()) {
            String category = candidate.getCategory() == null ? "" : candidate.getCategory();
            if (perCategory.merge(category, 1, Integer::sum) <= maxPerCategory) {
                kept.add(candidate);
            }
        }
        return Result.success(input.withRecommendations(kept));
    }
}
