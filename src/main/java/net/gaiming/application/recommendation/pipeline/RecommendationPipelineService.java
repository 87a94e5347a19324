package net.gaiming.application.recommendation.pipeline;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.recommendation.RecommendationProperties;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.pipeline.Pipeline;
import net.gaiming.pipeline.PipelineContext;
import net.gaiming.support.result.Result;
import net.gaiming.support.time.Deadline;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;

/**
 * Entry point for running the recommendation pipeline with a fresh context per request.
 */
@Slf4j
public class RecommendationPipelineService {

    private final Pipeline<RecommendationRequest, List<Recommendation>> pipeline;
    private final RecommendationProperties properties;
    private final Clock clock;

    public RecommendationPipelineService(Pipeline<RecommendationRequest, List<Recommendation>> pipeline,
                                         RecommendationProperties properties,
                                         Clock clock) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.clock = clock;
    }

    public Result<List<Recommendation>> execute(RecommendationRequest request) {
        return execute(request, null, null);
    }

    /**
     * @param userId        caller identity recorded on the context
     * @param correlationId propagated from the caller, generated when {@code null}
     */
    public Result<List<Recommendation>> execute(RecommendationRequest request,
                                                @Nullable String userId,
                                                @Nullable String correlationId) {
        PipelineContext context = PipelineContext.builder()
            .userId(userId)
            .correlationId(correlationId)
            .deadline(deadline())
            .clock(clock)
            .build();
        return execute(request, context);
    }

    public Result<List<Recommendation>> execute(RecommendationRequest request, PipelineContext context) {
        Result<List<Recommendation>> result = pipeline.execute(request, context);
        if (result.isFailure()) {
            log.info("Recommendation pipeline failed for player {} (correlation {}): {}",
                request.playerId(), context.getCorrelationId(), result.getError());
        } else {
            log.debug("Recommendation pipeline served {} game(s) to player {} (correlation {})",
                result.getValue().size(), request.playerId(), context.getCorrelationId());
        }
        return result;
    }

    /**
     * Runs the pipeline off the caller's thread.
     */
    public Mono<Result<List<Recommendation>>> executeAsync(RecommendationRequest request) {
        return Mono.fromCallable(() -> execute(request))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private Deadline deadline() {
        if (properties.pipelineTimeout().isZero() || properties.pipelineTimeout().isNegative()) {
            return Deadline.none();
        }
        return Deadline.after(properties.pipelineTimeout(), clock);
    }
}
