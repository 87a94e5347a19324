package net.gaiming.strategy;

import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Scores candidate games with a trained model. Implementations may call a remote model
 * server; callers bound the returned {@link Mono} with a timeout.
 */
public interface ModelServingClient {

    String modelVersion();

    /**
     * @return score per game id; games the model cannot score are left out
     */
    Mono<Map<Long, Double>> score(PlayerFeatures player, List<GameFeatures> games);
}
