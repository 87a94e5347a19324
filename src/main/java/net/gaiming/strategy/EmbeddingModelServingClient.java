package net.gaiming.strategy;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process scorer over the embeddings exported with the model at {@code modelPath}.
 *
 * <p>Player vectors live in the {@code emb_0..emb_n} custom features, game vectors in the
 * game features of the same names. The score is the cosine similarity mapped to {@code [0, 1]};
 * games or players without a vector fall back to popularity.</p>
 */
@Slf4j
public class EmbeddingModelServingClient implements ModelServingClient {

    static final String EMBEDDING_PREFIX = "emb_";
    private static final int MAX_DIMENSIONS = 256;

    private final String modelPath;

    public EmbeddingModelServingClient(String modelPath) {
        this.modelPath = modelPath;
    }

    @Override
    public String modelVersion() {
        int slash = modelPath.lastIndexOf('/');
        return slash >= 0 ? modelPath.substring(slash + 1) : modelPath;
    }

    @Override
    public Mono<Map<Long, Double>> score(PlayerFeatures player, List<GameFeatures> games) {
        return Mono.fromCallable(() -> scoreAll(player, games))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private Map<Long, Double> scoreAll(PlayerFeatures player, List<GameFeatures> games) {
        double[] playerVector = vector(player.getCustomFeatures());
        Map<Long, Double> scores = new HashMap<>();
        for (GameFeatures game : games) {
            double[] gameVector = vector(game.getFeatures());
            if (playerVector.length == 0 || gameVector.length == 0) {
                scores.put(game.getGameId(), game.getPopularityScore());
                continue;
            }
            scores.put(game.getGameId(), (cosine(playerVector, gameVector) + 1.0) / 2.0);
        }
        log.debug("Model {} scored {} games for player {}", modelVersion(), scores.size(), player.getPlayerId());
        return scores;
    }

    static double[] vector(Map<String, Double> features) {
        int dimensions = 0;
        while (dimensions < MAX_DIMENSIONS && features.containsKey(EMBEDDING_PREFIX + dimensions)) {
            dimensions++;
        }
        double[] vector = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            vector[i] = features.get(EMBEDDING_PREFIX + i);
        }
        return vector;
    }

    static double cosine(double[] a, double[] b) {
        int length = Math.min(a.length, b.length);
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
