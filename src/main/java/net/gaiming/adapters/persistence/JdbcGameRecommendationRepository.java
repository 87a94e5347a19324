package net.gaiming.adapters.persistence;

import net.gaiming.domain.model.GameRecommendation;
import net.gaiming.domain.repository.GameRecommendationRepository;
import net.gaiming.domain.repository.RecommendationHistoryCriteria;
import org.springframework.jdbc.core.RowMapper;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static net.gaiming.adapters.persistence.ResultSetSupport.getInstant;
import static net.gaiming.adapters.persistence.ResultSetSupport.setNullableString;
import static net.gaiming.adapters.persistence.ResultSetSupport.setNullableTimestamp;
import static net.gaiming.adapters.persistence.ResultSetSupport.toTimestamp;

class JdbcGameRecommendationRepository extends AbstractJdbcEntityRepository<GameRecommendation>
    implements GameRecommendationRepository {

    private static final String INSERT_SQL = """
        INSERT INTO game_recommendations (
            player_id, game_id, algorithm, score, rank_position, context, category, reason, confidence,
            is_clicked, clicked_at, is_played, played_at, session_id, platform, experiment_variant,
            model_version, feature_snapshot, metadata, version, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    // Only the interaction flags are mutable.
    private static final String UPDATE_SQL = """
        UPDATE game_recommendations
        SET is_clicked = ?, clicked_at = ?, is_played = ?, played_at = ?, updated_at = ?, version = version + 1
        WHERE id = ? AND version = ?
        """;

    private final RowMapper<GameRecommendation> mapper;

    JdbcGameRecommendationRepository(JdbcRepositoryContext context) {
        super(context);
        JsonColumns json = context.json();
        this.mapper = (rs, rowNum) -> {
            GameRecommendation recommendation = GameRecommendation.builder()
                .playerId(rs.getLong("player_id"))
                .gameId(rs.getLong("game_id"))
                .algorithm(rs.getString("algorithm"))
                .score(rs.getDouble("score"))
                .position(rs.getInt("rank_position"))
                .context(rs.getString("context"))
                .category(rs.getString("category"))
                .reason(rs.getString("reason"))
                .confidence(rs.getDouble("confidence"))
                .clicked(rs.getBoolean("is_clicked"))
                .clickedAt(getInstant(rs, "clicked_at"))
                .played(rs.getBoolean("is_played"))
                .playedAt(getInstant(rs, "played_at"))
                .sessionId(rs.getString("session_id"))
                .platform(rs.getString("platform"))
                .experimentVariant(rs.getString("experiment_variant"))
                .modelVersion(rs.getString("model_version"))
                .featureSnapshot(json.readDoubleMap(rs.getString("feature_snapshot")))
                .metadata(json.readObjectMap(rs.getString("metadata")))
                .createdAt(getInstant(rs, "created_at"))
                .build();
            recommendation.restore(rs.getLong("id"), rs.getLong("version"),
                getInstant(rs, "created_at"), getInstant(rs, "updated_at"));
            return recommendation;
        };
    }

    @Override
    protected String tableName() {
        return "game_recommendations";
    }

    @Override
    protected RowMapper<GameRecommendation> rowMapper() {
        return mapper;
    }

    @Override
    public List<GameRecommendation> findByAlgorithm(String algorithm, Instant from, Instant to) {
        return query("recommendations for algorithm " + algorithm,
            "SELECT * FROM game_recommendations WHERE LOWER(algorithm) = LOWER(?) AND created_at >= ? AND created_at <= ?",
            algorithm, toTimestamp(from), toTimestamp(to));
    }

    @Override
    public List<GameRecommendation> findHistory(RecommendationHistoryCriteria criteria) {
        List<String> clauses = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (criteria.getPlayerId() != null) {
            clauses.add("player_id = ?");
            params.add(criteria.getPlayerId());
        }
        if (criteria.getGameId() != null) {
            clauses.add("game_id = ?");
            params.add(criteria.getGameId());
        }
        if (criteria.getAlgorithm() != null) {
            clauses.add("LOWER(algorithm) = LOWER(?)");
            params.add(criteria.getAlgorithm());
        }
        if (criteria.getContext() != null) {
            clauses.add("LOWER(context) = LOWER(?)");
            params.add(criteria.getContext());
        }
        if (criteria.getFrom() != null) {
            clauses.add("created_at >= ?");
            params.add(toTimestamp(criteria.getFrom()));
        }
        if (criteria.getTo() != null) {
            clauses.add("created_at < ?");
            params.add(toTimestamp(criteria.getTo()));
        }
        if (criteria.getClicked() != null) {
            clauses.add("is_clicked = ?");
            params.add(criteria.getClicked());
        }
        if (criteria.getPlayed() != null) {
            clauses.add("is_played = ?");
            params.add(criteria.getPlayed());
        }
        String where = clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
        return query("recommendation history",
            "SELECT * FROM game_recommendations" + where + " ORDER BY created_at DESC, id DESC",
            params.toArray());
    }

    @Override
    protected String insertSql() {
        return INSERT_SQL;
    }

    @Override
    protected void bindInsert(PreparedStatement ps, GameRecommendation entity) throws SQLException {
        JsonColumns json = context.json();
        Instant createdAt = entity.getCreatedAt() != null ? entity.getCreatedAt() : now();
        ps.setLong(1, entity.getPlayerId());
        ps.setLong(2, entity.getGameId());
        ps.setString(3, entity.getAlgorithm());
        ps.setDouble(4, entity.getScore());
        ps.setInt(5, entity.getPosition());
        ps.setString(6, entity.getContext());
        ps.setString(7, entity.getCategory());
        ps.setString(8, entity.getReason());
        ps.setDouble(9, entity.getConfidence());
        ps.setBoolean(10, entity.isClicked());
        setNullableTimestamp(ps, 11, entity.getClickedAt());
        ps.setBoolean(12, entity.isPlayed());
        setNullableTimestamp(ps, 13, entity.getPlayedAt());
        setNullableString(ps, 14, entity.getSessionId());
        setNullableString(ps, 15, entity.getPlatform());
        setNullableString(ps, 16, entity.getExperimentVariant());
        ps.setString(17, entity.getModelVersion());
        setNullableString(ps, 18, json.write(entity.getFeatureSnapshot()));
        setNullableString(ps, 19, json.write(entity.getMetadata()));
        ps.setLong(20, entity.getVersion());
        ps.setTimestamp(21, toTimestamp(createdAt));
        ps.setTimestamp(22, toTimestamp(entity.getUpdatedAt() != null ? entity.getUpdatedAt() : createdAt));
    }

    @Override
    protected String updateSql() {
        return UPDATE_SQL;
    }

    @Override
    protected int bindUpdate(PreparedStatement ps, GameRecommendation entity) throws SQLException {
        ps.setBoolean(1, entity.isClicked());
        setNullableTimestamp(ps, 2, entity.getClickedAt());
        ps.setBoolean(3, entity.isPlayed());
        setNullableTimestamp(ps, 4, entity.getPlayedAt());
        ps.setTimestamp(5, toTimestamp(entity.getUpdatedAt() != null ? entity.getUpdatedAt() : now()));
        return 6;
    }
}
