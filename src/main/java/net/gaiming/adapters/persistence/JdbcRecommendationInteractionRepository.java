package net.gaiming.adapters.persistence;

import net.gaiming.domain.model.InteractionType;
import net.gaiming.domain.model.RecommendationInteraction;
import net.gaiming.domain.repository.RecommendationInteractionRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

import static net.gaiming.adapters.persistence.ResultSetSupport.getDoubleOrNull;
import static net.gaiming.adapters.persistence.ResultSetSupport.getInstant;
import static net.gaiming.adapters.persistence.ResultSetSupport.setNullableDouble;
import static net.gaiming.adapters.persistence.ResultSetSupport.setNullableString;
import static net.gaiming.adapters.persistence.ResultSetSupport.toTimestamp;

/**
 * Append-only interaction log. The unique index on
 * {@code (recommendation_id, session_id, interaction_type)} backs the dedup check.
 */
class JdbcRecommendationInteractionRepository extends AbstractJdbcEntityRepository<RecommendationInteraction>
    implements RecommendationInteractionRepository {

    private static final String INSERT_SQL = """
        INSERT INTO recommendation_interactions (
            recommendation_id, player_id, game_id, interaction_type, interaction_value, session_id,
            platform, user_agent, interaction_date, metadata, version, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final RowMapper<RecommendationInteraction> mapper;

    JdbcRecommendationInteractionRepository(JdbcRepositoryContext context) {
        super(context);
        JsonColumns json = context.json();
        this.mapper = (rs, rowNum) -> {
            RecommendationInteraction interaction = RecommendationInteraction.builder()
                .recommendationId(rs.getLong("recommendation_id"))
                .playerId(rs.getLong("player_id"))
                .gameId(rs.getLong("game_id"))
                .interactionType(InteractionType.valueOf(rs.getString("interaction_type")))
                .value(getDoubleOrNull(rs, "interaction_value"))
                .sessionId(rs.getString("session_id"))
                .platform(rs.getString("platform"))
                .userAgent(rs.getString("user_agent"))
                .interactionDate(getInstant(rs, "interaction_date"))
                .metadata(json.readObjectMap(rs.getString("metadata")))
                .build();
            interaction.restore(rs.getLong("id"), rs.getLong("version"),
                getInstant(rs, "created_at"), getInstant(rs, "updated_at"));
            return interaction;
        };
    }

    @Override
    protected String tableName() {
        return "recommendation_interactions";
    }

    @Override
    protected RowMapper<RecommendationInteraction> rowMapper() {
        return mapper;
    }

    @Override
    public boolean exists(long recommendationId, String sessionId, InteractionType interactionType) {
        String sql = """
            SELECT COUNT(*) FROM recommendation_interactions
            WHERE recommendation_id = ? AND session_id = ? AND interaction_type = ?
            """;
        try {
            Long count = jdbcTemplate.queryForObject(sql, Long.class,
                recommendationId, RecommendationInteraction.normalizeSession(sessionId), interactionType.name());
            return count != null && count > 0;
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to check interaction " + interactionType
                + " for recommendation " + recommendationId, ex);
        }
    }

    @Override
    public List<RecommendationInteraction> findByRecommendation(long recommendationId) {
        return query("interactions for recommendation " + recommendationId,
            "SELECT * FROM recommendation_interactions WHERE recommendation_id = ? ORDER BY interaction_date",
            recommendationId);
    }

    @Override
    protected String insertSql() {
        return INSERT_SQL;
    }

    @Override
    protected void bindInsert(PreparedStatement ps, RecommendationInteraction entity) throws SQLException {
        ps.setLong(1, entity.getRecommendationId());
        ps.setLong(2, entity.getPlayerId());
        ps.setLong(3, entity.getGameId());
        ps.setString(4, entity.getInteractionType().name());
        setNullableDouble(ps, 5, entity.getValue());
        ps.setString(6, entity.getSessionId());
        setNullableString(ps, 7, entity.getPlatform());
        setNullableString(ps, 8, entity.getUserAgent());
        ps.setTimestamp(9, toTimestamp(entity.getInteractionDate()));
        setNullableString(ps, 10, context.json().write(entity.getMetadata()));
        ps.setLong(11, entity.getVersion());
        ps.setTimestamp(12, toTimestamp(entity.getInteractionDate()));
        ps.setTimestamp(13, toTimestamp(entity.getInteractionDate()));
    }
}
