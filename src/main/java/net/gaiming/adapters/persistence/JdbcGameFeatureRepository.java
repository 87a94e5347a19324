package net.gaiming.adapters.persistence;

import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.repository.GameFeatureRepository;
import org.springframework.jdbc.core.RowMapper;

class JdbcGameFeatureRepository extends AbstractJdbcRepository<GameFeatures> implements GameFeatureRepository {

    private final RowMapper<GameFeatures> mapper;

    JdbcGameFeatureRepository(JdbcRepositoryContext context) {
        super(context);
        JsonColumns json = context.json();
        this.mapper = (rs, rowNum) -> GameFeatures.builder()
            .gameId(rs.getLong("game_id"))
            .gameName(rs.getString("game_name"))
            .providerId(rs.getInt("provider_id"))
            .providerName(rs.getString("provider_name"))
            .gameTypeId(rs.getInt("game_type_id"))
            .gameType(rs.getString("game_type"))
            .volatilityId(rs.getInt("volatility_id"))
            .averageRtp(rs.getDouble("average_rtp"))
            .minBet(rs.getBigDecimal("min_bet"))
            .maxBet(rs.getBigDecimal("max_bet"))
            .popularityScore(rs.getDouble("popularity_score"))
            .revenueScore(rs.getDouble("revenue_score"))
            .mobile(rs.getBoolean("is_mobile"))
            .desktop(rs.getBoolean("is_desktop"))
            .active(rs.getBoolean("is_active"))
            .releaseDate(ResultSetSupport.getLocalDate(rs, "release_date"))
            .newGame(rs.getBoolean("is_new_game"))
            .features(json.readDoubleMap(rs.getString("features")))
            .build();
    }

    @Override
    protected String tableName() {
        return "game_features";
    }

    @Override
    protected String idColumn() {
        return "game_id";
    }

    @Override
    protected RowMapper<GameFeatures> rowMapper() {
        return mapper;
    }
}
