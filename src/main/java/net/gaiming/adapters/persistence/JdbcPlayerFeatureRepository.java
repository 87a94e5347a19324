package net.gaiming.adapters.persistence;

import net.gaiming.domain.model.PlayerFeatures;
import net.gaiming.domain.repository.PlayerFeatureRepository;
import org.springframework.jdbc.core.RowMapper;

class JdbcPlayerFeatureRepository extends AbstractJdbcRepository<PlayerFeatures> implements PlayerFeatureRepository {

    private final RowMapper<PlayerFeatures> mapper;

    JdbcPlayerFeatureRepository(JdbcRepositoryContext context) {
        super(context);
        JsonColumns json = context.json();
        this.mapper = (rs, rowNum) -> PlayerFeatures.builder()
            .playerId(rs.getLong("player_id"))
            .age(rs.getInt("age"))
            .country(rs.getString("country"))
            .riskLevel(rs.getInt("risk_level"))
            .vipLevel(rs.getInt("vip_level"))
            .totalDeposits(ResultSetSupport.getDecimalOrZero(rs, "total_deposits"))
            .totalBets(ResultSetSupport.getDecimalOrZero(rs, "total_bets"))
            .totalWins(ResultSetSupport.getDecimalOrZero(rs, "total_wins"))
            .averageBetSize(ResultSetSupport.getDecimalOrZero(rs, "average_bet_size"))
            .totalGamesPlayed(rs.getInt("total_games_played"))
            .sessionCount(rs.getInt("session_count"))
            .averageSessionDuration(rs.getDouble("average_session_duration"))
            .lastPlayDate(ResultSetSupport.getInstant(rs, "last_play_date"))
            .daysSinceLastPlay(rs.getInt("days_since_last_play"))
            .preferredGameTypes(json.readStringList(rs.getString("preferred_game_types")))
            .preferredProviders(json.readStringList(rs.getString("preferred_providers")))
            .preferredVolatility(rs.getDouble("preferred_volatility"))
            .preferredRtp(rs.getDouble("preferred_rtp"))
            .playStyle(rs.getString("play_style"))
            .winRate(rs.getDouble("win_rate"))
            .consecutiveLosses(rs.getInt("consecutive_losses"))
            .newPlayer(rs.getBoolean("is_new_player"))
            .customFeatures(json.readDoubleMap(rs.getString("custom_features")))
            .build();
    }

    @Override
    protected String tableName() {
        return "player_features";
    }

    @Override
    protected String idColumn() {
        return "player_id";
    }

    @Override
    protected RowMapper<PlayerFeatures> rowMapper() {
        return mapper;
    }
}
