package net.gaiming.adapters.persistence;

import net.gaiming.domain.model.Player;
import net.gaiming.domain.repository.PlayerRepository;
import org.springframework.jdbc.core.RowMapper;

/**
 * Reads the {@code players} table maintained by the account system.
 */
class JdbcPlayerRepository extends AbstractJdbcRepository<Player> implements PlayerRepository {

    private static final RowMapper<Player> PLAYER_MAPPER = (rs, rowNum) -> new Player(
        rs.getLong("id"),
        rs.getString("username"),
        rs.getBoolean("is_active"),
        rs.getString("country"),
        rs.getInt("vip_level"),
        ResultSetSupport.getInstant(rs, "registered_at")
    );

    JdbcPlayerRepository(JdbcRepositoryContext context) {
        super(context);
    }

    @Override
    protected String tableName() {
        return "players";
    }

    @Override
    protected String idColumn() {
        return "id";
    }

    @Override
    protected RowMapper<Player> rowMapper() {
        return PLAYER_MAPPER;
    }
}
