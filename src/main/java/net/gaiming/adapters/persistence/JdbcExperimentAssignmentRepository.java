package net.gaiming.adapters.persistence;

import net.gaiming.domain.model.ExperimentAssignment;
import net.gaiming.domain.repository.ExperimentAssignmentRepository;
import org.springframework.jdbc.core.RowMapper;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Optional;

import static net.gaiming.adapters.persistence.ResultSetSupport.getInstant;
import static net.gaiming.adapters.persistence.ResultSetSupport.toTimestamp;

class JdbcExperimentAssignmentRepository extends AbstractJdbcEntityRepository<ExperimentAssignment>
    implements ExperimentAssignmentRepository {

    private static final RowMapper<ExperimentAssignment> ASSIGNMENT_MAPPER = (rs, rowNum) -> {
        ExperimentAssignment assignment = new ExperimentAssignment(
            rs.getLong("experiment_id"),
            rs.getLong("player_id"),
            rs.getString("variant_name"),
            getInstant(rs, "created_at"));
        assignment.restore(rs.getLong("id"), rs.getLong("version"),
            getInstant(rs, "created_at"), getInstant(rs, "updated_at"));
        return assignment;
    };

    JdbcExperimentAssignmentRepository(JdbcRepositoryContext context) {
        super(context);
    }

    @Override
    protected String tableName() {
        return "experiment_assignments";
    }

    @Override
    protected RowMapper<ExperimentAssignment> rowMapper() {
        return ASSIGNMENT_MAPPER;
    }

    @Override
    public Optional<ExperimentAssignment> findAssignment(long experimentId, long playerId) {
        return query("assignment of player " + playerId + " in experiment " + experimentId,
            "SELECT * FROM experiment_assignments WHERE experiment_id = ? AND player_id = ?",
            experimentId, playerId).stream().findFirst();
    }

    @Override
    protected String insertSql() {
        return """
            INSERT INTO experiment_assignments (experiment_id, player_id, variant_name, version, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
    }

    @Override
    protected void bindInsert(PreparedStatement ps, ExperimentAssignment entity) throws SQLException {
        ps.setLong(1, entity.getExperimentId());
        ps.setLong(2, entity.getPlayerId());
        ps.setString(3, entity.getVariantName());
        ps.setLong(4, entity.getVersion());
        ps.setTimestamp(5, toTimestamp(entity.getAssignedAt() != null ? entity.getAssignedAt() : now()));
        ps.setTimestamp(6, toTimestamp(entity.getAssignedAt() != null ? entity.getAssignedAt() : now()));
    }
}
