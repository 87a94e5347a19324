package net.gaiming.adapters.persistence;

import net.gaiming.domain.model.AbTestExperiment;
import net.gaiming.domain.model.ExperimentStatus;
import net.gaiming.domain.model.ExperimentVariant;
import net.gaiming.domain.repository.AbTestExperimentRepository;
import org.springframework.jdbc.core.RowMapper;
import tools.jackson.core.type.TypeReference;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static net.gaiming.adapters.persistence.ResultSetSupport.getInstant;
import static net.gaiming.adapters.persistence.ResultSetSupport.setNullableString;
import static net.gaiming.adapters.persistence.ResultSetSupport.setNullableTimestamp;
import static net.gaiming.adapters.persistence.ResultSetSupport.toTimestamp;

/**
 * Experiments with their variant list stored as a JSON column.
 */
class JdbcAbTestExperimentRepository extends AbstractJdbcEntityRepository<AbTestExperiment>
    implements AbTestExperimentRepository {

    private static final TypeReference<List<ExperimentVariant>> VARIANT_LIST = new TypeReference<>() { };

    private static final String INSERT_SQL = """
        INSERT INTO ab_test_experiments (
            experiment_name, description, status, start_date, end_date, target_contexts, variants,
            winning_variant, version, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String UPDATE_SQL = """
        UPDATE ab_test_experiments
        SET status = ?, start_date = ?, end_date = ?, winning_variant = ?, updated_at = ?, version = version + 1
        WHERE id = ? AND version = ?
        """;

    private final RowMapper<AbTestExperiment> mapper;

    JdbcAbTestExperimentRepository(JdbcRepositoryContext context) {
        super(context);
        JsonColumns json = context.json();
        this.mapper = (rs, rowNum) -> {
            AbTestExperiment experiment = new AbTestExperiment(
                rs.getString("experiment_name"),
                rs.getString("description"),
                json.readStringList(rs.getString("target_contexts")),
                json.read(rs.getString("variants"), VARIANT_LIST),
                getInstant(rs, "start_date"),
                getInstant(rs, "end_date"),
                getInstant(rs, "created_at"));
            experiment.restoreState(ExperimentStatus.valueOf(rs.getString("status")), rs.getString("winning_variant"));
            experiment.restore(rs.getLong("id"), rs.getLong("version"),
                getInstant(rs, "created_at"), getInstant(rs, "updated_at"));
            return experiment;
        };
    }

    @Override
    protected String tableName() {
        return "ab_test_experiments";
    }

    @Override
    protected RowMapper<AbTestExperiment> rowMapper() {
        return mapper;
    }

    @Override
    public Optional<AbTestExperiment> findByName(String name) {
        return query("experiment " + name,
            "SELECT * FROM ab_test_experiments WHERE experiment_name = ?", name).stream().findFirst();
    }

    @Override
    public List<AbTestExperiment> findRunning() {
        return query("running experiments",
            "SELECT * FROM ab_test_experiments WHERE status = ? ORDER BY start_date, id",
            ExperimentStatus.RUNNING.name());
    }

    @Override
    protected String insertSql() {
        return INSERT_SQL;
    }

    @Override
    protected void bindInsert(PreparedStatement ps, AbTestExperiment entity) throws SQLException {
        JsonColumns json = context.json();
        Instant createdAt = entity.getCreatedAt() != null ? entity.getCreatedAt() : now();
        ps.setString(1, entity.getName());
        ps.setString(2, entity.getDescription());
        ps.setString(3, entity.getStatus().name());
        ps.setTimestamp(4, toTimestamp(entity.getStartDate()));
        setNullableTimestamp(ps, 5, entity.getEndDate());
        ps.setString(6, json.write(entity.getTargetContexts()));
        ps.setString(7, json.write(entity.getVariants()));
        setNullableString(ps, 8, entity.getWinningVariant());
        ps.setLong(9, entity.getVersion());
        ps.setTimestamp(10, toTimestamp(createdAt));
        ps.setTimestamp(11, toTimestamp(entity.getUpdatedAt() != null ? entity.getUpdatedAt() : createdAt));
    }

    @Override
    protected String updateSql() {
        return UPDATE_SQL;
    }

    @Override
    protected int bindUpdate(PreparedStatement ps, AbTestExperiment entity) throws SQLException {
        ps.setString(1, entity.getStatus().name());
        ps.setTimestamp(2, toTimestamp(entity.getStartDate()));
        setNullableTimestamp(ps, 3, entity.getEndDate());
        setNullableString(ps, 4, entity.getWinningVariant());
        ps.setTimestamp(5, toTimestamp(entity.getUpdatedAt() != null ? entity.getUpdatedAt() : now()));
        return 6;
    }
}
