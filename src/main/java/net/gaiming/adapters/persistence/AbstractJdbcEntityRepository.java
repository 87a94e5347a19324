package net.gaiming.adapters.persistence;

import net.gaiming.domain.model.BaseEntity;
import net.gaiming.domain.repository.EntityRepository;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Write side for aggregates with a generated id and an optimistic {@code version} column.
 *
 * <p>{@link #add} and {@link #update} only register the entity with the unit of work's
 * change tracker. On flush, inserts read back the generated key and updates are guarded by
 * {@code WHERE id = ? AND version = ?}; a stale version surfaces as
 * {@link OptimisticLockingFailureException}.</p>
 */
abstract class AbstractJdbcEntityRepository<T extends BaseEntity> extends AbstractJdbcRepository<T>
    implements EntityRepository<T> {

    protected AbstractJdbcEntityRepository(JdbcRepositoryContext context) {
        super(context);
    }

    @Override
    protected String idColumn() {
        return "id";
    }

    @Override
    public void add(T entity) {
        context.changes().registerNew(entity, this::insert);
    }

    @Override
    public void update(T entity) {
        context.changes().registerDirty(entity, this::versionedUpdate);
    }

    protected abstract String insertSql();

    /**
     * Binds insert parameters in the column order of {@link #insertSql()}.
     */
    protected abstract void bindInsert(PreparedStatement ps, T entity) throws SQLException;

    /**
     * Update statement ending with {@code WHERE id = ? AND version = ?}; the two trailing
     * parameters are bound by the base class after {@link #bindUpdate} returns the next index.
     * Append-only aggregates return {@code null}.
     */
    protected String updateSql() {
        return null;
    }

    protected int bindUpdate(PreparedStatement ps, T entity) throws SQLException {
        return 1;
    }

    private int insert(T entity) {
        KeyHolder keys = new GeneratedKeyHolder();
        PreparedStatementCreator creator = connection -> {
            PreparedStatement ps = connection.prepareStatement(insertSql(), new String[] {"id"});
            bindInsert(ps, entity);
            return ps;
        };
        int rows = jdbcTemplate.update(creator, keys);
        Number generated = keys.getKey();
        if (generated == null) {
            throw new IllegalStateException("No generated key returned for " + tableName() + " insert");
        }
        entity.assignIdentity(generated.longValue());
        return rows;
    }

    private int versionedUpdate(T entity) {
        String sql = updateSql();
        if (sql == null) {
            throw new UnsupportedOperationException(tableName() + " rows are append-only");
        }
        long id = entity.getId();
        long expectedVersion = entity.getVersion();
        int rows = jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql);
            int next = bindUpdate(ps, entity);
            ps.setLong(next, id);
            ps.setLong(next + 1, expectedVersion);
            return ps;
        });
        if (rows == 0) {
            throw new OptimisticLockingFailureException(
                tableName() + " row " + id + " was changed concurrently (expected version " + expectedVersion + ")");
        }
        entity.advanceVersion();
        return rows;
    }

    protected Instant now() {
        return context.clock().instant();
    }
}
