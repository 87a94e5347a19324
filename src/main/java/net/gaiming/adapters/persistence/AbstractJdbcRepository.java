package net.gaiming.adapters.persistence;

import net.gaiming.domain.repository.ReadOnlyRepository;
import net.gaiming.support.specification.Specification;
import net.gaiming.support.specification.SpecificationEvaluator;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read side shared by the JDBC repositories. Specifications are evaluated in memory over
 * the rows returned by {@link #candidateSql()}.
 */
abstract class AbstractJdbcRepository<T> implements ReadOnlyRepository<T, Long> {

    protected final JdbcRepositoryContext context;
    protected final JdbcTemplate jdbcTemplate;

    protected AbstractJdbcRepository(JdbcRepositoryContext context) {
        this.context = Objects.requireNonNull(context, "context");
        this.jdbcTemplate = context.jdbcTemplate();
    }

    protected abstract String tableName();

    protected abstract String idColumn();

    protected abstract RowMapper<T> rowMapper();

    protected String candidateSql() {
        return "SELECT * FROM " + tableName();
    }

    @Override
    public Optional<T> findById(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        String sql = "SELECT * FROM " + tableName() + " WHERE " + idColumn() + " = ?";
        try {
            return jdbcTemplate.query(sql, rowMapper(), id).stream().findFirst();
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load " + tableName() + " row " + id, ex);
        }
    }

    @Override
    public List<T> find(Specification<T> specification) {
        return SpecificationEvaluator.evaluate(loadCandidates(), specification);
    }

    @Override
    public long count(Specification<T> specification) {
        return SpecificationEvaluator.count(loadCandidates(), specification);
    }

    protected List<T> loadCandidates() {
        try {
            return jdbcTemplate.query(candidateSql(), rowMapper());
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load " + tableName() + " rows", ex);
        }
    }

    protected List<T> query(String description, String sql, Object... args) {
        try {
            return jdbcTemplate.query(sql, rowMapper(), args);
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load " + description, ex);
        }
    }
}
