package net.gaiming.adapters.persistence;

import net.gaiming.domain.model.StrategyMetricSample;
import net.gaiming.domain.repository.StrategyMetricRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Instant;
import java.util.List;

class JdbcStrategyMetricRepository implements StrategyMetricRepository {

    private static final RowMapper<StrategyMetricSample> SAMPLE_MAPPER = (rs, rowNum) -> new StrategyMetricSample(
        rs.getString("algorithm"),
        rs.getString("metric_name"),
        rs.getDouble("metric_value"),
        ResultSetSupport.getInstant(rs, "measured_at"),
        rs.getString("measurement_period")
    );

    private final JdbcTemplate jdbcTemplate;

    JdbcStrategyMetricRepository(JdbcRepositoryContext context) {
        this.jdbcTemplate = context.jdbcTemplate();
    }

    @Override
    public List<StrategyMetricSample> findByAlgorithm(String algorithm, Instant from, Instant to) {
        String sql = """
            SELECT algorithm, metric_name, metric_value, measured_at, measurement_period
            FROM strategy_metric_samples
            WHERE LOWER(algorithm) = LOWER(?)
              AND measured_at >= ?
              AND measured_at <= ?
            ORDER BY measured_at
            """;
        try {
            return jdbcTemplate.query(sql, SAMPLE_MAPPER,
                algorithm, ResultSetSupport.toTimestamp(from), ResultSetSupport.toTimestamp(to));
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load metric samples for algorithm " + algorithm, ex);
        }
    }
}
