package net.gaiming.adapters.persistence;

import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Collaborators handed to every repository created inside one {@link JdbcUnitOfWork}.
 */
record JdbcRepositoryContext(JdbcTemplate jdbcTemplate, JsonColumns json, ChangeTracker changes, Clock clock) {
}
