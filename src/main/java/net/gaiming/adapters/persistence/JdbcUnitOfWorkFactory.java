package net.gaiming.adapters.persistence;

import net.gaiming.domain.event.DomainEventPublisher;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates one {@link JdbcUnitOfWork} per logical operation. The binding table is fixed at
 * construction; a port bound twice is a configuration error.
 */
public class JdbcUnitOfWorkFactory implements UnitOfWorkFactory {

    private final JdbcTemplate jdbcTemplate;
    private final PlatformTransactionManager transactionManager;
    private final JsonColumns jsonColumns;
    private final DomainEventPublisher eventPublisher;
    private final Clock clock;
    private final Map<Class<?>, RepositoryBinding<?>> bindings;

    public JdbcUnitOfWorkFactory(JdbcTemplate jdbcTemplate,
                                 PlatformTransactionManager transactionManager,
                                 JsonColumns jsonColumns,
                                 DomainEventPublisher eventPublisher,
                                 Clock clock,
                                 Collection<RepositoryBinding<?>> bindings) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionManager = transactionManager;
        this.jsonColumns = jsonColumns;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        Map<Class<?>, RepositoryBinding<?>> byPort = new LinkedHashMap<>();
        for (RepositoryBinding<?> binding : bindings) {
            if (byPort.putIfAbsent(binding.portType(), binding) != null) {
                throw new IllegalArgumentException("Repository port bound twice: " + binding.portType().getName());
            }
        }
        this.bindings = Map.copyOf(byPort);
    }

    @Override
    public UnitOfWork create() {
        JdbcRepositoryContext context = new JdbcRepositoryContext(jdbcTemplate, jsonColumns, new ChangeTracker(), clock);
        return new JdbcUnitOfWork(transactionManager, eventPublisher, context, bindings);
    }
}
