package net.gaiming.config;

import net.gaiming.adapters.persistence.JdbcUnitOfWorkFactory;
import net.gaiming.adapters.persistence.JsonColumns;
import net.gaiming.adapters.persistence.RepositoryBinding;
import net.gaiming.domain.event.DomainEventPublisher;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import tools.jackson.databind.json.JsonMapper;

import java.time.Clock;

/**
 * Unit of work plumbing over the auto-configured {@link JdbcTemplate} and transaction manager.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JsonColumns jsonColumns() {
        return new JsonColumns(JsonMapper.builder().build());
    }

    @Bean
    public UnitOfWorkFactory unitOfWorkFactory(JdbcTemplate jdbcTemplate,
                                               PlatformTransactionManager transactionManager,
                                               JsonColumns jsonColumns,
                                               DomainEventPublisher domainEventPublisher,
                                               Clock clock) {
        return new JdbcUnitOfWorkFactory(jdbcTemplate, transactionManager, jsonColumns, domainEventPublisher, clock,
            RepositoryBinding.defaults());
    }
}
