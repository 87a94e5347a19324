package net.gaiming.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import net.gaiming.domain.event.GameManagementSettingsUpdatedEvent;
import net.gaiming.domain.model.GameManagementSettings;
import net.gaiming.domain.model.GameSettingsOverrides;
import net.gaiming.domain.repository.GameManagementSettingsRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;
import net.gaiming.support.time.Deadline;
import net.gaiming.test.EmbeddedEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcUnitOfWorkTest {

    private EmbeddedEngine engine;

    @BeforeEach
    void setUp() {
        engine = new EmbeddedEngine();
        engine.game(1, 1, "slots", 0.5).game(2, 1, "slots", 0.5);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private GameManagementSettings hidden(long gameId) {
        GameManagementSettings settings = new GameManagementSettings(gameId, engine.clock().instant());
        settings.applyOverrides(GameSettingsOverrides.builder().hideInLobbyOverride(true).build(),
            engine.clock().instant(), "ops");
        return settings;
    }

    @Test
    void should_PersistAndAssignId_When_TransactionCommits() {
        GameManagementSettings settings = hidden(1);
        try (UnitOfWork uow = engine.unitOfWorkFactory().create()) {
            Result<Long> saved = uow.executeInTransaction(() -> {
                uow.getRepository(GameManagementSettingsRepository.class).add(settings);
                return uow.saveChanges().map(rows -> settings.getId());
            });

            assertThat(saved.isSuccess()).isTrue();
            assertThat(saved.getValue()).isPositive();
        }
        assertThat(engine.countRows("game_management_settings")).isEqualTo(1);
    }

    @Test
    void should_DispatchEventsOnlyAfterSave_When_AggregateRaisedThem() {
        try (UnitOfWork uow = engine.unitOfWorkFactory().create()) {
            uow.getRepository(GameManagementSettingsRepository.class).add(hidden(1));
            uow.executeInTransaction(uow::saveChanges);
            assertThat(engine.events().published()).isEmpty();

            Result<Integer> dispatched = uow.saveChangesAndDispatchEvents();

            assertThat(dispatched.isSuccess()).isTrue();
        }
        List<GameManagementSettingsUpdatedEvent> events =
            engine.events().eventsOfType(GameManagementSettingsUpdatedEvent.class);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).gameId()).isEqualTo(1L);
    }

    @Test
    void should_DiscardRowsAndEvents_When_RolledBack() {
        try (UnitOfWork uow = engine.unitOfWorkFactory().create()) {
            assertThat(uow.beginTransaction().isSuccess()).isTrue();
            uow.getRepository(GameManagementSettingsRepository.class).add(hidden(1));
            assertThat(uow.saveChanges().getValue()).isEqualTo(1);

            uow.rollbackTransaction();
            uow.saveChangesAndDispatchEvents();
        }
        assertThat(engine.countRows("game_management_settings")).isZero();
        assertThat(engine.events().published()).isEmpty();
    }

    @Test
    void should_RollBack_When_OperationReturnsFailure() {
        try (UnitOfWork uow = engine.unitOfWorkFactory().create()) {
            Result<Void> outcome = uow.executeInTransaction(() -> {
                uow.getRepository(GameManagementSettingsRepository.class).add(hidden(1));
                uow.saveChanges();
                return Result.failure(ErrorCode.VALIDATION, "changed my mind");
            });

            assertThat(outcome.getError().code()).isEqualTo(ErrorCode.VALIDATION);
            assertThat(uow.hasActiveTransaction()).isFalse();
        }
        assertThat(engine.countRows("game_management_settings")).isZero();
    }

    @Test
    void should_RollBackAndReportDataAccess_When_OperationThrows() {
        try (UnitOfWork uow = engine.unitOfWorkFactory().create()) {
            Result<Void> outcome = uow.executeInTransaction(() -> {
                uow.getRepository(GameManagementSettingsRepository.class).add(hidden(2));
                uow.saveChanges();
                throw new IllegalStateException("boom");
            });

            assertThat(outcome.isFailure()).isTrue();
        }
        assertThat(engine.countRows("game_management_settings")).isZero();
    }

    @Test
    void should_RejectNestedBegin_When_TransactionAlreadyOpen() {
        try (UnitOfWork uow = engine.unitOfWorkFactory().create()) {
            uow.beginTransaction();

            Result<Void> nested = uow.beginTransaction();

            assertThat(nested.getError().code()).isEqualTo(ErrorCode.INVALID_STATE);
        }
    }

    @Test
    void should_Cancel_When_DeadlineAlreadyPassed() {
        Deadline expired = Deadline.after(Duration.ofSeconds(1), engine.clock());
        engine.clock().advance(Duration.ofSeconds(2));
        try (UnitOfWork uow = engine.unitOfWorkFactory().create()) {
            Result<Integer> outcome = uow.executeInTransaction(() -> Result.success(1), expired);

            assertThat(outcome.getError().code()).isEqualTo(ErrorCode.CANCELLED);
        }
    }

    @Test
    void should_ReportConflict_When_UniqueKeyViolated() {
        try (UnitOfWork uow = engine.unitOfWorkFactory().create()) {
            uow.getRepository(GameManagementSettingsRepository.class).add(hidden(1));
            uow.saveChanges();
        }
        try (UnitOfWork uow = engine.unitOfWorkFactory().create()) {
            uow.getRepository(GameManagementSettingsRepository.class).add(hidden(1));

            Result<Integer> duplicate = uow.saveChanges();

            assertThat(duplicate.getError().code()).isEqualTo(ErrorCode.CONFLICT);
        }
    }

    @Test
    void should_ReportConflict_When_RowChangedSinceRead() {
        try (UnitOfWork uow = engine.unitOfWorkFactory().create()) {
            uow.getRepository(GameManagementSettingsRepository.class).add(hidden(1));
            uow.saveChanges();
        }
        try (UnitOfWork first = engine.unitOfWorkFactory().create();
             UnitOfWork second = engine.unitOfWorkFactory().create()) {
            GameManagementSettingsRepository firstRepository = first.getRepository(GameManagementSettingsRepository.class);
            GameManagementSettingsRepository secondRepository =
                second.getRepository(GameManagementSettingsRepository.class);
            GameManagementSettings mine = firstRepository.findByGameId(1).orElseThrow();
            GameManagementSettings theirs = secondRepository.findByGameId(1).orElseThrow();

            mine.applyOverrides(GameSettingsOverrides.builder().featured(true).build(), engine.clock().instant(), "a");
            firstRepository.update(mine);
            assertThat(first.saveChanges().isSuccess()).isTrue();

            theirs.applyOverrides(GameSettingsOverrides.builder().featured(false).build(), engine.clock().instant(), "b");
            secondRepository.update(theirs);
            Result<Integer> stale = second.saveChanges();

            assertThat(stale.getError().code()).isEqualTo(ErrorCode.CONFLICT);
        }
        Integer version = engine.jdbcTemplate()
            .queryForObject("SELECT version FROM game_management_settings WHERE game_id = 1", Integer.class);
        assertThat(version).isEqualTo(1);
    }

    @Test
    void should_Throw_When_RepositoryTypeNotRegistered() {
        try (UnitOfWork uow = engine.unitOfWorkFactory().create()) {
            assertThatThrownBy(() -> uow.getRepository(Runnable.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No repository registered");
        }
    }
}
