package net.gaiming.application.cqrs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.util.List;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;
import org.junit.jupiter.api.Test;

class MediatorDispatcherTest {

    record Ping(String text) implements Query<String> {
    }

    record Unhandled() implements Query<String> {
    }

    record Rename(String name, CommandMetadata metadata) implements Command<Boolean> {
    }

    static final class PingHandler implements RequestHandler<Ping, String> {
        @Override
        public Class<Ping> requestType() {
            return Ping.class;
        }

        @Override
        public Result<String> handle(Ping request) {
            if ("boom".equals(request.text())) {
                throw new IllegalStateException("handler exploded");
            }
            if ("null".equals(request.text())) {
                return null;
            }
            return Result.success("pong:" + request.text());
        }
    }

    static final class RenameHandler implements RequestHandler<Rename, Boolean> {
        @Override
        public Class<Rename> requestType() {
            return Rename.class;
        }

        @Override
        public Result<Boolean> handle(Rename request) {
            if (request.name().isBlank()) {
                return Result.failure(ErrorCode.VALIDATION, "Name is required");
            }
            return Result.success(Boolean.TRUE);
        }
    }

    private final Dispatcher dispatcher =
        new MediatorDispatcher(HandlerRegistry.of(List.of(new PingHandler(), new RenameHandler())));

    @Test
    void should_RouteToRegisteredHandler_When_Dispatching() {
        assertThat(dispatcher.dispatch(new Ping("hi")).getValue()).isEqualTo("pong:hi");
        assertThat(dispatcher.dispatch(new Rename("x", CommandMetadata.system(Clock.systemUTC()))).getValue()).isTrue();
    }

    @Test
    void should_ReturnNoHandler_When_TypeNotRegistered() {
        Result<String> result = dispatcher.dispatch(new Unhandled());

        assertThat(result.getError().code()).isEqualTo(ErrorCode.NO_HANDLER);
        assertThat(result.getError().message()).isEqualTo("No handler registered for Unhandled");
    }

    @Test
    void should_ReturnValidation_When_RequestIsNull() {
        assertThat(dispatcher.dispatch(null).getError().code()).isEqualTo(ErrorCode.VALIDATION);
    }

    @Test
    void should_WrapException_When_HandlerThrows() {
        Result<String> result = dispatcher.dispatch(new Ping("boom"));

        assertThat(result.getError().code()).isEqualTo(ErrorCode.UNEXPECTED);
        assertThat(result.getError().message()).isEqualTo("Unexpected error handling Ping: handler exploded");
        assertThat(result.getError().cause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void should_ReturnUnexpected_When_HandlerReturnsNull() {
        assertThat(dispatcher.dispatch(new Ping("null")).getError().code()).isEqualTo(ErrorCode.UNEXPECTED);
    }

    @Test
    void should_PassThroughHandlerFailure_When_HandlerRejects() {
        Result<Boolean> result = dispatcher.dispatch(new Rename(" ", CommandMetadata.system(Clock.systemUTC())));

        assertThat(result.getError().code()).isEqualTo(ErrorCode.VALIDATION);
    }

    @Test
    void should_RejectDuplicateHandlers_When_BuildingRegistry() {
        assertThatThrownBy(() -> HandlerRegistry.of(List.of(new PingHandler(), new PingHandler())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Duplicate handler for Ping");
    }

    @Test
    void should_ExposeRegisteredTypes_When_Built() {
        HandlerRegistry registry = HandlerRegistry.of(List.of(new PingHandler()));

        assertThat(registry.hasHandler(Ping.class)).isTrue();
        assertThat(registry.hasHandler(Rename.class)).isFalse();
        assertThat(registry.requestTypes()).containsExactly(Ping.class);
    }

    @Test
    void should_PreferUserName_When_ResolvingActor() {
        Clock clock = Clock.systemUTC();

        assertThat(CommandMetadata.issuedBy("u-1", "alice", clock).actor()).isEqualTo("alice");
        assertThat(CommandMetadata.issuedBy("u-1", null, clock).actor()).isEqualTo("u-1");
        assertThat(CommandMetadata.system(clock).actor()).isEqualTo(CommandMetadata.SYSTEM_USER);
    }
}
