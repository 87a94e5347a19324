package net.gaiming.pipeline;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import net.gaiming.support.time.Deadline;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-run state shared by the steps of one pipeline execution.
 *
 * <p>Properties live in a concurrent map; {@code null} values are not stored, setting one
 * removes the property.</p>
 */
@Getter
public class PipelineContext {

    private final String contextId;
    private final Instant createdAt;
    @Nullable
    private final String userId;
    private final String correlationId;
    private final Deadline deadline;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Object> properties = new ConcurrentHashMap<>();

    @Builder
    private PipelineContext(@Nullable String userId, @Nullable String correlationId,
                            @Nullable Deadline deadline, @Nullable Clock clock) {
        this.contextId = UUID.randomUUID().toString();
        this.createdAt = (clock != null ? clock : Clock.systemUTC()).instant();
        this.userId = userId;
        this.correlationId = correlationId != null ? correlationId : contextId;
        this.deadline = deadline != null ? deadline : Deadline.none();
    }

    public static PipelineContext create() {
        return builder().build();
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = properties.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public void set(String key, @Nullable Object value) {
        if (value == null) {
            properties.remove(key);
        } else {
            properties.put(key, value);
        }
    }

    public boolean has(String key) {
        return properties.containsKey(key);
    }

    public void remove(String key) {
        properties.remove(key);
    }

    public <T> Optional<T> get(ContextKey<T> key) {
        Object value = properties.get(key.name());
        return value == null ? Optional.empty() : Optional.of(key.cast(value));
    }

    public <T> void set(ContextKey<T> key, @Nullable T value) {
        set(key.name(), value);
    }

    public boolean has(ContextKey<?> key) {
        return has(key.name());
    }

    public void remove(ContextKey<?> key) {
        remove(key.name());
    }

    public <T> T getOrDefault(ContextKey<T> key, T defaultValue) {
        return get(key).orElse(defaultValue);
    }

    /**
     * @throws IllegalStateException when the property is absent
     */
    public <T> T require(ContextKey<T> key) {
        return get(key).orElseThrow(() -> new IllegalStateException(
            "Required context property '" + key.name() + "' is missing in context " + contextId));
    }

    public boolean isExpired() {
        return deadline.isExpired();
    }
}
