package net.gaiming.pipeline;

import jakarta.annotation.Nullable;

import java.util.Objects;

/**
 * Typed handle for a {@link PipelineContext} property.
 *
 * <p>Keys created with {@link #of(String, Class)} check the stored value's type on read;
 * keys for parameterized types use {@link #named(String)} and rely on the writer.</p>
 */
public final class ContextKey<T> {

    private final String name;
    @Nullable
    private final Class<T> type;

    private ContextKey(String name, @Nullable Class<T> type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Context key name must not be blank");
        }
        this.name = name;
        this.type = type;
    }

    public static <T> ContextKey<T> of(String name, Class<T> type) {
        return new ContextKey<>(name, Objects.requireNonNull(type, "type"));
    }

    public static <T> ContextKey<T> named(String name) {
        return new ContextKey<>(name, null);
    }

    public String name() {
        return name;
    }

    @SuppressWarnings("unchecked")
    T cast(Object value) {
        if (type == null) {
            return (T) value;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Context property '" + name + "' holds "
                + value.getClass().getName() + ", expected " + type.getName());
        }
        return type.cast(value);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ContextKey<?> key && key.name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "ContextKey[" + name + "]";
    }
}
