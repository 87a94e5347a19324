package net.gaiming.application.cqrs;

import jakarta.annotation.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Audit envelope attached to every command.
 *
 * @param userId   identity supplied by the caller, {@code null} for system-issued commands
 * @param userName display name for audit columns such as {@code updated_by}
 */
public record CommandMetadata(UUID commandId,
                              Instant issuedAt,
                              @Nullable String userId,
                              @Nullable String userName,
                              Map<String, String> attributes) {

    public static final String SYSTEM_USER = "system";

    public CommandMetadata {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(issuedAt, "issuedAt");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static CommandMetadata system(Clock clock) {
        return new CommandMetadata(UUID.randomUUID(), clock.instant(), null, SYSTEM_USER, Map.of());
    }

    public static CommandMetadata issuedBy(String userId, @Nullable String userName, Clock clock) {
        return new CommandMetadata(UUID.randomUUID(), clock.instant(), userId, userName, Map.of());
    }

    /**
     * Name written to audit columns; falls back to the user id, then to {@value #SYSTEM_USER}.
     */
    public String actor() {
        if (userName != null && !userName.isBlank()) {
            return userName;
        }
        return userId != null && !userId.isBlank() ? userId : SYSTEM_USER;
    }
}
