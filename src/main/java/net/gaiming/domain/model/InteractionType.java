package net.gaiming.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum InteractionType {
    VIEW,
    CLICK,
    PLAY,
    DISMISS,
    LIKE,
    DISLIKE;

    public static Optional<InteractionType> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
