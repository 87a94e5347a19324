package net.gaiming.support.result;

/**
 * Machine-readable failure categories carried by {@link Result}.
 */
public enum ErrorCode {
    /** A referenced player, game, recommendation or metric set does not exist. */
    NOT_FOUND,
    /** No handler is registered for the dispatched request type. */
    NO_HANDLER,
    /** The request is malformed or refers to an entity in an unusable state. */
    VALIDATION,
    /** The operation is not allowed in the current lifecycle state. */
    INVALID_STATE,
    /** A concurrent writer changed the same aggregate, or a unique key was violated. */
    CONFLICT,
    /** Infrastructure hiccup that a retry may resolve. */
    TRANSIENT,
    /** The caller-supplied deadline expired. */
    CANCELLED,
    /** A pipeline step failed without recovering. */
    STEP_FAILED,
    /** A programming or wiring error surfaced at a boundary. */
    UNEXPECTED
}
