package net.gaiming.strategy;

/**
 * Which selection rule picked the strategy.
 */
public enum SelectionSource {
    OVERRIDE,
    EXPERIMENT,
    PLAYER_PROFILE,
    CONTEXT_DEFAULT,
    FALLBACK
}
