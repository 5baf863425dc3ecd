package me.golemcore.relay.domain.model;

/**
 * Lifecycle of a debounce timer. {@link #FIRED} and {@link #CANCELLED} are
 * terminal.
 */
public enum TimerState {

    /**
     * Waiting for the quiet period to elapse.
     */
    SCHEDULED,

    /**
     * The quiet period elapsed and the fire callback ran (or is running).
     */
    FIRED,

    /**
     * Retired before firing, by a merge or an explicit cancel.
     */
    CANCELLED
}
