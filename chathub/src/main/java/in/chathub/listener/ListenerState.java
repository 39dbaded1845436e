package in.chathub.listener;

/**
 * Lifecycle of {@link PgChangeListener}.
 *
 * CONNECTING -> LISTENING -> (connection lost) FAILED -> CONNECTING ...
 * STOPPED only before start() and after stop().
 */
public enum ListenerState {
    STOPPED,
    CONNECTING,
    LISTENING,
    FAILED
}
