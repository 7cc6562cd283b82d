package cinder.network;

/**
 * Lifecycle of one client connection.
 */
public enum ConnectionState {
    CONNECTING,
    READING_COMMAND,
    EXECUTING,
    WRITING_REPLY,
    CLOSING,
    CLOSED;

    public boolean canTransitionTo(ConnectionState next) {
        switch (this) {
            case CONNECTING:
                return next == READING_COMMAND || next == CLOSING;
            case READING_COMMAND:
                return next == EXECUTING || next == CLOSING;
            case EXECUTING:
                return next == WRITING_REPLY || next == CLOSING;
            case WRITING_REPLY:
                return next == READING_COMMAND || next == CLOSING;
            case CLOSING:
                return next == CLOSED;
            default:
                return false;
        }
    }
}
