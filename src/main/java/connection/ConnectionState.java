package connection;

import java.util.Objects;

/**
 * State of a {@link ConnectionManager}: DISCONNECTED, CONNECTING, CONNECTED, or ERROR with a human readable message.
 * Instances are immutable. The three message-less states are singletons, errors are compared by status and message.
 */
public final class ConnectionState {

    public static final ConnectionState DISCONNECTED = new ConnectionState(Status.DISCONNECTED, null);
    public static final ConnectionState CONNECTING = new ConnectionState(Status.CONNECTING, null);
    public static final ConnectionState CONNECTED = new ConnectionState(Status.CONNECTED, null);

    private final Status status;
    private final String errorMessage;

    private ConnectionState(Status status, String errorMessage) {
        this.status = status;
        this.errorMessage = errorMessage;
    }

    /**
     * @param message Non-empty, cause specific description of what went wrong.
     */
    public static ConnectionState error(String message) {
        if(message == null || message.isEmpty())
            message = "Unknown error.";
        return new ConnectionState(Status.ERROR, message);
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return The error message, or null unless this is an ERROR state.
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean is(Status status) {
        return this.status == status;
    }

    public String getDisplayName() {
        switch (status) {
            case DISCONNECTED: return "Disconnected";
            case CONNECTING: return "Connecting...";
            case CONNECTED: return "Connected";
            default: return "Error: " + errorMessage;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj)
            return true;
        if(!(obj instanceof ConnectionState))
            return false;
        ConnectionState other = (ConnectionState) obj;
        return status == other.status && Objects.equals(errorMessage, other.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, errorMessage);
    }

    @Override
    public String toString() {
        return status == Status.ERROR ? "ERROR(" + errorMessage + ")" : status.name();
    }

    public enum Status {
        DISCONNECTED, CONNECTING, CONNECTED, ERROR
    }
}
