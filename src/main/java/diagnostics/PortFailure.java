package diagnostics;

/**
 * A port of a multi-port scan that didn't complete the handshake.
 */
public class PortFailure {

    private final int port;
    private final String error;

    PortFailure(int port, String error) {
        this.port = port;
        this.error = error;
    }

    public int getPort() {
        return port;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "Port " + port + ": " + error;
    }
}
