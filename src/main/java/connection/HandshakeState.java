package connection;

public enum HandshakeState {

    NOT_STARTED, // No connection attempt in progress.
    AWAITING_SESSION, // Socket opened (or opening), waiting for the open frame.
    AWAITING_NAMESPACE_ACK, // Namespace join requested, waiting for the acknowledgement.
    READY; // Handshake complete, application events may flow.
}
