package connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import protocol.Frame;
import protocol.FrameCodec;
import protocol.FrameType;

/**
 * Recognizes the connection setup sequence:
 * <p> NOT_STARTED to AWAITING_SESSION, on {@link #start()}.
 * <br> AWAITING_SESSION to AWAITING_NAMESPACE_ACK, on an open frame. The caller must then send the namespace request.
 * <br> AWAITING_NAMESPACE_ACK to READY, on a namespace acknowledgement, or on the legacy {@code connected} event
 *      that older servers send instead.
 * <p> READY holds until {@link #reset()}.
 * <p>
 * The machine only decides. Sending frames and changing the connection state is up to the caller,
 *  which lets diagnostics probes reuse the same recognition logic.
 */
public class HandshakeStateMachine {

    private final Logger logger = LoggerFactory.getLogger(HandshakeStateMachine.class);

    private volatile HandshakeState state = HandshakeState.NOT_STARTED;
    private volatile String sessionId;

    public void start() {
        state = HandshakeState.AWAITING_SESSION;
        sessionId = null;
    }

    public void reset() {
        state = HandshakeState.NOT_STARTED;
        sessionId = null;
    }

    /**
     * Feed a received frame into the machine.
     *
     * @return What the caller has to do as a consequence.
     */
    public Transition onFrame(Frame frame) {
        switch (state) {
            case AWAITING_SESSION:
                if(frame.getType() == FrameType.OPEN) {
                    sessionId = frame.getSessionId();
                    state = HandshakeState.AWAITING_NAMESPACE_ACK;
                    logger.debug("Session opened: {}", frame.getSessionInfo());
                    return Transition.SEND_NAMESPACE_REQUEST;
                }
                break;
            case AWAITING_NAMESPACE_ACK:
                if(frame.getType() == FrameType.NAMESPACE_ACK) {
                    if(frame.getSessionId() != null)
                        sessionId = frame.getSessionId();
                    state = HandshakeState.READY;
                    return Transition.READY;
                }
                if(frame.isEvent(FrameCodec.LEGACY_CONNECTED_EVENT)) {
                    logger.debug("Handshake completed by legacy '{}' event.", FrameCodec.LEGACY_CONNECTED_EVENT);
                    state = HandshakeState.READY;
                    return Transition.READY;
                }
                break;
            default:
                return Transition.NONE;
        }

        logger.debug("Ignoring {} while {}", frame, state);
        return Transition.NONE;
    }

    public HandshakeState getState() {
        return state;
    }

    public boolean isReady() {
        return state == HandshakeState.READY;
    }

    /**
     * @return Session id from the open frame, or from the acknowledgement if it carried one. Null before that.
     */
    public String getSessionId() {
        return sessionId;
    }

    public enum Transition {
        NONE, SEND_NAMESPACE_REQUEST, READY
    }
}
