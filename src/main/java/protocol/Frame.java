package protocol;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Represents one protocol frame, decoded from or to be encoded into a single WebSocket text message.
 * Can be one of six types, see {@link FrameType}.
 * <p>
 * Depending on the type, a frame carries:
 * <p> OPEN: the {@link SessionInfo}.
 * <br> NAMESPACE_ACK: an optional session id (null when absent or unparsable).
 * <br> EVENT: the event name and its JSON object payload.
 * <br> UNKNOWN: only the raw text.
 * <p>
 * Frames are immutable. Payloads are copied on the way in and out.
 */
public class Frame {

    public static final Frame PING = new Frame(FrameType.PING, "2", null, null, null, null);
    public static final Frame PONG = new Frame(FrameType.PONG, "3", null, null, null, null);
    /**
     * The outbound namespace join request. It shares its encoding ({@code 40}) with an inbound acknowledgement.
     */
    public static final Frame NAMESPACE_REQUEST = new Frame(FrameType.NAMESPACE_ACK, "40", null, null, null, null);

    private final FrameType type;
    private final String raw;
    private final SessionInfo sessionInfo;
    private final String sessionId;
    private final String eventName;
    private final String payload;

    private Frame(FrameType type, String raw, SessionInfo sessionInfo, String sessionId, String eventName, String payload) {
        this.type = type;
        this.raw = raw;
        this.sessionInfo = sessionInfo;
        this.sessionId = sessionId;
        this.eventName = eventName;
        this.payload = payload;
    }

    public static Frame open(String raw, SessionInfo sessionInfo) {
        return new Frame(FrameType.OPEN, raw, sessionInfo, sessionInfo.getSessionId(), null, null);
    }

    public static Frame namespaceAck(String raw, String sessionId) {
        return new Frame(FrameType.NAMESPACE_ACK, raw, null, sessionId, null, null);
    }

    public static Frame event(String eventName, JSONObject payload) {
        return event(null, eventName, payload);
    }

    static Frame event(String raw, String eventName, JSONObject payload) {
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(payload, "payload");
        return new Frame(FrameType.EVENT, raw, null, null, eventName, payload.toString());
    }

    public static Frame unknown(String raw) {
        return new Frame(FrameType.UNKNOWN, raw, null, null, null, null);
    }

    public FrameType getType() {
        return type;
    }

    /**
     * @return The text this frame was decoded from, or null for frames built locally.
     */
    public String getRaw() {
        return raw;
    }

    public SessionInfo getSessionInfo() {
        return sessionInfo;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getEventName() {
        return eventName;
    }

    /**
     * @return A fresh copy of the event payload, or null if this isn't an event frame.
     */
    public JSONObject getPayload() {
        return payload == null ? null : new JSONObject(payload);
    }

    public boolean isEvent(String name) {
        return type == FrameType.EVENT && name.equals(eventName);
    }

    @Override
    public String toString() {
        switch (type) {
            case EVENT:
                return "Frame{type=EVENT, name=" + eventName + ", payload=" + payload + '}';
            case OPEN:
                return "Frame{type=OPEN, sessionInfo=" + sessionInfo + '}';
            case NAMESPACE_ACK:
                return "Frame{type=NAMESPACE_ACK, sessionId=" + sessionId + '}';
            default:
                return "Frame{type=" + type + ", raw=" + raw + '}';
        }
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj)
            return true;

        if(!(obj instanceof Frame))
            return false;

        Frame frame = (Frame) obj;
        if(type != frame.type)
            return false;

        switch (type) {
            case EVENT:
                return eventName.equals(frame.eventName) && new JSONObject(payload).similar(new JSONObject(frame.payload));
            case NAMESPACE_ACK:
                return Objects.equals(sessionId, frame.sessionId);
            case OPEN:
                return Objects.equals(raw, frame.raw);
            case UNKNOWN:
                return Objects.equals(raw, frame.raw);
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, eventName, sessionId);
    }
}
