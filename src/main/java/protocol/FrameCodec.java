package protocol;

import exceptions.FrameParserException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec for the text frames of the real-time connection.
 * <p> Each WebSocket message carries exactly one frame, so there is no payload/length framing to deal with.
 *      A frame is classified by its leading characters:
 * <p> - {@code 0{...}}: OPEN, followed by the session info JSON object.
 * <br>- {@code 2}: PING, a server initiated liveness probe.
 * <br>- {@code 3}: PONG, the answer to a PING we sent.
 * <br>- {@code 40} or {@code 40{...}}: NAMESPACE_ACK, optionally carrying {@code {"sid": "..."}}.
 * <br>- {@code 42[...]}: EVENT, a JSON array whose first element is the event name and second the payload object.
 * <br>- Anything else: UNKNOWN.
 * <p>
 * Decoding never throws. A frame that can't be understood, including an event frame with a malformed array,
 *  is returned as an UNKNOWN frame so that the connection keeps going.
 *
 * @see <a href="https://github.com/socketio/engine.io-protocol">Engine.IO protocol</a> for detailed information.
 */
public class FrameCodec {

    private final Logger logger = LoggerFactory.getLogger(FrameCodec.class);

    //Engine.IO protocol version used in the handshake query.
    public static final String ENGINE_IO_VERSION = "4";
    // Event name that legacy servers send instead of a namespace acknowledgement.
    public static final String LEGACY_CONNECTED_EVENT = "connected";

    private static final String OPEN_PREFIX = FrameType.OPEN.prefix + "{";
    private static final String NAMESPACE_ACK_WITH_DATA_PREFIX = FrameType.NAMESPACE_ACK.prefix + "{";
    private static final String EVENT_PREFIX = FrameType.EVENT.prefix + "[";

    /**
     * Decode a text frame.
     *
     * @param encodedFrame Text of one WebSocket message.
     * @return Decoded frame, never null.
     */
    public Frame decode(String encodedFrame) {
        if(encodedFrame == null || encodedFrame.isEmpty())
            return Frame.unknown(encodedFrame);

        try {
            if(encodedFrame.startsWith(OPEN_PREFIX))
                return Frame.open(encodedFrame, SessionInfo.parse(encodedFrame.substring(FrameType.OPEN.prefix.length())));

            if(FrameType.PING.prefix.equals(encodedFrame))
                return Frame.PING;

            if(FrameType.PONG.prefix.equals(encodedFrame))
                return Frame.PONG;

            if(FrameType.NAMESPACE_ACK.prefix.equals(encodedFrame))
                return Frame.namespaceAck(encodedFrame, null);

            if(encodedFrame.startsWith(NAMESPACE_ACK_WITH_DATA_PREFIX))
                return Frame.namespaceAck(encodedFrame, parseAckSessionId(encodedFrame));

            if(encodedFrame.startsWith(EVENT_PREFIX))
                return decodeEvent(encodedFrame);
        } catch (FrameParserException e) {
            logger.warn("Discarding malformed frame: {} ({})", encodedFrame, e.getMessage());
            return Frame.unknown(encodedFrame);
        }

        logger.debug("Unrecognized frame: {}", encodedFrame);
        return Frame.unknown(encodedFrame);
    }

    /*
        The session id in an acknowledgement is informational only.
        Failing to read it must not invalidate the acknowledgement itself.
     */
    private String parseAckSessionId(String encodedFrame) {
        try {
            JSONObject json = new JSONObject(encodedFrame.substring(FrameType.NAMESPACE_ACK.prefix.length()));
            return json.optString("sid", null);
        } catch (JSONException e) {
            logger.debug("Namespace acknowledgement carried unreadable data: {}", encodedFrame);
            return null;
        }
    }

    private Frame decodeEvent(String encodedFrame) {
        JSONArray array;
        try {
            array = new JSONArray(encodedFrame.substring(FrameType.EVENT.prefix.length()));
        } catch (JSONException e) {
            throw new FrameParserException("Event frame isn't a JSON array.", e);
        }

        if(array.length() < 2)
            throw new FrameParserException("Event frame needs a name and a payload, got " + array.length() + " element(s).");

        Object name = array.get(0);
        Object payload = array.get(1);
        if(!(name instanceof String))
            throw new FrameParserException("Event name isn't a string: " + name);
        if(!(payload instanceof JSONObject))
            throw new FrameParserException("Payload of event '" + name + "' isn't an object: " + payload);

        return Frame.event(encodedFrame, (String) name, (JSONObject) payload);
    }

    /**
     * Encode an outbound frame. Only PING, PONG, the namespace request and EVENT frames can be sent.
     *
     * @throws FrameParserException for frames that a client never sends.
     */
    public String encode(Frame frame) {
        switch (frame.getType()) {
            case PING:
            case PONG:
                return frame.getType().prefix;
            case NAMESPACE_ACK:
                return FrameType.NAMESPACE_ACK.prefix;
            case EVENT:
                return FrameType.EVENT.prefix + new JSONArray().put(frame.getEventName()).put(frame.getPayload());
            default:
                throw new FrameParserException("Can't encode a frame of type " + frame.getType() + ".");
        }
    }

    public String encodePing() {
        return encode(Frame.PING);
    }

    public String encodePong() {
        return encode(Frame.PONG);
    }

    public String encodeNamespaceRequest() {
        return encode(Frame.NAMESPACE_REQUEST);
    }

    public String encodeEvent(String eventName, JSONObject payload) {
        return encode(Frame.event(eventName, payload));
    }
}
