package protocol;

/**
 * Kinds of frames that travel over the real-time connection.
 * <p> OPEN ({@code 0{...}}), PING ({@code 2}), PONG ({@code 3}), NAMESPACE_ACK ({@code 40} / {@code 40{...}}),
 *      EVENT ({@code 42[name,payload]}) and UNKNOWN for anything else.
 * <p>
 * @see <a href="https://github.com/socketio/socket.io-protocol">Socket.IO Protocol</a> for detailed information.
 */
public enum FrameType {

    OPEN("0"), PING("2"), PONG("3"), NAMESPACE_ACK("40"), EVENT("42"), UNKNOWN("");

    final String prefix;

    FrameType(String prefix) {
        this.prefix = prefix;
    }

    // Leading characters of the encoded frame.
    public String prefix() {
        return prefix;
    }
}
