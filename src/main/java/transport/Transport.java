package transport;

import common.Observable;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * A text-message socket to the real-time server.
 * <p>
 * Incoming messages are consumed with one-shot reads: {@link #receive(ReceiveCallback)} delivers exactly one message,
 *  and the consumer issues the next read once it is done with it. Messages that arrive while no read is pending are
 *  buffered in arrival order, so at most one message is ever being handled and none is skipped or reordered.
 * <p>
 * Lifecycle changes are emitted as events:
 * <p> {@link #OPEN}, emitted when the socket connection is established. No protocol frame has been exchanged yet.
 * <p> {@link #ABRUPT_CLOSE}, emitted with a message and the Throwable when the connection fails or is lost.
 * <p> {@link #CLOSE}, emitted with the close code and reason when the server closes the connection.
 * <p> A transport closed by {@link #close()} emits nothing.
 */
public abstract class Transport extends Observable {

    protected final String url;
    protected volatile State state;
    private final Queue<String> inbox;
    private ReceiveCallback pendingReceive;

    protected Transport(String url) {
        this.url = url;
        state = State.INITIAL;
        inbox = new ConcurrentLinkedQueue<>();
    }

    /**
     * Issue a one-shot read. The callback is called once, with the next message, possibly on another thread.
     * Only one read may be pending at a time.
     */
    public void receive(ReceiveCallback callback) {
        String message;
        synchronized (this) {
            message = inbox.poll();
            if(message == null) {
                pendingReceive = callback;
                return;
            }
        }
        callback.onMessage(message);
    }

    /**
     * Implementations call this for each text message, in the order they arrive.
     */
    protected void onIncoming(String text) {
        ReceiveCallback callback;
        synchronized (this) {
            callback = pendingReceive;
            if(callback == null) {
                inbox.offer(text);
                return;
            }
            pendingReceive = null;
        }
        callback.onMessage(text);
    }

    protected void clearPendingReads() {
        synchronized (this) {
            pendingReceive = null;
            inbox.clear();
        }
    }

    public String getUrl() {
        return url;
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    public boolean isClosed() {
        return state == State.CLOSED || state == State.ABRUPTLY_CLOSED;
    }

    /**
     * Start connecting. Completion is reported with the {@link #OPEN} or {@link #ABRUPT_CLOSE} event.
     */
    public abstract void open();

    /**
     * Write a text message.
     *
     * @return false if the message couldn't be queued for sending.
     */
    public abstract boolean send(String text);

    /**
     * Close the connection from the client side. Safe to call more than once. Removes all listeners.
     */
    public abstract void close();

    public static final String OPEN = "open";
    public static final String ABRUPT_CLOSE = "abrupt_close";
    public static final String CLOSE = "close";

    public enum State {
        INITIAL, OPENING, OPEN, CLOSED, ABRUPTLY_CLOSED
    }

    @FunctionalInterface
    public interface ReceiveCallback {

        void onMessage(String text);
    }
}
