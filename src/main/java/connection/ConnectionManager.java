package connection;

import common.Observable;
import common.Utils;
import common.Worker;
import events.EventDispatcher;
import events.EventHandler;
import events.EventType;
import events.GameEvents;
import events.HandlerTable;
import exceptions.SyncClientException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import protocol.Frame;
import protocol.FrameCodec;
import protocol.FrameType;
import transport.Transport;

import java.util.concurrent.Future;

/**
 * Keeps one real-time connection to the game server.
 * <p> {@link #connect()} derives the WebSocket URL from {@code baseUrl}, opens a {@link Transport} and drives it through
 *      the handshake (see {@link HandshakeStateMachine}). Once the handshake is READY, the state becomes CONNECTED,
 *      {@code register_device} is sent, the {@link HeartbeatMonitor} starts and event frames are dispatched to the
 *      handlers registered with {@link #on(EventType, EventHandler)}.
 * <p> A transport failure, an abnormal close by the server or a handshake timeout moves the state to ERROR with a cause
 *      specific message and arms one reconnect attempt. A normal close (code 1000) moves the state to DISCONNECTED and
 *      arms the reconnect only if the connection had been established. {@link #disconnect()} cancels everything.
 * <p>
 * All state lives on the client's {@link Worker}. Socket reads, timers and public calls are serialized on it, and socket
 *  reads are one-shot: the next frame is read only after the current one has been handled.
 * <p>
 * Lifecycle events, emitted on the worker thread:
 * <p> {@link #STATE_CHANGED}, with the new {@link ConnectionState}.
 * <p> {@link #CONNECTED}, with the session id, once the handshake is complete.
 * <p> {@link #DISCONNECTED}, after {@link #disconnect()} or a normal close by the server.
 * <p> {@link #ERROR}, with the error message.
 * <p> {@link #PING}, {@link #PONG} and {@link #SERVER_PING}, for heartbeat traffic.
 * <p> {@link #DEGRADED}, with the number of consecutive heartbeat failures.
 * <p> {@link #RECONNECT_ATTEMPT}, with the attempt number, right before a scheduled reconnect runs.
 */
public class ConnectionManager extends Observable {

    private static final int NORMAL_CLOSURE = 1000;

    private final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final ClientConfig config;
    private final Worker worker;
    private final FrameCodec codec;
    private final HandshakeStateMachine handshake;
    private final HeartbeatMonitor heartbeat;
    private final ReconnectPolicy reconnectPolicy;
    private final HandlerTable handlerTable;
    private final EventDispatcher dispatcher;
    // Guards reads and writes of the state pair, so that observers never see half of a transition.
    private final Object stateLock = new Object();

    private volatile ConnectionState state;
    private Transport transport;
    private String url;
    private Future<?> handshakeTimeoutFuture;
    private volatile boolean shutdown;

    public ConnectionManager(ClientConfig config) {
        this(config, new Worker("ConnectionManager"));
    }

    public ConnectionManager(ClientConfig config, Worker worker) {
        if(config == null)
            config = new ClientConfig();
        config.validate();

        this.config = config;
        this.worker = worker;
        codec = new FrameCodec();
        handshake = new HandshakeStateMachine();
        heartbeat = new HeartbeatMonitor(worker, config, this::sendFrame);
        reconnectPolicy = new ReconnectPolicy(worker, config.reconnectDelayMs);
        handlerTable = new HandlerTable();
        dispatcher = new EventDispatcher(handlerTable);
        state = ConnectionState.DISCONNECTED;

        heartbeat.on(HeartbeatMonitor.PING, args -> emitEvent(PING, args))
                .on(HeartbeatMonitor.PONG, args -> emitEvent(PONG, args))
                .on(HeartbeatMonitor.SERVER_PING, args -> emitEvent(SERVER_PING, args))
                .on(HeartbeatMonitor.DEGRADED, args -> emitEvent(DEGRADED, args));
        handlerTable.register(GameEvents.ADMIN_DIAGNOSTIC_PING, this::answerDiagnosticPing);
    }

    /**
     * Start connecting. Does nothing while CONNECTING or CONNECTED.
     * If the URL can't be built, the state becomes ERROR right away.
     */
    public void connect() {
        checkNotShutdown();
        worker.runSync(this::doConnect);
    }

    /**
     * Close the connection and cancel every timer, including a pending reconnect.
     * Safe to call any number of times, from any thread, including from event callbacks.
     */
    public void disconnect() {
        if(worker.isShutdown() && !worker.isWorkerThread())
            return;
        worker.runSync(this::doDisconnect);
    }

    /**
     * Force the DISCONNECTED state because the server is known to be down, whatever the socket claims.
     */
    public void markServerUnavailable() {
        if(worker.isShutdown())
            return;
        worker.runSync(() -> {
            if(state.is(ConnectionState.Status.DISCONNECTED) && transport == null)
                return;
            logger.info("Server reported unavailable, dropping connection state {}", state);
            doDisconnect();
        });
    }

    /**
     * Disconnect and stop the worker. The instance can't be used afterwards.
     */
    public void shutdown() {
        if(shutdown)
            return;
        worker.runSync(() -> {
            doDisconnect();
            shutdown = true;
        });
        handlerTable.clear();
        removeAllListeners();
        worker.shutdown();
    }

    /**
     * Register a handler for an application event. Handlers run on the client's worker.
     *
     * @return Registration that removes the handler again.
     */
    public <T> HandlerTable.Registration on(EventType<T> eventType, EventHandler<T> handler) {
        return handlerTable.register(eventType, handler);
    }

    /**
     * Send an application event. Events are only written while CONNECTED, nothing is buffered.
     *
     * @return true if the event was handed to the socket.
     */
    public boolean emit(String eventName, JSONObject payload) {
        boolean[] sent = {false};
        if(!worker.isShutdown() || worker.isWorkerThread())
            worker.runSync(() -> sent[0] = sendEvent(eventName, payload));
        return sent[0];
    }

    /**
     * Send a client initiated heartbeat PING now.
     *
     * @return true if it was written.
     */
    public boolean sendPing() {
        boolean[] sent = {false};
        if(!worker.isShutdown() || worker.isWorkerThread())
            worker.runSync(() -> sent[0] = isConnected() && heartbeat.sendPing());
        return sent[0];
    }

    private void doConnect() {
        if(shutdown)
            return;
        if(state.is(ConnectionState.Status.CONNECTING) || state.is(ConnectionState.Status.CONNECTED)) {
            logger.debug("connect() ignored, already {}", state);
            return;
        }

        try {
            url = Utils.toWebSocketUrl(config.baseUrl, config.handshakePath);
        } catch (SyncClientException e) {
            logger.error("Can't connect: {}", e.getMessage());
            transition(ConnectionState.error(e.getMessage()), false);
            emitEvent(ERROR, e.getMessage());
            return;
        }

        reconnectPolicy.cancel();
        handshake.start();
        transition(ConnectionState.CONNECTING, false);
        logger.info("Connecting to {}", url);

        Transport current = config.transportFactory().create(url);
        transport = current;
        handshakeTimeoutFuture = worker.schedule(() -> onHandshakeTimeout(current), config.handshakeTimeoutMs);

        current.once(Transport.OPEN, args -> worker.execute(() -> onTransportOpen(current)))
                .once(Transport.ABRUPT_CLOSE, args -> worker.execute(() ->
                        onTransportFailure(current, (String) args[0], (Throwable) args[1])))
                .once(Transport.CLOSE, args -> worker.execute(() ->
                        onTransportClosed(current, (Integer) args[0], (String) args[1])));
        receiveNext(current);
        current.open();
    }

    /*
        One-shot read. The next read is issued only after the frame has been handled on the worker,
        so frames are processed strictly in arrival order and never interleaved.
     */
    private void receiveNext(Transport current) {
        current.receive(text -> worker.execute(() -> {
            if(current != transport)
                return;
            onFrameText(text);
            if(current == transport)
                receiveNext(current);
        }));
    }

    private void onTransportOpen(Transport current) {
        if(current != transport)
            return;
        logger.debug("Socket open to {}, waiting for session.", url);
    }

    private void onFrameText(String text) {
        logger.debug("Received: {}", text);
        Frame frame = codec.decode(text);
        FrameType type = frame.getType();

        if(type == FrameType.PING) {
            heartbeat.onServerPing();
            return;
        }
        if(type == FrameType.PONG) {
            heartbeat.onPong();
            return;
        }
        if(type == FrameType.UNKNOWN) {
            logger.debug("Discarded unknown frame: {}", text);
            return;
        }

        HandshakeStateMachine.Transition transition;
        synchronized (stateLock) {
            transition = handshake.onFrame(frame);
        }
        switch (transition) {
            case SEND_NAMESPACE_REQUEST:
                sendFrame(codec.encodeNamespaceRequest());
                return;
            case READY:
                onHandshakeComplete();
                return;
            default:
                break;
        }

        if(type == FrameType.EVENT) {
            if(handshake.isReady())
                dispatcher.dispatch(frame);
            else
                logger.debug("Dropping event '{}' received before the handshake completed.", frame.getEventName());
        }
    }

    private void onHandshakeComplete() {
        handshakeTimeoutFuture = cancel(handshakeTimeoutFuture);
        reconnectPolicy.reset();
        transition(ConnectionState.CONNECTED, false);
        logger.info("Connected to {} with session {}", url, handshake.getSessionId());
        emitEvent(CONNECTED, handshake.getSessionId());

        if(config.deviceUuid != null)
            sendEvent(GameEvents.REGISTER_DEVICE, GameEvents.registerDevice(config.deviceUuid));
        if(config.heartbeatEnabled)
            heartbeat.start();
    }

    private void onHandshakeTimeout(Transport current) {
        if(current != transport || handshake.isReady())
            return;
        handshakeTimeoutFuture = null;
        fail("Timed out waiting for server handshake after " + formatDuration(config.handshakeTimeoutMs)
                + " at " + Utils.hostAndPort(url) + ".");
    }

    private void onTransportFailure(Transport current, String message, Throwable throwable) {
        if(current != transport)
            return;
        fail(Utils.describeTransportFailure(Utils.hostAndPort(url), throwable, message));
    }

    private void onTransportClosed(Transport current, Integer code, String reason) {
        if(current != transport)
            return;
        String detail = reason == null || reason.isEmpty() ? "" : ": " + reason;
        if(code == null || code != NORMAL_CLOSURE) {
            fail("Server closed the connection (code " + code + detail + ").");
            return;
        }

        boolean wasConnected = state.is(ConnectionState.Status.CONNECTED);
        logger.info("Server closed the connection to {} normally{}", url, detail);
        teardown();
        transition(ConnectionState.DISCONNECTED, true);
        // Armed before DISCONNECTED is emitted, so a listener calling disconnect() cancels it.
        if(wasConnected)
            scheduleReconnect();
        emitEvent(DISCONNECTED);
    }

    /*
        Transport errors, abnormal closes by the server and handshake timeouts all end up here.
     */
    private void fail(String message) {
        logger.error("Connection to {} failed: {}", url, message);
        teardown();
        ConnectionState errorState = ConnectionState.error(message);
        transition(errorState, true);
        emitEvent(ERROR, message);

        // A listener may have disconnected or connected again in the meantime.
        if(state == errorState)
            scheduleReconnect();
    }

    private void scheduleReconnect() {
        if(!config.reconnect || shutdown)
            return;
        reconnectPolicy.schedule(attempt -> {
            emitEvent(RECONNECT_ATTEMPT, attempt);
            doConnect();
        });
    }

    private void doDisconnect() {
        reconnectPolicy.cancel();
        teardown();
        if(state.is(ConnectionState.Status.DISCONNECTED) && handshake.getState() == HandshakeState.NOT_STARTED)
            return;

        transition(ConnectionState.DISCONNECTED, true);
        logger.info("Disconnected from {}", url);
        emitEvent(DISCONNECTED);
    }

    // Cancel the connection's timers and close its socket. Doesn't touch the state.
    private void teardown() {
        handshakeTimeoutFuture = cancel(handshakeTimeoutFuture);
        heartbeat.stop();
        if(transport != null) {
            Transport closing = transport;
            transport = null;
            closing.close();
        }
    }

    private void transition(ConnectionState newState, boolean resetHandshake) {
        ConnectionState oldState;
        synchronized (stateLock) {
            oldState = state;
            if(resetHandshake)
                handshake.reset();
            state = newState;
        }
        if(!newState.equals(oldState)) {
            logger.debug("State {} -> {}", oldState, newState);
            emitEvent(STATE_CHANGED, newState);
        }
    }

    private boolean sendEvent(String eventName, JSONObject payload) {
        if(!isConnected()) {
            logger.debug("Not connected, event '{}' not sent.", eventName);
            return false;
        }
        return sendFrame(codec.encodeEvent(eventName, payload));
    }

    private boolean sendFrame(String encodedFrame) {
        Transport current = transport;
        if(current == null)
            return false;
        logger.debug("Sending: {}", encodedFrame);
        return current.send(encodedFrame);
    }

    private void answerDiagnosticPing(GameEvents.AdminDiagnosticPing ping) {
        logger.debug("Answering diagnostic ping {}", ping.getPingId());
        sendEvent(GameEvents.CLIENT_DIAGNOSTIC_PONG, GameEvents.clientDiagnosticPong(ping, System.currentTimeMillis()));
    }

    private static String formatDuration(long millis) {
        return millis % 1000 == 0 ? millis / 1000 + "s" : millis + "ms";
    }

    private static Future<?> cancel(Future<?> future) {
        if(future != null)
            future.cancel(false);
        return null;
    }

    private void checkNotShutdown() {
        if(shutdown || worker.isShutdown())
            throw new SyncClientException("Client is shut down. Create a new instance instead.");
    }

    public ConnectionState getState() {
        synchronized (stateLock) {
            return state;
        }
    }

    public HandshakeState getHandshakeState() {
        synchronized (stateLock) {
            return handshake.getState();
        }
    }

    public boolean isConnected() {
        return state.is(ConnectionState.Status.CONNECTED);
    }

    /**
     * @return Session id of the current connection, null until the server sent one.
     */
    public String getSessionId() {
        return handshake.getSessionId();
    }

    /**
     * @return A snapshot of the heartbeat bookkeeping.
     */
    public HeartbeatLedger getHeartbeatLedger() {
        HeartbeatLedger[] copy = {null};
        if(worker.isShutdown() && !worker.isWorkerThread())
            return heartbeat.getLedger().copy();
        worker.runSync(() -> copy[0] = heartbeat.getLedger().copy());
        return copy[0];
    }

    public boolean isReconnectScheduled() {
        boolean[] armed = {false};
        if(!worker.isShutdown() || worker.isWorkerThread())
            worker.runSync(() -> armed[0] = reconnectPolicy.isArmed());
        return armed[0];
    }

    /**
     * @return WebSocket URL of the last connection attempt, null before the first one.
     */
    public String getUrl() {
        return url;
    }

    public ClientConfig getConfig() {
        return config;
    }

    public Worker getWorker() {
        return worker;
    }

    public static final String STATE_CHANGED = "state_changed";
    public static final String CONNECTED = "connected";
    public static final String DISCONNECTED = "disconnected";
    public static final String ERROR = "error";
    public static final String PING = HeartbeatMonitor.PING;
    public static final String PONG = HeartbeatMonitor.PONG;
    public static final String SERVER_PING = HeartbeatMonitor.SERVER_PING;
    public static final String DEGRADED = HeartbeatMonitor.DEGRADED;
    public static final String RECONNECT_ATTEMPT = "reconnect_attempt";
}
