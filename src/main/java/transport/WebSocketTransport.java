package transport;

import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okio.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;

/**
 * {@link Transport} backed by an OkHttp WebSocket.
 * OkHttp delivers the messages of one socket sequentially on its reader thread, which keeps the arrival order.
 */
public class WebSocketTransport extends Transport {

    private final Logger logger = LoggerFactory.getLogger(WebSocketTransport.class);

    // Normal closure, see RFC 6455 section 7.4.1.
    static final int NORMAL_CLOSURE = 1000;

    private final WebSocket.Factory webSocketFactory;
    private final Map<String, String> headerMap;
    private volatile WebSocket webSocket;

    public WebSocketTransport(String url, WebSocket.Factory webSocketFactory) {
        this(url, webSocketFactory, Collections.emptyMap());
    }

    public WebSocketTransport(String url, WebSocket.Factory webSocketFactory, Map<String, String> headerMap) {
        super(url);
        this.webSocketFactory = webSocketFactory;
        this.headerMap = headerMap;
    }

    /**
     * @return A factory that creates OkHttp WebSocket transports with the given headers.
     */
    public static TransportFactory factory(WebSocket.Factory webSocketFactory, Map<String, String> headerMap) {
        return url -> new WebSocketTransport(url, webSocketFactory, headerMap);
    }

    @Override
    public void open() {
        if(state != State.INITIAL)
            return;

        state = State.OPENING;
        Request.Builder requestBuilder = new Request.Builder().url(url);
        if(headerMap != null)
            headerMap.forEach(requestBuilder::addHeader);

        logger.debug("Opening WebSocket to {}", url);
        webSocket = webSocketFactory.newWebSocket(requestBuilder.build(), new WebSocketListener());
    }

    @Override
    public boolean send(String text) {
        WebSocket socket = webSocket;
        if(state != State.OPEN || socket == null) {
            logger.debug("Not sending {}, WebSocket isn't open.", text);
            return false;
        }
        logger.debug("Sending: {}", text);
        return socket.send(text);
    }

    @Override
    public void close() {
        if(isClosed())
            return;

        state = State.CLOSED;
        removeAllListeners();
        clearPendingReads();
        WebSocket socket = webSocket;
        if(socket != null && !socket.close(NORMAL_CLOSURE, null))
            socket.cancel();
    }

    private void closeAbruptly(String message, Throwable throwable) {
        if(isClosed())
            return;

        state = State.ABRUPTLY_CLOSED;
        emitEvent(ABRUPT_CLOSE, message, throwable);
        removeAllListeners();
    }

    private class WebSocketListener extends okhttp3.WebSocketListener {

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            if(state != State.OPENING)
                return;
            state = State.OPEN;
            emitEvent(OPEN);
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            if(!isClosed())
                onIncoming(text);
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            if(!isClosed())
                onIncoming(bytes.utf8());
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            if(isClosed())
                return;
            logger.error("WebSocket failure on {}. Response: {}", url, response, t);
            closeAbruptly(response != null ? "Unexpected response: " + response.code() : t.getMessage(), t);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(code, null);
            if(isClosed())
                return;
            logger.debug("Server is closing {} with code {} ({})", url, code, reason);
            state = State.CLOSED;
            emitEvent(CLOSE, code, reason);
            removeAllListeners();
        }
    }
}
