package connection;

import exceptions.SyncClientException;
import okhttp3.OkHttpClient;
import protocol.FrameCodec;
import transport.TransportFactory;
import transport.WebSocketTransport;

import java.util.HashMap;
import java.util.Map;

/**
 * Configures the real-time client.
 * Available configurations are:
 * <p> {@code String baseUrl} HTTP(S) address of the game server. ("http://localhost:5000" by default)
 * <p> {@code String handshakePath} Path and query appended to the WebSocket URL. ("/socket.io/?EIO=4&amp;transport=websocket")
 * <p> {@code long handshakeTimeoutMs} How long {@code connect()} may take to complete the handshake. (30,000 ms)
 * <p> {@code boolean reconnect} Whether to retry once after a transport failure. (true)
 * <p> {@code long reconnectDelayMs} Delay of that retry. (5,000 ms)
 * <p> {@code boolean heartbeatEnabled} Whether the heartbeat monitor runs while connected. (true)
 * <p> {@code long heartbeatGracePeriodMs} Delay between the completed handshake and the first heartbeat timer. (2,000 ms)
 * <p> {@code long heartbeatCheckIntervalMs} Period of the staleness check. (60,000 ms)
 * <p> {@code long heartbeatStaleThresholdMs} Age after which the last server ping counts as stale. (60,000 ms)
 * <p> {@code int heartbeatFailureThreshold} Consecutive stale checks that mark the connection degraded. (3)
 * <p> {@code long clientPingIntervalMs} Period of client initiated pings, 0 disables them. (30,000 ms)
 * <p> {@code long healthPollIntervalMs} Period of the health poller. (10,000 ms)
 * <p> {@code String healthPath} Path of the HTTP health endpoint. ("/health")
 * <p> {@code String deviceUuid} Id sent with {@code register_device} after each handshake, null to skip it.
 * <p> {@code Map<String, String> headerMap} Headers for the WebSocket request.
 * <p> {@code OkHttpClient okHttpClient} OkHttp client used for WebSockets and HTTP requests.
 * <p> {@code TransportFactory transportFactory} Creates the socket of each attempt. (OkHttp WebSocket when null)
 */
public class ClientConfig implements Cloneable {

    public static final String DEFAULT_HANDSHAKE_PATH = "/socket.io/?EIO=" + FrameCodec.ENGINE_IO_VERSION + "&transport=websocket";

    public String baseUrl;
    public String handshakePath;
    public long handshakeTimeoutMs;
    public boolean reconnect;
    public long reconnectDelayMs;
    public boolean heartbeatEnabled;
    public long heartbeatGracePeriodMs;
    public long heartbeatCheckIntervalMs;
    public long heartbeatStaleThresholdMs;
    public int heartbeatFailureThreshold;
    public long clientPingIntervalMs;
    public long healthPollIntervalMs;
    public String healthPath;
    public String deviceUuid;
    public Map<String, String> headerMap;
    public OkHttpClient okHttpClient;
    public TransportFactory transportFactory;

    public ClientConfig() {
        baseUrl = "http://localhost:5000";
        handshakePath = DEFAULT_HANDSHAKE_PATH;
        handshakeTimeoutMs = 30_000;
        reconnect = true;
        reconnectDelayMs = 5_000;
        heartbeatEnabled = true;
        heartbeatGracePeriodMs = 2_000;
        heartbeatCheckIntervalMs = 60_000;
        heartbeatStaleThresholdMs = 60_000;
        heartbeatFailureThreshold = 3;
        clientPingIntervalMs = 30_000;
        healthPollIntervalMs = 10_000;
        healthPath = "/health";
        headerMap = new HashMap<>();
    }

    public ClientConfig(String baseUrl) {
        this();
        this.baseUrl = baseUrl;
    }

    /**
     * @throws SyncClientException if a value can't be used.
     */
    public void validate() {
        if(baseUrl == null || baseUrl.trim().isEmpty())
            throw new SyncClientException("baseUrl can't be null or empty.");
        if(handshakeTimeoutMs <= 0)
            throw new SyncClientException("handshakeTimeoutMs must be positive, was " + handshakeTimeoutMs);
        if(reconnectDelayMs < 0 || heartbeatGracePeriodMs < 0 || clientPingIntervalMs < 0)
            throw new SyncClientException("Delays can't be negative.");
        if(heartbeatEnabled && (heartbeatCheckIntervalMs <= 0 || heartbeatStaleThresholdMs <= 0 || heartbeatFailureThreshold <= 0))
            throw new SyncClientException("Heartbeat interval, threshold and failure threshold must be positive.");
        if(healthPollIntervalMs <= 0)
            throw new SyncClientException("healthPollIntervalMs must be positive, was " + healthPollIntervalMs);
    }

    public OkHttpClient okHttpClient() {
        if(okHttpClient == null)
            okHttpClient = new OkHttpClient();
        return okHttpClient;
    }

    public TransportFactory transportFactory() {
        if(transportFactory != null)
            return transportFactory;
        return WebSocketTransport.factory(okHttpClient(), headerMap);
    }

    @Override
    public ClientConfig clone() {
        try {
            ClientConfig copy = (ClientConfig) super.clone();
            copy.headerMap = new HashMap<>(headerMap);
            return copy;
        } catch (CloneNotSupportedException e) {
            throw new SyncClientException("Cloning of config object is not supported.", e);
        }
    }
}
