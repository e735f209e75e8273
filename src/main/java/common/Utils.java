package common;

import exceptions.SyncClientException;

import javax.net.ssl.SSLException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.MalformedURLException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.UnknownHostException;

/**
 * Static utility methods that are used through out the entire API.
 */
public class Utils {

    /**
     * Derives the WebSocket URL of the real-time endpoint from an HTTP base URL.
     * The scheme is rewritten ({@code http} to {@code ws}, {@code https} to {@code wss}),
     *  any trailing slash of the base is dropped and the handshake path is appended.
     * <p>
     * For example, "https://abc.com:5001" with "/socket.io/?EIO=4&amp;transport=websocket"
     *  becomes "wss://abc.com:5001/socket.io/?EIO=4&amp;transport=websocket".
     *
     * @param baseUrl The configured HTTP(S) base URL.
     * @param handshakePath Fixed path and query of the handshake.
     * @return The WebSocket URL.
     * @throws SyncClientException if the result is not a valid ws/wss URL.
     */
    public static String toWebSocketUrl(String baseUrl, String handshakePath) {
        if(baseUrl == null || baseUrl.trim().isEmpty())
            throw new SyncClientException("Invalid URL: base URL is empty.");

        String base = baseUrl.trim();
        if(base.startsWith("https://"))
            base = "wss://" + base.substring("https://".length());
        else if(base.startsWith("http://"))
            base = "ws://" + base.substring("http://".length());

        while(base.endsWith("/"))
            base = base.substring(0, base.length() - 1);

        String wsUrl = base + (handshakePath == null ? "" : handshakePath);
        try {
            URI uri = new URI(wsUrl);
            if(!"ws".equals(uri.getScheme()) && !"wss".equals(uri.getScheme()))
                throw new SyncClientException("Invalid URL: unsupported scheme in {" + baseUrl + "}.");
            if(uri.getHost() == null || uri.getHost().isEmpty())
                throw new SyncClientException("Invalid URL: no host in {" + baseUrl + "}.");
            return wsUrl;
        } catch (URISyntaxException e) {
            throw new SyncClientException("Invalid URL: can't parse {" + wsUrl + "}.", e);
        }
    }

    /**
     * Joins a base URL and a path, making sure there is exactly one slash between them.
     */
    public static String joinUrl(String baseUrl, String path) {
        String base = baseUrl;
        while(base.endsWith("/"))
            base = base.substring(0, base.length() - 1);
        if(path == null || path.isEmpty())
            return base;
        return base + (path.startsWith("/") ? path : "/" + path);
    }

    /**
     * Adds "http://" to a server address that has no scheme.
     */
    public static String normalizeServerUrl(String serverUrl) {
        String url = serverUrl == null ? "" : serverUrl.trim();
        if(!url.contains("://"))
            url = "http://" + url;
        return url;
    }

    /**
     * @return The explicit port of the URL, or the scheme's default (443 for https/wss, 80 otherwise).
     */
    public static int portOf(URL url) {
        if(url.getPort() != -1)
            return url.getPort();
        return "https".equals(url.getProtocol()) ? 443 : 80;
    }

    /**
     * Parses a server address, throwing a {@link SyncClientException} with a readable message if it isn't a valid URL.
     */
    public static URL parseUrl(String url) {
        try {
            URL parsed = new URL(url);
            if(parsed.getHost() == null || parsed.getHost().isEmpty())
                throw new SyncClientException("Invalid server URL: " + url + ". Please use format: http://192.168.68.50:5001");
            return parsed;
        } catch (MalformedURLException e) {
            throw new SyncClientException("Invalid server URL: " + url + ". Please use format: http://192.168.68.50:5001", e);
        }
    }

    /**
     * Turns a transport failure into a human readable, cause specific message that a UI can show as troubleshooting help.
     *
     * @param target The host (or host:port) that the connection was made to.
     * @param throwable The failure reported by the transport, may be null.
     * @param fallback Message to use if the throwable carries no useful information.
     * @return Non-empty description of the failure.
     */
    public static String describeTransportFailure(String target, Throwable throwable, String fallback) {
        if(throwable instanceof UnknownHostException)
            return "Host unreachable: can't resolve " + target + ".";
        if(throwable instanceof ConnectException)
            return "Connection refused by " + target + ". Is the server running on that port?";
        if(throwable instanceof NoRouteToHostException)
            return "Host unreachable: no route to " + target + ".";
        if(throwable instanceof SocketTimeoutException || throwable instanceof InterruptedIOException)
            return "Timed out connecting to " + target + ".";
        if(throwable instanceof SSLException)
            return "Secure connection failed: " + throwable.getMessage();

        if(throwable != null && throwable.getMessage() != null && !throwable.getMessage().isEmpty())
            return "Connection lost: " + throwable.getMessage();
        if(fallback != null && !fallback.isEmpty())
            return fallback;
        return "Connection lost.";
    }

    /**
     * Extracts "host:port" from a ws/wss/http/https URL for use in messages, falling back to the URL itself.
     */
    public static String hostAndPort(String url) {
        try {
            URI uri = new URI(url);
            if(uri.getHost() == null)
                return url;
            return uri.getHost() + (uri.getPort() != -1 ? ":" + uri.getPort() : "");
        } catch (URISyntaxException e) {
            return url;
        }
    }
}
