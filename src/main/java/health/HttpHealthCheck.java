package health;

import common.Utils;
import okhttp3.Call;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * {@link HealthCheck} that GETs the server's health endpoint.
 * The server counts as healthy if it answers with a 2xx status and a JSON object body.
 */
public class HttpHealthCheck implements HealthCheck {

    private final Logger logger = LoggerFactory.getLogger(HttpHealthCheck.class);

    private final Call.Factory callFactory;
    private final String url;

    /**
     * @param callFactory OkHttp client (or any other call factory) to send the request with.
     * @param baseUrl HTTP(S) address of the server.
     * @param healthPath Path of the health endpoint, like "/health".
     */
    public HttpHealthCheck(Call.Factory callFactory, String baseUrl, String healthPath) {
        this.callFactory = callFactory;
        this.url = Utils.joinUrl(baseUrl, healthPath);
    }

    @Override
    public CompletableFuture<Boolean> check() {
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid health URL: {}", url);
            future.complete(false);
            return future;
        }

        logger.debug("Health check: GET {}", url);
        callFactory.newCall(request).enqueue(new okhttp3.Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                logger.debug("Health check of {} failed: {}", url, e.toString());
                future.complete(false);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody body = response.body()) {
                    if(!response.isSuccessful() || body == null) {
                        logger.debug("Health check of {} answered {}", url, response.code());
                        future.complete(false);
                        return;
                    }
                    new JSONObject(body.string());
                    future.complete(true);
                } catch (IOException | JSONException e) {
                    logger.debug("Health check of {} returned an unreadable body: {}", url, e.toString());
                    future.complete(false);
                }
            }
        });
        return future;
    }

    public String getUrl() {
        return url;
    }
}
