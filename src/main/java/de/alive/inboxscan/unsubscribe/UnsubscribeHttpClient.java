package de.alive.inboxscan.unsubscribe;

import de.alive.inboxscan.exception.UnsubscribeException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.time.Duration;

@Slf4j
public class UnsubscribeHttpClient {

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; inboxscan-unsubscriber)";

    private final OkHttpClient http;

    public UnsubscribeHttpClient(@NotNull Duration timeout) {
        this(new OkHttpClient.Builder()
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .followRedirects(false)
                .followSslRedirects(false)
                .build());
    }

    public UnsubscribeHttpClient(@NotNull OkHttpClient http) {
        this.http = http;
    }

    /**
     * @return the 2xx or 3xx status code of the response
     * @throws UnsubscribeException for any other status, or when no response arrived
     */
    public int get(@NotNull String url) throws UnsubscribeException {
        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .header("User-Agent", USER_AGENT)
                    .get()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new UnsubscribeException("Invalid URL: " + e.getMessage(), -1, false);
        }

        try (Response response = http.newCall(request).execute()) {
            int status = response.code();
            log.debug("GET {} -> {}", url, status);
            if (status >= 200 && status < 400) {
                return status;
            }
            throw UnsubscribeException.forStatus(status);
        } catch (IOException e) {
            throw new UnsubscribeException("Request failed: " + e.getMessage(), e);
        }
    }
}
