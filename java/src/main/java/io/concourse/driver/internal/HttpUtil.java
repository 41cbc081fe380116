package io.concourse.driver.internal;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Helper for issuing HTTP requests with JSON payloads.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    public static HttpResponse<InputStream> postJson(HttpClient client, String url, Object payload, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url));

        if (payload == null) {
            builder.POST(HttpRequest.BodyPublishers.noBody());
        } else {
            byte[] body = Json.mapper().writeValueAsBytes(payload);
            builder.POST(HttpRequest.BodyPublishers.ofByteArray(body));
            builder.header("Content-Type", "application/json");
        }

        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.timeout(timeout);
        }

        builder.header("Accept", "application/json");

        return client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    }
}
