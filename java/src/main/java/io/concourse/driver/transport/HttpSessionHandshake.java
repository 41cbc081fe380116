package io.concourse.driver.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.concourse.driver.AuthenticationException;
import io.concourse.driver.ConcourseException;
import io.concourse.driver.TransportException;
import io.concourse.driver.internal.ApiErrorDecoder;
import io.concourse.driver.internal.HttpUtil;
import io.concourse.driver.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link SessionHandshake} against the {@code /login} and {@code /logout} endpoints.
 */
public final class HttpSessionHandshake implements SessionHandshake {

    private static final Logger LOGGER = Logger.getLogger(HttpSessionHandshake.class.getName());

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpSessionHandshake(HttpClient httpClient, String baseUrl, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Credential login(String username, String password, String environment) throws ConcourseException {
        HttpResponse<InputStream> response = post("/login", new LoginRequest(username, password, environment), "login");

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }
            JsonNode node = Json.mapper().readTree(bodyStream);
            String token = node.path("token").asText();
            if (token == null || token.isBlank()) {
                throw new AuthenticationException(response.statusCode(), "login response missing token");
            }
            LOGGER.info(() -> "[concourse-driver] logged in as " + username);
            return new Credential(token);
        } catch (IOException ex) {
            throw new TransportException("decode login response: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void logout(Credential credential, String environment) throws ConcourseException {
        Objects.requireNonNull(credential, "credential");
        HttpResponse<InputStream> response = post("/logout", new LogoutRequest(credential.token(), environment), "logout");

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }
        } catch (IOException ex) {
            throw new TransportException("decode logout response: " + ex.getMessage(), ex);
        }
    }

    private HttpResponse<InputStream> post(String path, Object body, String action) throws TransportException {
        try {
            return HttpUtil.postJson(httpClient, baseUrl + path, body, requestTimeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException(action + " interrupted", ex);
        } catch (IOException ex) {
            throw new TransportException(action + " request: " + ex.getMessage(), ex);
        }
    }

    private record LoginRequest(String username, String password, String environment) {
    }

    private record LogoutRequest(String credential, String environment) {
    }
}
