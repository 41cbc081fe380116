package io.concourse.driver.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.concourse.driver.ConcourseException;
import io.concourse.driver.TransportException;
import io.concourse.driver.dispatch.OperationDescriptor;
import io.concourse.driver.internal.ApiErrorDecoder;
import io.concourse.driver.internal.HttpUtil;
import io.concourse.driver.internal.Json;
import io.concourse.driver.transaction.TransactionToken;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/**
 * {@link RemoteOperationInvoker} speaking JSON over HTTP: each variant is a {@code POST} to
 * {@code {baseUrl}/rpc/{name}} and the server answers {@code {"result": ...}}.
 */
public final class HttpRemoteOperationInvoker implements RemoteOperationInvoker {

    private static final Logger LOGGER = Logger.getLogger(HttpRemoteOperationInvoker.class.getName());

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String environment;
    private final Duration requestTimeout;
    private final ExecutorService ownedExecutor;

    private volatile boolean closed;

    public HttpRemoteOperationInvoker(HttpClient httpClient, String baseUrl, String environment, Duration requestTimeout) {
        this(httpClient, baseUrl, environment, requestTimeout, null);
    }

    /**
     * @param ownedExecutor executor backing {@code httpClient} that this invoker shuts down on {@link #close()};
     *                      {@code null} when the client is managed by the caller.
     */
    public HttpRemoteOperationInvoker(
        HttpClient httpClient,
        String baseUrl,
        String environment,
        Duration requestTimeout,
        ExecutorService ownedExecutor
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.environment = environment == null ? "" : environment;
        this.requestTimeout = requestTimeout;
        this.ownedExecutor = ownedExecutor;
    }

    @Override
    public JsonNode invoke(OperationDescriptor descriptor, List<JsonNode> params, Credential credential, TransactionToken transaction)
        throws ConcourseException {
        Objects.requireNonNull(descriptor, "descriptor");
        if (closed) {
            throw new TransportException("connection is closed");
        }

        RpcRequest body = new RpcRequest(
            params == null ? List.of() : params,
            credential == null ? null : credential.token(),
            transaction == null ? null : transaction.value(),
            environment
        );

        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.postJson(httpClient, baseUrl + "/rpc/" + descriptor.name(), body, requestTimeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException(descriptor.name() + " interrupted", ex);
        } catch (IOException ex) {
            throw new TransportException(descriptor.name() + " request: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }
            byte[] bytes = bodyStream.readAllBytes();
            if (bytes.length == 0) {
                return NullNode.getInstance();
            }
            JsonNode result = Json.mapper().readTree(bytes).path("result");
            return result.isMissingNode() ? NullNode.getInstance() : result;
        } catch (IOException ex) {
            throw new TransportException("decode " + descriptor.name() + " response: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
            LOGGER.fine(() -> "[concourse-driver] released transport executor");
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private record RpcRequest(List<JsonNode> params, String credential, String transaction, String environment) {
    }
}
