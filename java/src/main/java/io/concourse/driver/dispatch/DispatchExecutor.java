package io.concourse.driver.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.concourse.driver.ConcourseException;
import io.concourse.driver.internal.Json;
import io.concourse.driver.resolve.Slot;
import io.concourse.driver.transaction.TransactionContext;
import io.concourse.driver.transport.Credential;
import io.concourse.driver.transport.RemoteOperationInvoker;
import io.concourse.driver.transport.ValueCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Seam between resolution and transport: orders the normalized values of a call by its descriptor, encodes them,
 * attaches the session credential and current transaction token, and decodes what comes back.
 *
 * <p>
 * Stored values ({@link Slot#VALUE}) go through the {@link ValueCodec}; keys, records, criteria and times are plain
 * JSON.
 * </p>
 */
public final class DispatchExecutor {

    private static final Logger LOGGER = Logger.getLogger(DispatchExecutor.class.getName());

    private final RemoteOperationInvoker invoker;
    private final ValueCodec codec;
    private final TransactionContext transaction;
    private final Credential credential;

    public DispatchExecutor(RemoteOperationInvoker invoker, ValueCodec codec, TransactionContext transaction, Credential credential) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.transaction = Objects.requireNonNull(transaction, "transaction");
        this.credential = Objects.requireNonNull(credential, "credential");
    }

    public Object execute(OperationDescriptor descriptor, Map<Slot, Object> values) throws ConcourseException {
        Objects.requireNonNull(descriptor, "descriptor");
        List<JsonNode> params = encode(descriptor, values == null ? Map.of() : values);
        LOGGER.fine(() -> "[concourse-driver] dispatching " + descriptor.name());
        JsonNode result = transaction.withCurrentToken(token -> invoker.invoke(descriptor, params, credential, token));
        return codec.decode(result);
    }

    private List<JsonNode> encode(OperationDescriptor descriptor, Map<Slot, Object> values) {
        List<JsonNode> params = new ArrayList<>(descriptor.parameters().size());
        for (Slot slot : descriptor.parameters()) {
            if (!values.containsKey(slot)) {
                throw new IllegalArgumentException(descriptor.name() + " is missing a value for " + slot);
            }
            Object value = values.get(slot);
            params.add(slot == Slot.VALUE ? codec.encode(value) : Json.mapper().valueToTree(value));
        }
        return params;
    }
}
