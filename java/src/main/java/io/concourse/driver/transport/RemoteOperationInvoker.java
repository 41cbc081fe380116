package io.concourse.driver.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.concourse.driver.ConcourseException;
import io.concourse.driver.dispatch.OperationDescriptor;
import io.concourse.driver.transaction.TransactionToken;

import java.util.List;

/**
 * Contract for performing one remote call. Implementations must preserve the order of calls issued by a thread.
 */
public interface RemoteOperationInvoker extends AutoCloseable {

    /**
     * @param descriptor  the remote variant to call.
     * @param params      encoded parameters, in the order of {@link OperationDescriptor#parameters()}.
     * @param credential  the session credential.
     * @param transaction the staged transaction token, or {@code null} in autocommit mode.
     * @return the encoded result; a JSON null node when the variant returns nothing.
     */
    JsonNode invoke(OperationDescriptor descriptor, List<JsonNode> params, Credential credential, TransactionToken transaction)
        throws ConcourseException;

    /**
     * Releases connection resources. Further invocations fail.
     */
    @Override
    default void close() {
        // default no-op
    }
}
