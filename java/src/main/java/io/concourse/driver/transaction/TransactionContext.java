package io.concourse.driver.transaction;

import com.fasterxml.jackson.databind.JsonNode;
import io.concourse.driver.ConcourseException;
import io.concourse.driver.IllegalStateTransitionException;
import io.concourse.driver.dispatch.OperationDescriptor;
import io.concourse.driver.dispatch.OperationDispatchTable;
import io.concourse.driver.resolve.OperationFamily;
import io.concourse.driver.resolve.ShapeTag;
import io.concourse.driver.transport.Credential;
import io.concourse.driver.transport.RemoteOperationInvoker;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Autocommit/staged state machine of one client session.
 *
 * <p>
 * The context starts in {@link TransactionState#AUTOCOMMIT}. {@link #stage()} obtains a token from the server and
 * every call dispatched through {@link #withCurrentToken(TokenCall)} carries it until {@link #commit()} or
 * {@link #abort()} returns the context to autocommit. Transitions and dispatched calls share one lock, so a call
 * never observes a token that a concurrent transition is replacing.
 * </p>
 *
 * <p>
 * {@code commit()} and {@code abort()} always leave the context in autocommit, whatever the server answers. Both are
 * no-ops in autocommit: {@code commit()} then returns {@code false} without contacting the server.
 * </p>
 */
public final class TransactionContext {

    private static final Logger LOGGER = Logger.getLogger(TransactionContext.class.getName());

    private final RemoteOperationInvoker invoker;
    private final Credential credential;
    private final OperationDescriptor stageOperation;
    private final OperationDescriptor commitOperation;
    private final OperationDescriptor abortOperation;

    private final ReentrantLock lock = new ReentrantLock();
    private TransactionToken token;

    public TransactionContext(RemoteOperationInvoker invoker, Credential credential, OperationDispatchTable table) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.credential = Objects.requireNonNull(credential, "credential");
        Objects.requireNonNull(table, "table");
        this.stageOperation = table.lookup(OperationFamily.STAGE, ShapeTag.NONE);
        this.commitOperation = table.lookup(OperationFamily.COMMIT, ShapeTag.NONE);
        this.abortOperation = table.lookup(OperationFamily.ABORT, ShapeTag.NONE);
    }

    /**
     * Starts staging. On failure the exception propagates and the context stays in autocommit.
     *
     * @throws IllegalStateTransitionException when a transaction is already staged.
     */
    public void stage() throws ConcourseException {
        lock.lock();
        try {
            if (token != null) {
                throw new IllegalStateTransitionException("a transaction is already staged; commit or abort it first");
            }
            JsonNode result = invoker.invoke(stageOperation, List.of(), credential, null);
            token = new TransactionToken(tokenValue(result));
            LOGGER.info(() -> "[concourse-driver] transaction staged");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Commits the staged operations as one unit. The context returns to autocommit before the outcome is known, so a
     * {@link io.concourse.driver.TransactionConflictException} or transport failure still leaves it in autocommit.
     *
     * @return the server's verdict, or {@code false} when nothing was staged.
     */
    public boolean commit() throws ConcourseException {
        lock.lock();
        try {
            if (token == null) {
                LOGGER.fine(() -> "[concourse-driver] commit ignored: no staged transaction");
                return false;
            }
            TransactionToken staged = token;
            token = null;
            JsonNode result = invoker.invoke(commitOperation, List.of(), credential, staged);
            boolean committed = result == null || result.isNull() || result.isMissingNode() || result.asBoolean();
            LOGGER.info(() -> "[concourse-driver] transaction committed: " + committed);
            return committed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards the staged operations. A no-op in autocommit.
     */
    public void abort() throws ConcourseException {
        lock.lock();
        try {
            if (token == null) {
                return;
            }
            TransactionToken staged = token;
            token = null;
            invoker.invoke(abortOperation, List.of(), credential, staged);
            LOGGER.info(() -> "[concourse-driver] transaction aborted");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the staged token without telling the server. Used when the connection can no longer carry an abort.
     */
    public void discard() {
        lock.lock();
        try {
            if (token != null) {
                token = null;
                LOGGER.info(() -> "[concourse-driver] staged transaction discarded locally");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code call} with the current token (null in autocommit) while holding the transition lock.
     */
    public <T> T withCurrentToken(TokenCall<T> call) throws ConcourseException {
        Objects.requireNonNull(call, "call");
        lock.lock();
        try {
            return call.call(token);
        } finally {
            lock.unlock();
        }
    }

    public TransactionState state() {
        lock.lock();
        try {
            return token == null ? TransactionState.AUTOCOMMIT : TransactionState.STAGED;
        } finally {
            lock.unlock();
        }
    }

    public boolean isStaged() {
        return state() == TransactionState.STAGED;
    }

    public Optional<TransactionToken> currentToken() {
        lock.lock();
        try {
            return Optional.ofNullable(token);
        } finally {
            lock.unlock();
        }
    }

    private static String tokenValue(JsonNode result) throws ConcourseException {
        if (result == null || result.isNull() || result.isMissingNode()) {
            throw new ConcourseException("stage response missing transaction token");
        }
        String value = result.isTextual() ? result.asText() : result.toString();
        if (value.isBlank()) {
            throw new ConcourseException("stage response missing transaction token");
        }
        return value;
    }

    @FunctionalInterface
    public interface TokenCall<T> {
        T call(TransactionToken token) throws ConcourseException;
    }
}
