package io.concourse.driver;

import io.concourse.driver.dispatch.DispatchExecutor;
import io.concourse.driver.dispatch.OperationDescriptor;
import io.concourse.driver.dispatch.OperationDispatchTable;
import io.concourse.driver.resolve.ArgumentResolver;
import io.concourse.driver.resolve.CallArguments;
import io.concourse.driver.resolve.OperationFamily;
import io.concourse.driver.resolve.ResolvedCall;
import io.concourse.driver.transaction.TransactionContext;
import io.concourse.driver.transaction.TransactionState;
import io.concourse.driver.transport.Credential;
import io.concourse.driver.transport.HttpRemoteOperationInvoker;
import io.concourse.driver.transport.HttpSessionHandshake;
import io.concourse.driver.transport.JsonValueCodec;
import io.concourse.driver.transport.RemoteOperationInvoker;
import io.concourse.driver.transport.SessionHandshake;
import io.concourse.driver.transport.TimestampResolver;
import io.concourse.driver.transport.ValueCodec;

import java.net.http.HttpClient;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for talking to Concourse Server. A client owns exactly one session: one credential, one
 * transaction context and one connection. Obtain it with {@link #connect(Config)} and release it with
 * {@link #close()}.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Logical operations ({@code get}, {@code select}, {@code audit}, {@code add}, {@code set}) take
 *       {@link CallArguments} in any supported shape. The arguments are resolved to one remote variant before the
 *       network is touched, so argument errors never cost a round trip.</li>
 *   <li>By default every write is durable as soon as the server acknowledges it. {@link #stage()} groups subsequent
 *       operations into one all-or-nothing transaction finished by {@link #commit()} or {@link #abort()}.</li>
 *   <li>Times are microseconds since the epoch, or natural-language phrases such as {@code "last month"} that the
 *       server resolves.</li>
 *   <li>A transport failure makes the connection unusable: every later call fails fast with
 *       {@link TransportException}.</li>
 * </ul>
 *
 * <p>
 * Staging transitions are serialized with in-flight calls, but a caller driving one client from several threads
 * must still coordinate multi-call transactions itself.
 * </p>
 */
public final class ConcourseClient implements TimestampResolver, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ConcourseClient.class.getName());

    private final Config config;
    private final SessionHandshake handshake;
    private final RemoteOperationInvoker invoker;
    private final Credential credential;
    private final ArgumentResolver resolver = new ArgumentResolver();
    private final OperationDispatchTable table = OperationDispatchTable.standard();
    private final TransactionContext transaction;
    private final DispatchExecutor executor;

    private final Object stateLock = new Object();
    private boolean closed;
    private boolean loggedOut;
    private TransportException brokenBy;

    private ConcourseClient(
        Config config,
        SessionHandshake handshake,
        RemoteOperationInvoker invoker,
        ValueCodec codec,
        Credential credential
    ) {
        this.config = config;
        this.handshake = handshake;
        this.invoker = invoker;
        this.credential = credential;
        this.transaction = new TransactionContext(invoker, credential, table);
        this.executor = new DispatchExecutor(invoker, codec, transaction, credential);
    }

    /**
     * Opens a session using the HTTP transport and JSON value codec.
     *
     * @throws AuthenticationException when the server rejects the configured username and password.
     * @throws TransportException      when the server cannot be reached.
     */
    public static ConcourseClient connect(Config config) throws ConcourseException {
        Objects.requireNonNull(config, "config");
        Config resolved = config.withDefaults();

        HttpClient httpClient = resolved.getHttpClient();
        ExecutorService ownedExecutor = null;
        if (httpClient == null) {
            ownedExecutor = Executors.newCachedThreadPool(runnable -> {
                Thread thread = new Thread(runnable, "concourse-driver-http");
                thread.setDaemon(true);
                return thread;
            });
            httpClient = HttpClient.newBuilder()
                .connectTimeout(resolved.getHttpTimeout())
                .executor(ownedExecutor)
                .build();
        }

        RemoteOperationInvoker invoker = new HttpRemoteOperationInvoker(
            httpClient,
            resolved.getBaseUrl(),
            resolved.getEnvironment(),
            resolved.getHttpTimeout(),
            ownedExecutor
        );
        SessionHandshake handshake = new HttpSessionHandshake(httpClient, resolved.getBaseUrl(), resolved.getHttpTimeout());
        return connect(resolved, handshake, invoker, new JsonValueCodec());
    }

    /**
     * Opens a session over caller-supplied collaborators. The client takes ownership of {@code invoker} and closes
     * it on {@link #close()}, or immediately when login fails.
     */
    public static ConcourseClient connect(
        Config config,
        SessionHandshake handshake,
        RemoteOperationInvoker invoker,
        ValueCodec codec
    ) throws ConcourseException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(handshake, "handshake");
        Objects.requireNonNull(invoker, "invoker");
        Objects.requireNonNull(codec, "codec");
        Config resolved = config.withDefaults();

        LOGGER.info(() -> String.format(Locale.ROOT,
            "[concourse-driver] connecting to %s (environment '%s')", resolved.getBaseUrl(), resolved.getEnvironment()));
        Credential credential;
        try {
            credential = handshake.login(resolved.getUsername(), resolved.getPassword(), resolved.getEnvironment());
        } catch (ConcourseException | RuntimeException ex) {
            invoker.close();
            throw ex;
        }
        return new ConcourseClient(resolved, handshake, invoker, codec, credential);
    }

    /**
     * Reads the most recently added value(s). Accepts a selector ({@code record}, {@code records} or
     * {@code criteria}), optionally {@code key} or {@code keys}, and optionally a {@code timestamp}.
     *
     * @return the value for a single key and record; otherwise nested maps keyed by record id and key.
     * @throws MissingRequiredArgumentsException when no selector is supplied.
     * @throws AmbiguousArgumentsException       when mutually exclusive arguments are supplied together.
     */
    public Object get(CallArguments arguments) throws ConcourseException {
        return dispatch(OperationFamily.GET, arguments);
    }

    public Object get(String key, long record) throws ConcourseException {
        return get(CallArguments.builder().key(key).record(record).build());
    }

    /**
     * Reads all values. Takes the same arguments as {@link #get(CallArguments)}.
     */
    public Object select(CallArguments arguments) throws ConcourseException {
        return dispatch(OperationFamily.SELECT, arguments);
    }

    public Object select(String criteria) throws ConcourseException {
        return select(CallArguments.builder().criteria(criteria).build());
    }

    public Object select(long record) throws ConcourseException {
        return select(CallArguments.builder().record(record).build());
    }

    /**
     * Describes the changes made to a record, or to one key in it, optionally between {@code start} and {@code end}.
     *
     * @return a map from change timestamp to a description of the change.
     */
    public Object audit(CallArguments arguments) throws ConcourseException {
        return dispatch(OperationFamily.AUDIT, arguments);
    }

    public Object audit(long record) throws ConcourseException {
        return audit(CallArguments.builder().record(record).build());
    }

    /**
     * Appends {@code value} to {@code key} in a new record, one record or several.
     *
     * @return the new record id when no record is given, whether the value was added for one record, or a map from
     * record id to that outcome.
     */
    public Object add(CallArguments arguments) throws ConcourseException {
        return dispatch(OperationFamily.ADD, arguments);
    }

    public Object add(String key, Object value) throws ConcourseException {
        return add(CallArguments.builder().key(key).value(value).build());
    }

    public Object add(String key, Object value, long record) throws ConcourseException {
        return add(CallArguments.builder().key(key).value(value).record(record).build());
    }

    /**
     * Atomically replaces every value of {@code key} with {@code value}.
     *
     * @return the new record id when no record is given, otherwise nothing.
     */
    public Object set(CallArguments arguments) throws ConcourseException {
        return dispatch(OperationFamily.SET, arguments);
    }

    public Object set(String key, Object value, long record) throws ConcourseException {
        return set(CallArguments.builder().key(key).value(value).record(record).build());
    }

    /**
     * @return the server's current time in microseconds since the epoch.
     */
    public long time() throws ConcourseException {
        return asLong(dispatch(OperationFamily.TIME, CallArguments.empty()), "time");
    }

    /**
     * @return the instant described by {@code phrase} (e.g. {@code "3 weeks ago"}) in microseconds since the epoch.
     */
    public long time(String phrase) throws ConcourseException {
        Objects.requireNonNull(phrase, "phrase");
        return asLong(dispatch(OperationFamily.TIME, CallArguments.builder().phrase(phrase).build()), "timePhrase");
    }

    @Override
    public long resolvePhrase(String phrase) throws ConcourseException {
        return time(phrase);
    }

    /**
     * Starts a transaction. Every later operation is staged until {@link #commit()} or {@link #abort()}.
     *
     * <pre>{@code
     * client.stage();
     * try {
     *     client.add("name", "Jeff Nelson", 1);
     *     client.commit();
     * } catch (TransactionConflictException ex) {
     *     client.abort();
     * }
     * }</pre>
     *
     * @throws IllegalStateTransitionException when a transaction is already staged.
     */
    public void stage() throws ConcourseException {
        ensureUsable();
        try {
            transaction.stage();
        } catch (TransportException ex) {
            markBroken(ex);
            throw ex;
        }
    }

    /**
     * Commits the staged transaction. The client is back in autocommit afterwards, even when this throws, including
     * when the connection is already closed or unusable.
     *
     * @return whether the server committed; {@code false} without a remote call when nothing is staged.
     * @throws TransactionConflictException when another session changed data the transaction used.
     */
    public boolean commit() throws ConcourseException {
        ensureUsableOrDiscard();
        try {
            return transaction.commit();
        } catch (TransportException ex) {
            markBroken(ex);
            throw ex;
        }
    }

    /**
     * Discards the staged transaction and returns to autocommit. Does nothing when nothing is staged. On a closed or
     * unusable connection the staged token is dropped locally before the {@link TransportException} is thrown.
     */
    public void abort() throws ConcourseException {
        ensureUsableOrDiscard();
        try {
            transaction.abort();
        } catch (TransportException ex) {
            markBroken(ex);
            throw ex;
        }
    }

    public TransactionState transactionState() {
        return transaction.state();
    }

    public String getServerEnvironment() throws ConcourseException {
        return String.valueOf(dispatch(OperationFamily.SERVER_ENVIRONMENT, CallArguments.empty()));
    }

    public String getServerVersion() throws ConcourseException {
        return String.valueOf(dispatch(OperationFamily.SERVER_VERSION, CallArguments.empty()));
    }

    /**
     * Ends the server session without releasing the connection. Mostly useful in tests.
     */
    public void logout() throws ConcourseException {
        ensureUsable();
        try {
            handshake.logout(credential, config.getEnvironment());
        } catch (TransportException ex) {
            markBroken(ex);
            throw ex;
        }
        synchronized (stateLock) {
            loggedOut = true;
        }
    }

    /**
     * Aborts a staged transaction, logs out when configured to, and releases the connection. Failures while tearing
     * down are logged, not thrown. Calling {@code close()} again has no effect.
     */
    @Override
    public void close() {
        boolean reachable;
        boolean shouldLogout;
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            closed = true;
            reachable = brokenBy == null;
            shouldLogout = reachable && config.isLogoutOnClose() && !loggedOut;
        }
        try {
            if (reachable) {
                try {
                    transaction.abort();
                } catch (ConcourseException ex) {
                    transaction.discard();
                    LOGGER.log(Level.WARNING, "[concourse-driver] abort on close failed", ex);
                }
            } else {
                transaction.discard();
            }
            if (shouldLogout) {
                try {
                    handshake.logout(credential, config.getEnvironment());
                } catch (ConcourseException ex) {
                    LOGGER.log(Level.WARNING, "[concourse-driver] logout on close failed", ex);
                }
            }
        } finally {
            invoker.close();
            LOGGER.info(() -> "[concourse-driver] connection to " + config.getBaseUrl() + " closed");
        }
    }

    public boolean isClosed() {
        synchronized (stateLock) {
            return closed;
        }
    }

    private Object dispatch(OperationFamily family, CallArguments arguments) throws ConcourseException {
        Objects.requireNonNull(arguments, "arguments");
        ResolvedCall call = resolver.resolve(family, arguments);
        OperationDescriptor descriptor = table.lookup(family, call.shape());
        ensureUsable();
        try {
            return executor.execute(descriptor, call.values());
        } catch (TransportException ex) {
            markBroken(ex);
            throw ex;
        }
    }

    private void ensureUsable() throws TransportException {
        synchronized (stateLock) {
            if (closed) {
                throw new TransportException("client is closed");
            }
            if (brokenBy != null) {
                throw new TransportException("connection is unusable after an earlier transport failure", brokenBy);
            }
        }
    }

    /**
     * Like {@link #ensureUsable()}, but first drops a staged token the server can no longer be asked about, so the
     * client still ends in autocommit.
     */
    private void ensureUsableOrDiscard() throws TransportException {
        try {
            ensureUsable();
        } catch (TransportException ex) {
            transaction.discard();
            throw ex;
        }
    }

    private void markBroken(TransportException cause) {
        synchronized (stateLock) {
            if (brokenBy == null) {
                brokenBy = cause;
            }
        }
        LOGGER.log(Level.WARNING, "[concourse-driver] connection marked unusable", cause);
    }

    private static long asLong(Object result, String operation) throws ConcourseException {
        if (result instanceof Number) {
            return ((Number) result).longValue();
        }
        throw new ConcourseException(operation + " returned a non-numeric result: " + result);
    }
}
