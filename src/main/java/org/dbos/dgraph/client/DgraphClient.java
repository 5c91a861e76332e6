package org.dbos.dgraph.client;

import org.dbos.dgraph.api.Check;
import org.dbos.dgraph.api.LoginRequest;
import org.dbos.dgraph.api.Operation;
import org.dbos.dgraph.connection.CallOptions;
import org.dbos.dgraph.connection.DgraphConnection;
import org.dbos.dgraph.connection.RpcException;
import org.dbos.dgraph.connection.ZmqDgraphConnection;
import org.dbos.dgraph.result.Result;
import org.dbos.dgraph.result.TransportError;
import org.dbos.dgraph.transaction.DgraphTransaction;
import org.dbos.dgraph.transaction.Query;
import org.dbos.dgraph.transaction.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * DgraphClient holds a fixed set of connections to Dgraph alphas and creates transactions over them.
 * Calls are spread over the connections round-robin. Transport failures never escape as exceptions: every
 * operation completes with a {@link Result}. This class is thread-safe; the transactions it creates are not.
 */
public class DgraphClient implements DgraphExecutor, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DgraphClient.class);

    private final DgraphConnection[] dgraphs;
    private final boolean closeConnections;

    // Round-robin cursor. May repeat or skip an index under races, never leaves the range.
    private final AtomicInteger nextConnection = new AtomicInteger(0);
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    /**
     * Create a client over the given connections. The connections are not closed with the client.
     * @param connections   connections to Dgraph alphas, at least one.
     */
    public DgraphClient(DgraphConnection... connections) {
        this(connections, false);
    }

    /**
     * Create a client over the given connections.
     * @param connections       connections to Dgraph alphas, at least one.
     * @param closeConnections  if true, {@link #close()} also closes the connections.
     */
    public DgraphClient(DgraphConnection[] connections, boolean closeConnections) {
        if (connections == null) {
            throw new NullPointerException("connections");
        }
        if (connections.length == 0) {
            throw new IllegalArgumentException("At least one connection is required");
        }
        for (DgraphConnection c : connections) {
            if (c == null) {
                throw new IllegalArgumentException("Connections must not contain null");
            }
        }
        this.dgraphs = connections.clone();
        this.closeConnections = closeConnections;
    }

    /**
     * Create a client with one ZeroMQ connection per address. The client owns the connections.
     * @param addresses <code>host</code> or <code>host:port</code> of each alpha.
     * @return          a new {@link DgraphClient}.
     */
    public static DgraphClient connect(String... addresses) {
        if (addresses == null || addresses.length == 0) {
            throw new IllegalArgumentException("At least one address is required");
        }
        DgraphConnection[] connections = new DgraphConnection[addresses.length];
        int opened = 0;
        try {
            for (; opened < addresses.length; opened++) {
                connections[opened] = new ZmqDgraphConnection(addresses[opened]);
            }
        } catch (RuntimeException e) {
            for (int i = 0; i < opened; i++) {
                connections[i].close();
            }
            throw e;
        }
        return new DgraphClient(connections, true);
    }

    /** Transactions **/

    /**
     * Create a read-write transaction.
     * @return  a new {@link Transaction} in the OK state.
     */
    public Transaction newTransaction() {
        assertNotDisposed();
        return DgraphTransaction.readWrite(this);
    }

    /**
     * Create a read-only transaction.
     * @return  a new {@link Query} handle.
     */
    public Query newReadOnlyTransaction() {
        return newReadOnlyTransaction(false);
    }

    /**
     * Create a read-only transaction.
     * @param bestEffort    if true, the server may answer without a consensus read, trading consistency for latency.
     * @return              a new {@link Query} handle.
     */
    public Query newReadOnlyTransaction(boolean bestEffort) {
        assertNotDisposed();
        return DgraphTransaction.readOnly(this, bestEffort);
    }

    /** Administration **/

    public CompletableFuture<Result<Void>> alter(Operation op) {
        return alter(op, null);
    }

    /**
     * Alter the schema or drop data. The operation is passed through unchanged.
     * @param op        the operation.
     * @param options   per-call options, or <code>null</code>.
     * @return          ok, or a {@link TransportError}.
     */
    public CompletableFuture<Result<Void>> alter(Operation op, CallOptions options) {
        CallOptions opts = CallOptions.orDefault(options);
        return dgraphExecute(
                dg -> dg.alter(op, opts).thenApply(payload -> Result.ok()),
                rpcEx -> Result.fail(new TransportError(rpcEx)));
    }

    public CompletableFuture<Result<String>> checkVersion() {
        return checkVersion(null);
    }

    /**
     * Ask one alpha for its version.
     * @param options   per-call options, or <code>null</code>.
     * @return          the version tag, or a {@link TransportError}.
     */
    public CompletableFuture<Result<String>> checkVersion(CallOptions options) {
        CallOptions opts = CallOptions.orDefault(options);
        return dgraphExecute(
                dg -> dg.checkVersion(Check.getDefaultInstance(), opts).thenApply(v -> Result.ok(v.getTag())),
                rpcEx -> Result.fail(new TransportError(rpcEx)));
    }

    public CompletableFuture<Result<Void>> login(String userId, String password) {
        return login(LoginRequest.newBuilder().setUserid(userId).setPassword(password).build(), null);
    }

    public CompletableFuture<Result<Void>> loginIntoNamespace(String userId, String password, long namespace) {
        return login(LoginRequest.newBuilder()
                .setUserid(userId)
                .setPassword(password)
                .setNamespace(namespace)
                .build(), null);
    }

    public CompletableFuture<Result<Void>> login(LoginRequest request) {
        return login(request, null);
    }

    /**
     * Log in to the cluster. Credentials are passed through unchanged.
     * @param request   the login request.
     * @param options   per-call options, or <code>null</code>.
     * @return          ok, or a {@link TransportError}.
     */
    public CompletableFuture<Result<Void>> login(LoginRequest request, CallOptions options) {
        CallOptions opts = CallOptions.orDefault(options);
        return dgraphExecute(
                dg -> dg.login(request, opts).thenApply(response -> Result.ok()),
                rpcEx -> Result.fail(new TransportError(rpcEx)));
    }

    /** Execution **/

    @Override
    public <T> CompletableFuture<T> dgraphExecute(Function<DgraphConnection, CompletableFuture<T>> execute,
                                                  Function<RpcException, T> onFail) {
        if (disposed.get()) {
            return CompletableFuture.failedFuture(new ObjectDisposedException(getClass().getSimpleName()));
        }
        int index = getNextConnection();
        return execute.apply(dgraphs[index]).handle((value, ex) -> {
            if (ex == null) {
                return CompletableFuture.completedFuture(value);
            }
            Throwable cause = unwrap(ex);
            if (cause instanceof RpcException) {
                logger.debug("Call on connection {} failed: {}", index, cause.getMessage());
                return CompletableFuture.completedFuture(onFail.apply((RpcException) cause));
            }
            return CompletableFuture.<T>failedFuture(cause);
        }).thenCompose(Function.identity());
    }

    public int getNumConnections() {
        return dgraphs.length;
    }

    public boolean isClosed() {
        return disposed.get();
    }

    /**
     * Close the client. Later calls fail with {@link ObjectDisposedException}. Safe to call repeatedly.
     */
    @Override
    public void close() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        if (closeConnections) {
            for (DgraphConnection c : dgraphs) {
                c.close();
            }
        }
        logger.debug("Closed client over {} connections", dgraphs.length);
    }

    /* --------------------------- Internal functions ------------------------------- */

    private int getNextConnection() {
        return Math.floorMod(nextConnection.getAndIncrement(), dgraphs.length);
    }

    private void assertNotDisposed() {
        if (disposed.get()) {
            throw new ObjectDisposedException(getClass().getSimpleName());
        }
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
