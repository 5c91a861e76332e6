package org.dbos.dgraph.transaction;

import org.dbos.dgraph.api.Request;
import org.dbos.dgraph.api.Response;
import org.dbos.dgraph.api.TxnContext;
import org.dbos.dgraph.client.DgraphExecutor;
import org.dbos.dgraph.client.ObjectDisposedException;
import org.dbos.dgraph.connection.CallOptions;
import org.dbos.dgraph.result.ClientDisposed;
import org.dbos.dgraph.result.Result;
import org.dbos.dgraph.result.TransactionNotOK;
import org.dbos.dgraph.result.TransportError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * The single transaction implementation. Read-only and read-write transactions share the same context handling
 * and differ only in the <code>readOnly</code> flag, which gates mutate and commit.
 * For internal use only; create transactions through {@link org.dbos.dgraph.client.DgraphClient}.
 */
public class DgraphTransaction implements Transaction {
    private static final Logger logger = LoggerFactory.getLogger(DgraphTransaction.class);

    private final DgraphExecutor client;
    private final TxnContext.Builder context = TxnContext.newBuilder();
    private final boolean readOnly;
    private final boolean bestEffort;

    private volatile TransactionState transactionState = TransactionState.OK;
    private boolean hasMutated = false;
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    private DgraphTransaction(DgraphExecutor client, boolean readOnly, boolean bestEffort) {
        if (client == null) {
            throw new NullPointerException("client");
        }
        this.client = client;
        this.readOnly = readOnly;
        this.bestEffort = bestEffort;
    }

    public static DgraphTransaction readWrite(DgraphExecutor client) {
        return new DgraphTransaction(client, false, false);
    }

    public static DgraphTransaction readOnly(DgraphExecutor client, boolean bestEffort) {
        return new DgraphTransaction(client, true, bestEffort);
    }

    @Override
    public TransactionState getTransactionState() {
        return transactionState;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public boolean isBestEffort() {
        return bestEffort;
    }

    /**
     * Return a snapshot of the transaction's context.
     * @return  the current {@link TxnContext}.
     */
    public TxnContext getContext() {
        return context.build();
    }

    /** Queries **/

    @Override
    public CompletableFuture<Result<QueryResponse>> query(String queryString) {
        return queryWithVars(queryString, null, null);
    }

    @Override
    public CompletableFuture<Result<QueryResponse>> query(String queryString, CallOptions options) {
        return queryWithVars(queryString, null, options);
    }

    @Override
    public CompletableFuture<Result<QueryResponse>> queryWithVars(String queryString, Map<String, String> vars) {
        return queryWithVars(queryString, vars, null);
    }

    @Override
    public CompletableFuture<Result<QueryResponse>> queryWithVars(String queryString, Map<String, String> vars,
                                                                  CallOptions options) {
        if (disposed.get()) {
            return disposedFuture();
        }
        if (transactionState != TransactionState.OK) {
            return CompletableFuture.completedFuture(notOK());
        }

        Request.Builder request = Request.newBuilder()
                .setQuery(queryString)
                .setStartTs(context.getStartTs())
                .setHash(context.getHash())
                .setReadOnly(readOnly)
                .setBestEffort(bestEffort);
        if (vars != null) {
            request.putAllVars(vars);
        }

        CallOptions opts = CallOptions.orDefault(options);
        Request req = request.build();
        return client.<Result<QueryResponse>>dgraphExecute(
                dg -> dg.query(req, opts).thenApply(r -> Result.ok(new QueryResponse(r))),
                rpcEx -> Result.<QueryResponse>fail(new TransportError(rpcEx))
        ).thenApply(response -> {
            // A failed read leaves the transaction usable.
            if (response.isFailed()) {
                return response;
            }
            Result<Void> err = mergeContext(response.getValue().getDgraphResponse());
            if (err.isFailed()) {
                return err.<QueryResponse>toResult();
            }
            return response;
        });
    }

    /** Mutations **/

    @Override
    public CompletableFuture<Result<QueryResponse>> mutate(RequestBuilder request) {
        return mutate(request, null);
    }

    @Override
    public CompletableFuture<Result<QueryResponse>> mutate(String setJson, String deleteJson, boolean commitNow) {
        return mutate(setJson, deleteJson, commitNow, null);
    }

    @Override
    public CompletableFuture<Result<QueryResponse>> mutate(String setJson, String deleteJson, boolean commitNow,
                                                           CallOptions options) {
        return mutate(new RequestBuilder().commitNow(commitNow).withMutations(
                new MutationBuilder().setJson(setJson).deleteJson(deleteJson)), options);
    }

    @Override
    public CompletableFuture<Result<QueryResponse>> mutate(RequestBuilder request, CallOptions options) {
        assertWritable("mutate");
        if (disposed.get()) {
            return disposedFuture();
        }
        if (transactionState != TransactionState.OK) {
            return CompletableFuture.completedFuture(notOK());
        }

        Request.Builder builder = request.getRequest();
        if (builder.getMutationsCount() == 0) {
            return CompletableFuture.completedFuture(Result.ok(QueryResponse.empty()));
        }

        hasMutated = true;
        Request req = builder
                .setStartTs(context.getStartTs())
                .setHash(context.getHash())
                .build();

        CallOptions opts = CallOptions.orDefault(options);
        return client.<Result<QueryResponse>>dgraphExecute(
                dg -> dg.query(req, opts).thenApply(r -> Result.ok(new QueryResponse(r))),
                rpcEx -> Result.<QueryResponse>fail(new TransportError(rpcEx))
        ).thenCompose(response -> {
            if (response.isFailed()) {
                // The caller must see the original failure, whatever the discard does.
                return discard().handle((discarded, ex) -> {
                    if (ex != null) {
                        logger.debug("Discard after failed mutation raised: {}", ex.getMessage());
                    } else if (discarded.isFailed()) {
                        logger.debug("Discard after failed mutation failed: {}", discarded.getErrors());
                    }
                    transactionState = TransactionState.ERROR;  // Overwrites ABORTED.
                    return response;
                });
            }

            if (req.getCommitNow()) {
                transactionState = TransactionState.COMMITTED;
            }

            Result<Void> err = mergeContext(response.getValue().getDgraphResponse());
            if (err.isFailed()) {
                // Keep the response for inspection, but report the broken bookkeeping.
                return CompletableFuture.completedFuture(response.withErrors(err.getErrors()));
            }
            return CompletableFuture.completedFuture(response);
        });
    }

    /** Commit and discard **/

    @Override
    public CompletableFuture<Result<Void>> commit() {
        return commit(null);
    }

    @Override
    public CompletableFuture<Result<Void>> commit(CallOptions options) {
        assertWritable("commit");
        if (disposed.get()) {
            return disposedFuture();
        }
        if (transactionState != TransactionState.OK) {
            return CompletableFuture.completedFuture(notOK());
        }

        transactionState = TransactionState.COMMITTED;

        if (!hasMutated) {
            return CompletableFuture.completedFuture(Result.ok());
        }
        return commitOrAbort(CallOptions.orDefault(options));
    }

    @Override
    public CompletableFuture<Result<Void>> discard() {
        return discard(null);
    }

    // Must be safe to call multiple times and from close(), so it never checks the disposed flag.
    @Override
    public CompletableFuture<Result<Void>> discard(CallOptions options) {
        if (transactionState != TransactionState.OK) {
            // COMMITTED can't be discarded, ERROR is entered after a discard, ABORTED is already discarded.
            return CompletableFuture.completedFuture(Result.ok());
        }

        transactionState = TransactionState.ABORTED;
        context.setAborted(true);

        if (!hasMutated) {
            return CompletableFuture.completedFuture(Result.ok());
        }
        return commitOrAbort(CallOptions.orDefault(options));
    }

    /** Disposal **/

    @Override
    public void close() {
        if (disposed.compareAndSet(false, true) && transactionState == TransactionState.OK) {
            // Fire and forget. The server cleans up abandoned transactions eventually anyway.
            CompletableFuture.supplyAsync(this::discard)
                    .thenCompose(Function.identity())
                    .whenComplete((r, ex) -> {
                        if (ex != null) {
                            logger.debug("Discard on close raised: {}", ex.getMessage());
                        } else if (r.isFailed()) {
                            logger.debug("Discard on close failed: {}", r.getErrors());
                        }
                    });
        }
    }

    @Override
    public CompletableFuture<Result<Void>> closeAsync() {
        if (disposed.compareAndSet(false, true) && transactionState == TransactionState.OK) {
            return discard();
        }
        return CompletableFuture.completedFuture(Result.ok());
    }

    /* --------------------------- Internal functions ------------------------------- */

    private CompletableFuture<Result<Void>> commitOrAbort(CallOptions opts) {
        TxnContext ctx = context.build();
        return client.<Result<Void>>dgraphExecute(
                dg -> dg.commitOrAbort(ctx, opts).thenApply(c -> Result.ok()),
                rpcEx -> Result.fail(new TransportError(rpcEx))
        ).exceptionally(ex -> {
            // Teardown may run after the client is closed; report that as a result.
            Throwable cause = (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
            if (cause instanceof ObjectDisposedException) {
                return Result.fail(new ClientDisposed(cause.getMessage()));
            }
            throw (ex instanceof CompletionException) ? (CompletionException) ex : new CompletionException(ex);
        });
    }

    private Result<Void> mergeContext(Response response) {
        return TransactionContexts.merge(context, response.hasTxn() ? response.getTxn() : null);
    }

    private <T> Result<T> notOK() {
        return Result.fail(new TransactionNotOK(transactionState.name()));
    }

    private <T> CompletableFuture<T> disposedFuture() {
        return CompletableFuture.failedFuture(new ObjectDisposedException(getClass().getSimpleName()));
    }

    private void assertWritable(String operation) {
        if (readOnly) {
            throw new IllegalStateException("Cannot " + operation + " in a read-only transaction");
        }
    }
}
