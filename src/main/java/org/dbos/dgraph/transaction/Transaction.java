package org.dbos.dgraph.transaction;

import org.dbos.dgraph.connection.CallOptions;
import org.dbos.dgraph.result.Result;

import java.util.concurrent.CompletableFuture;

/**
 * A read-write transaction. Closing a transaction that is still OK discards it.
 */
public interface Transaction extends Query, AutoCloseable {

    CompletableFuture<Result<QueryResponse>> mutate(RequestBuilder request);

    /**
     * Send mutations. If the remote call fails, the transaction is discarded and moves to ERROR.
     * A request without mutations succeeds immediately without contacting the server.
     * @param request   the mutations, and optionally a query block for an upsert.
     * @param options   per-call options, or <code>null</code>.
     * @return          the response. If the returned context does not belong to this transaction the result
     *                  carries both the response and a <code>StartTsMismatch</code> error.
     */
    CompletableFuture<Result<QueryResponse>> mutate(RequestBuilder request, CallOptions options);

    CompletableFuture<Result<QueryResponse>> mutate(String setJson, String deleteJson, boolean commitNow);

    CompletableFuture<Result<QueryResponse>> mutate(String setJson, String deleteJson, boolean commitNow,
                                                    CallOptions options);

    CompletableFuture<Result<Void>> commit();

    CompletableFuture<Result<Void>> commit(CallOptions options);

    CompletableFuture<Result<Void>> discard();

    /**
     * Roll back the transaction. Safe to call any number of times and in any state; does nothing once the
     * transaction has finished.
     * @param options   per-call options, or <code>null</code>.
     * @return          ok, or a <code>TransportError</code> from the abort call.
     */
    CompletableFuture<Result<Void>> discard(CallOptions options);

    /**
     * Schedule a discard without waiting for it. Only the first close has any effect.
     */
    @Override
    void close();

    /**
     * Discard the transaction if it is still OK and wait for the discard. Only the first close has any effect.
     * @return  the discard's result, or ok if there was nothing to do.
     */
    CompletableFuture<Result<Void>> closeAsync();
}
