package org.dbos.dgraph.connection;

import org.dbos.dgraph.api.Check;
import org.dbos.dgraph.api.LoginRequest;
import org.dbos.dgraph.api.Operation;
import org.dbos.dgraph.api.Payload;
import org.dbos.dgraph.api.Request;
import org.dbos.dgraph.api.Response;
import org.dbos.dgraph.api.TxnContext;
import org.dbos.dgraph.api.Version;

import java.util.concurrent.CompletableFuture;

/**
 * A connection to one Dgraph alpha. Connections are shared by many transactions and must be safe for concurrent use.
 * Transport failures are reported by completing the returned future exceptionally with an {@link RpcException}.
 */
public interface DgraphConnection extends AutoCloseable {

    /**
     * Run a query, or a mutation when the request carries mutations.
     * @param request   the request, stamped with the transaction's start timestamp and hash.
     * @param options   per-call options.
     * @return          the server's response, including the updated transaction context.
     */
    CompletableFuture<Response> query(Request request, CallOptions options);

    /**
     * Commit the transaction, or abort it if <code>context.aborted</code> is set.
     * @param context   the client's transaction context.
     * @param options   per-call options.
     * @return          the final context.
     */
    CompletableFuture<TxnContext> commitOrAbort(TxnContext context, CallOptions options);

    CompletableFuture<Payload> alter(Operation operation, CallOptions options);

    CompletableFuture<Version> checkVersion(Check check, CallOptions options);

    CompletableFuture<Response> login(LoginRequest request, CallOptions options);

    @Override
    void close();
}
