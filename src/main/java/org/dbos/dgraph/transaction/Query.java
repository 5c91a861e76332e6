package org.dbos.dgraph.transaction;

import org.dbos.dgraph.connection.CallOptions;
import org.dbos.dgraph.result.Result;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A transaction that can only read. All reads of one transaction see the same snapshot.
 * Not thread-safe: use one instance from one logical thread of control.
 */
public interface Query {

    TransactionState getTransactionState();

    CompletableFuture<Result<QueryResponse>> query(String queryString);

    CompletableFuture<Result<QueryResponse>> query(String queryString, CallOptions options);

    CompletableFuture<Result<QueryResponse>> queryWithVars(String queryString, Map<String, String> vars);

    /**
     * Run a query in this transaction. A transport failure is returned and leaves the transaction usable.
     * @param queryString   the DQL query.
     * @param vars          query variables, or <code>null</code>.
     * @param options       per-call options, or <code>null</code>.
     * @return              the response, <code>TransactionNotOK</code> if the transaction has finished,
     *                      <code>TransportError</code> or <code>StartTsMismatch</code>.
     */
    CompletableFuture<Result<QueryResponse>> queryWithVars(String queryString, Map<String, String> vars,
                                                           CallOptions options);
}
