package org.dbos.dgraph.transaction;

import org.dbos.dgraph.api.TxnContext;
import org.dbos.dgraph.result.Result;
import org.dbos.dgraph.result.StartTsMismatch;

public class TransactionContexts {

    /**
     * Merge a context returned by the server into the transaction's own context.
     * The hash is replaced by the latest one; keys and predicates accumulate across calls.
     * @param local     the transaction's context, updated in place.
     * @param remote    the context from a response, or <code>null</code> if the response carried none.
     * @return          ok, or {@link StartTsMismatch} if the response belongs to another transaction.
     */
    public static Result<Void> merge(TxnContext.Builder local, TxnContext remote) {
        if (remote == null) {
            return Result.ok();
        }

        // First successful call assigns the start timestamp.
        if (local.getStartTs() == 0) {
            local.setStartTs(remote.getStartTs());
        }

        if (local.getStartTs() != remote.getStartTs()) {
            return Result.fail(new StartTsMismatch(local.getStartTs(), remote.getStartTs()));
        }

        local.setHash(remote.getHash());
        local.addAllKeys(remote.getKeysList());
        local.addAllPreds(remote.getPredsList());
        return Result.ok();
    }
}
