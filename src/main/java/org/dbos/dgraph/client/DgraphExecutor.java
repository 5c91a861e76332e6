package org.dbos.dgraph.client;

import org.dbos.dgraph.connection.DgraphConnection;
import org.dbos.dgraph.connection.RpcException;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * For internal use only. The single seam through which transactions reach a {@link DgraphConnection}.
 */
public interface DgraphExecutor {

    /**
     * Run a remote call on the next connection and turn its transport failure into a value.
     * @param execute   the remote call.
     * @param onFail    maps an {@link RpcException} raised by the call to a result.
     * @param <T>       the result type.
     * @return          the call's result, or <code>onFail</code>'s result if the transport failed.
     */
    <T> CompletableFuture<T> dgraphExecute(Function<DgraphConnection, CompletableFuture<T>> execute,
                                           Function<RpcException, T> onFail);
}
