package org.dbos.dgraph.result;

import org.dbos.dgraph.api.StatusCode;
import org.dbos.dgraph.connection.RpcException;

/**
 * The remote call itself failed: network, protocol, deadline, cancellation or a status reported by the server.
 */
public class TransportError extends DgraphError {
    private final RpcException exception;

    public TransportError(RpcException exception) {
        super(exception.getMessage());
        this.exception = exception;
    }

    public RpcException getException() {
        return exception;
    }

    public StatusCode getCode() {
        return exception.getCode();
    }
}
