package org.dbos.dgraph.connection;

import org.dbos.dgraph.api.StatusCode;

/**
 * A remote call failed at the transport level, or the server answered with a non-OK status.
 */
public class RpcException extends Exception {
    private final StatusCode code;

    public RpcException(StatusCode code, String message) {
        super(code + ": " + message);
        this.code = code;
    }

    public RpcException(StatusCode code, String message, Throwable cause) {
        super(code + ": " + message, cause);
        this.code = code;
    }

    public StatusCode getCode() {
        return code;
    }
}
