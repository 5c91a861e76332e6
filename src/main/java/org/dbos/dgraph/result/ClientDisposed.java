package org.dbos.dgraph.result;

/**
 * The client was closed before a commit or discard could reach the server.
 */
public class ClientDisposed extends DgraphError {
    public ClientDisposed(String message) {
        super(message);
    }
}
