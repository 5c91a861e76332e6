package org.dbos.dgraph.client;

/**
 * An operation was invoked on a client or transaction that has already been closed.
 */
public class ObjectDisposedException extends IllegalStateException {
    public ObjectDisposedException(String objectName) {
        super("Cannot access a closed object: " + objectName);
    }
}
