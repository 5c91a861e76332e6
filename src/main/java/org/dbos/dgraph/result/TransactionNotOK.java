package org.dbos.dgraph.result;

/**
 * An operation was invoked on a transaction that already left the OK state.
 */
public class TransactionNotOK extends DgraphError {
    private final String state;

    public TransactionNotOK(String state) {
        super("Transaction is in state " + state);
        this.state = state;
    }

    public String getState() {
        return state;
    }
}
