package org.dbos.dgraph.transaction;

/**
 * OK is the only non-terminal state. ERROR is entered only when a mutation's remote call fails.
 */
public enum TransactionState {
    OK,
    COMMITTED,
    ABORTED,
    ERROR
}
