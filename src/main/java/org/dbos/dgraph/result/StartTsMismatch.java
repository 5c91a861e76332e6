package org.dbos.dgraph.result;

/**
 * The server returned a context that belongs to a different transaction. The transaction is unusable afterwards.
 */
public class StartTsMismatch extends DgraphError {
    private final long localStartTs;
    private final long remoteStartTs;

    public StartTsMismatch(long localStartTs, long remoteStartTs) {
        super(String.format("StartTs mismatch: transaction has %d, response carries %d",
                localStartTs, remoteStartTs));
        this.localStartTs = localStartTs;
        this.remoteStartTs = remoteStartTs;
    }

    public long getLocalStartTs() {
        return localStartTs;
    }

    public long getRemoteStartTs() {
        return remoteStartTs;
    }
}
