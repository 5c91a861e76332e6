package org.dbos.dgraph.transaction;

import org.dbos.dgraph.api.Latency;
import org.dbos.dgraph.api.Response;

import java.util.Map;

/**
 * The answer to a query or mutation.
 */
public class QueryResponse {
    private final Response dgraphResponse;

    public QueryResponse(Response dgraphResponse) {
        this.dgraphResponse = dgraphResponse;
    }

    public static QueryResponse empty() {
        return new QueryResponse(Response.getDefaultInstance());
    }

    /**
     * Return the JSON result of the query, or an empty string if there is none.
     * @return  the JSON text.
     */
    public String getJson() {
        return dgraphResponse.getJson().toStringUtf8();
    }

    /**
     * Return the UIDs assigned to blank nodes by a mutation, keyed by blank node name.
     * @return  the assigned UIDs.
     */
    public Map<String, String> getUids() {
        return dgraphResponse.getUidsMap();
    }

    public Latency getLatency() {
        return dgraphResponse.getLatency();
    }

    public Response getDgraphResponse() {
        return dgraphResponse;
    }
}
