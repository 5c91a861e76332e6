package org.dbos.dgraph.transaction;

import org.dbos.dgraph.api.Mutation;
import org.dbos.dgraph.api.Request;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a mutation request. A request may also carry a query block and variables, which makes it an upsert.
 */
public class RequestBuilder {
    private String query;
    private final Map<String, String> vars = new HashMap<>();
    private final List<Mutation> mutations = new ArrayList<>();
    private boolean commitNow;

    public RequestBuilder withQuery(String query) {
        this.query = query;
        return this;
    }

    public RequestBuilder withVar(String name, String value) {
        vars.put(name, value);
        return this;
    }

    public RequestBuilder withMutations(MutationBuilder... builders) {
        for (MutationBuilder b : builders) {
            mutations.add(b.getMutation());
        }
        return this;
    }

    /**
     * Commit the transaction together with this request, without a separate commit call.
     * @param commitNow whether to commit immediately.
     * @return          this builder.
     */
    public RequestBuilder commitNow(boolean commitNow) {
        this.commitNow = commitNow;
        return this;
    }

    public boolean isCommitNow() {
        return commitNow;
    }

    public int getMutationCount() {
        return mutations.size();
    }

    /**
     * Return a fresh request builder. The transaction stamps its start timestamp and hash onto it.
     * @return  a {@link Request.Builder}.
     */
    public Request.Builder getRequest() {
        Request.Builder b = Request.newBuilder()
                .addAllMutations(mutations)
                .putAllVars(vars)
                .setCommitNow(commitNow);
        if (query != null) {
            b.setQuery(query);
        }
        return b;
    }
}
