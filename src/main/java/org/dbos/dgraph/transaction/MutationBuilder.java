package org.dbos.dgraph.transaction;

import com.google.protobuf.ByteString;
import org.dbos.dgraph.api.Mutation;

/**
 * Builds one {@link Mutation}. The payloads are opaque to the client.
 */
public class MutationBuilder {
    private String setJson;
    private String deleteJson;
    private String setNquads;
    private String delNquads;
    private String cond;

    public MutationBuilder setJson(String setJson) {
        this.setJson = setJson;
        return this;
    }

    public MutationBuilder deleteJson(String deleteJson) {
        this.deleteJson = deleteJson;
        return this;
    }

    public MutationBuilder setNquads(String setNquads) {
        this.setNquads = setNquads;
        return this;
    }

    public MutationBuilder delNquads(String delNquads) {
        this.delNquads = delNquads;
        return this;
    }

    // Condition for upserts, e.g. "@if(eq(len(v), 0))".
    public MutationBuilder cond(String cond) {
        this.cond = cond;
        return this;
    }

    public Mutation getMutation() {
        Mutation.Builder b = Mutation.newBuilder();
        if (setJson != null) {
            b.setSetJson(ByteString.copyFromUtf8(setJson));
        }
        if (deleteJson != null) {
            b.setDeleteJson(ByteString.copyFromUtf8(deleteJson));
        }
        if (setNquads != null) {
            b.setSetNquads(ByteString.copyFromUtf8(setNquads));
        }
        if (delNquads != null) {
            b.setDelNquads(ByteString.copyFromUtf8(delNquads));
        }
        if (cond != null) {
            b.setCond(cond);
        }
        return b.build();
    }
}
