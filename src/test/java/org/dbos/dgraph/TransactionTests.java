package org.dbos.dgraph;

import com.google.protobuf.ByteString;
import org.dbos.dgraph.api.Request;
import org.dbos.dgraph.api.Response;
import org.dbos.dgraph.api.StatusCode;
import org.dbos.dgraph.api.TxnContext;
import org.dbos.dgraph.client.DgraphClient;
import org.dbos.dgraph.client.ObjectDisposedException;
import org.dbos.dgraph.connection.RpcException;
import org.dbos.dgraph.result.ClientDisposed;
import org.dbos.dgraph.result.Result;
import org.dbos.dgraph.result.StartTsMismatch;
import org.dbos.dgraph.result.TransactionNotOK;
import org.dbos.dgraph.result.TransportError;
import org.dbos.dgraph.transaction.DgraphTransaction;
import org.dbos.dgraph.transaction.MutationBuilder;
import org.dbos.dgraph.transaction.Query;
import org.dbos.dgraph.transaction.QueryResponse;
import org.dbos.dgraph.transaction.RequestBuilder;
import org.dbos.dgraph.transaction.Transaction;
import org.dbos.dgraph.transaction.TransactionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TransactionTests {
    private static final Logger logger = LoggerFactory.getLogger(TransactionTests.class);

    private FakeDgraphConnection conn;
    private DgraphClient client;

    @BeforeEach
    public void setUp() {
        conn = new FakeDgraphConnection();
        client = new DgraphClient(conn);
    }

    @AfterEach
    public void tearDown() {
        client.close();
    }

    private static <T> T await(CompletableFuture<T> f) throws Exception {
        return f.get(5, TimeUnit.SECONDS);
    }

    private static RpcException unavailable() {
        return new RpcException(StatusCode.UNAVAILABLE, "connection refused");
    }

    // Put the transaction in the given terminal state, or leave it OK.
    private Transaction transactionIn(TransactionState state) throws Exception {
        Transaction txn = client.newTransaction();
        switch (state) {
            case COMMITTED:
                await(txn.commit());
                break;
            case ABORTED:
                await(txn.discard());
                break;
            case ERROR:
                conn.failure = unavailable();
                await(txn.mutate("{\"name\":\"x\"}", null, false));
                conn.failure = null;
                break;
            default:
                break;
        }
        assertEquals(state, txn.getTransactionState());
        return txn;
    }

    @Test
    public void testQueryCarriesContext() throws Exception {
        logger.info("testQueryCarriesContext");
        conn.onQuery = r -> CompletableFuture.completedFuture(FakeDgraphConnection.response(7, "h1"));
        Transaction txn = client.newTransaction();

        Result<QueryResponse> r1 = await(txn.query("{ q(func: has(name)) { name } }"));
        assertTrue(r1.isSuccess());
        assertEquals("{}", r1.getValue().getJson());
        Result<QueryResponse> r2 = await(txn.queryWithVars("query q($a: string) { q(func: eq(name, $a)) { uid } }",
                Map.of("$a", "alice")));
        assertTrue(r2.isSuccess());

        assertEquals(2, conn.queries.size());
        Request first = conn.queries.get(0);
        assertEquals(0, first.getStartTs());
        assertEquals("", first.getHash());
        assertFalse(first.getReadOnly());
        Request second = conn.queries.get(1);
        assertEquals(7, second.getStartTs());
        assertEquals("h1", second.getHash());
        assertEquals("alice", second.getVarsMap().get("$a"));
        assertEquals(TransactionState.OK, txn.getTransactionState());
    }

    @Test
    public void testReadOnlyFlags() throws Exception {
        logger.info("testReadOnlyFlags");
        Query ro = client.newReadOnlyTransaction();
        Query be = client.newReadOnlyTransaction(true);
        assertTrue(await(ro.query("{ q(func: uid(0x1)) { uid } }")).isSuccess());
        assertTrue(await(be.query("{ q(func: uid(0x1)) { uid } }")).isSuccess());

        assertTrue(conn.queries.get(0).getReadOnly());
        assertFalse(conn.queries.get(0).getBestEffort());
        assertTrue(conn.queries.get(1).getReadOnly());
        assertTrue(conn.queries.get(1).getBestEffort());

        DgraphTransaction readOnly = DgraphTransaction.readOnly(client, false);
        assertThrows(IllegalStateException.class, () -> readOnly.mutate("{}", null, false));
        assertThrows(IllegalStateException.class, readOnly::commit);
        assertTrue(await(readOnly.discard()).isSuccess());
    }

    @Test
    public void testQueryTransportFailureKeepsTransactionUsable() throws Exception {
        logger.info("testQueryTransportFailureKeepsTransactionUsable");
        Transaction txn = client.newTransaction();
        conn.failure = new RpcException(StatusCode.DEADLINE_EXCEEDED, "too slow");
        Result<QueryResponse> r = await(txn.query("{ q(func: has(name)) { name } }"));
        assertTrue(r.isFailed());
        assertNull(r.getValue());
        assertTrue(r.getError() instanceof TransportError);
        assertEquals(StatusCode.DEADLINE_EXCEEDED, ((TransportError) r.getError()).getCode());
        assertEquals(TransactionState.OK, txn.getTransactionState());

        conn.failure = null;
        assertTrue(await(txn.query("{ q(func: has(name)) { name } }")).isSuccess());
    }

    @Test
    public void testQueryStartTsMismatch() throws Exception {
        logger.info("testQueryStartTsMismatch");
        Transaction txn = client.newTransaction();
        conn.onQuery = r -> CompletableFuture.completedFuture(FakeDgraphConnection.response(7, "h1"));
        assertTrue(await(txn.query("{ a(func: has(name)) { name } }")).isSuccess());

        conn.onQuery = r -> CompletableFuture.completedFuture(FakeDgraphConnection.response(9, "h2"));
        Result<QueryResponse> r = await(txn.query("{ b(func: has(name)) { name } }"));
        assertTrue(r.isFailed());
        assertTrue(r.hasError(StartTsMismatch.class));
        assertNull(r.getValue());
        assertEquals(7, ((DgraphTransaction) txn).getContext().getStartTs());
    }

    @Test
    public void testEmptyMutationIsFree() throws Exception {
        logger.info("testEmptyMutationIsFree");
        Transaction txn = client.newTransaction();
        Result<QueryResponse> r = await(txn.mutate(new RequestBuilder().commitNow(true)));
        assertTrue(r.isSuccess());
        assertEquals("", r.getValue().getJson());
        assertEquals(TransactionState.OK, txn.getTransactionState());

        assertTrue(await(txn.commit()).isSuccess());
        assertEquals(TransactionState.COMMITTED, txn.getTransactionState());
        assertTrue(conn.queries.isEmpty());
        assertTrue(conn.commits.isEmpty());
    }

    @Test
    public void testDiscardWithoutMutationIsFree() throws Exception {
        logger.info("testDiscardWithoutMutationIsFree");
        Transaction txn = client.newTransaction();
        await(txn.query("{ q(func: has(name)) { name } }"));
        assertTrue(await(txn.discard()).isSuccess());
        assertEquals(TransactionState.ABORTED, txn.getTransactionState());
        assertTrue(conn.commits.isEmpty());
    }

    @Test
    public void testMutationFailureMovesToError() throws Exception {
        logger.info("testMutationFailureMovesToError");
        conn.onQuery = r -> CompletableFuture.completedFuture(FakeDgraphConnection.response(4, "h1"));
        Transaction txn = client.newTransaction();
        assertTrue(await(txn.query("{ q(func: has(name)) { name } }")).isSuccess());

        conn.onQuery = r -> FakeDgraphConnection.failed(new RpcException(StatusCode.ABORTED, "conflict"));
        Result<QueryResponse> r = await(txn.mutate("{\"name\":\"bob\"}", null, false));
        assertTrue(r.isFailed());
        assertEquals(StatusCode.ABORTED, ((TransportError) r.getError()).getCode());
        assertEquals(TransactionState.ERROR, txn.getTransactionState());

        // The internal discard was sent once, flagged as an abort.
        assertEquals(1, conn.commits.size());
        assertTrue(conn.commits.get(0).getAborted());
        assertEquals(4, conn.commits.get(0).getStartTs());
    }

    @Test
    public void testMutationFailureIgnoresDiscardFailure() throws Exception {
        logger.info("testMutationFailureIgnoresDiscardFailure");
        Transaction txn = client.newTransaction();
        conn.onQuery = r -> FakeDgraphConnection.failed(unavailable());
        conn.onCommitOrAbort = c -> FakeDgraphConnection.failed(new RpcException(StatusCode.INTERNAL, "abort failed"));
        Result<QueryResponse> r = await(txn.mutate("{\"name\":\"bob\"}", null, false));
        assertEquals(StatusCode.UNAVAILABLE, ((TransportError) r.getError()).getCode());
        assertEquals(1, r.getErrors().size());
        assertEquals(TransactionState.ERROR, txn.getTransactionState());
    }

    @Test
    public void testCommitNow() throws Exception {
        logger.info("testCommitNow");
        conn.onQuery = r -> CompletableFuture.completedFuture(FakeDgraphConnection.response(11, "h"));
        Transaction txn = client.newTransaction();
        Result<QueryResponse> r = await(txn.mutate("{\"name\":\"carol\"}", null, true));
        assertTrue(r.isSuccess());
        assertTrue(conn.queries.get(0).getCommitNow());
        assertEquals(TransactionState.COMMITTED, txn.getTransactionState());

        Result<Void> c = await(txn.commit());
        assertTrue(c.isFailed());
        assertEquals("COMMITTED", ((TransactionNotOK) c.getError()).getState());
        assertTrue(conn.commits.isEmpty());
    }

    @Test
    public void testCommitSendsAccumulatedContext() throws Exception {
        logger.info("testCommitSendsAccumulatedContext");
        Transaction txn = client.newTransaction();
        conn.onQuery = r -> CompletableFuture.completedFuture(
                FakeDgraphConnection.response(5, "h1", List.of("k1"), List.of("name")));
        assertTrue(await(txn.mutate("{\"name\":\"dave\"}", null, false)).isSuccess());
        conn.onQuery = r -> CompletableFuture.completedFuture(
                FakeDgraphConnection.response(5, "h2", List.of("k2"), List.of("age")));
        assertTrue(await(txn.mutate(new RequestBuilder().withMutations(
                new MutationBuilder().setNquads("_:d <age> \"40\" ."))))
                .isSuccess());

        assertEquals(5, conn.queries.get(1).getStartTs());
        assertEquals("h1", conn.queries.get(1).getHash());

        assertTrue(await(txn.commit()).isSuccess());
        assertEquals(TransactionState.COMMITTED, txn.getTransactionState());
        assertEquals(1, conn.commits.size());
        TxnContext sent = conn.commits.get(0);
        assertEquals(5, sent.getStartTs());
        assertEquals("h2", sent.getHash());
        assertEquals(List.of("k1", "k2"), sent.getKeysList());
        assertEquals(List.of("name", "age"), sent.getPredsList());
        assertFalse(sent.getAborted());
    }

    @Test
    public void testUpsertPassesQueryBlock() throws Exception {
        logger.info("testUpsertPassesQueryBlock");
        Transaction txn = client.newTransaction();
        RequestBuilder upsert = new RequestBuilder()
                .withQuery("query { v as var(func: eq(email, \"a@b.c\")) }")
                .withMutations(new MutationBuilder()
                        .setNquads("uid(v) <email> \"a@b.c\" .")
                        .cond("@if(eq(len(v), 0))"))
                .commitNow(true);
        assertTrue(await(txn.mutate(upsert)).isSuccess());
        Request sent = conn.queries.get(0);
        assertEquals("query { v as var(func: eq(email, \"a@b.c\")) }", sent.getQuery());
        assertEquals(1, sent.getMutationsCount());
        assertEquals("@if(eq(len(v), 0))", sent.getMutations(0).getCond());
        assertEquals(TransactionState.COMMITTED, txn.getTransactionState());
    }

    @Test
    public void testCommitTransportFailure() throws Exception {
        logger.info("testCommitTransportFailure");
        Transaction txn = client.newTransaction();
        assertTrue(await(txn.mutate("{\"name\":\"erin\"}", null, false)).isSuccess());
        conn.onCommitOrAbort = c -> FakeDgraphConnection.failed(new RpcException(StatusCode.ABORTED, "conflict"));
        Result<Void> r = await(txn.commit());
        assertTrue(r.isFailed());
        assertEquals(StatusCode.ABORTED, ((TransportError) r.getError()).getCode());
        assertEquals(TransactionState.COMMITTED, txn.getTransactionState());
    }

    @Test
    public void testMutationMergeFailureKeepsResponse() throws Exception {
        logger.info("testMutationMergeFailureKeepsResponse");
        Transaction txn = client.newTransaction();
        conn.onQuery = r -> CompletableFuture.completedFuture(FakeDgraphConnection.response(7, "h1"));
        await(txn.query("{ q(func: has(name)) { name } }"));

        Response foreign = FakeDgraphConnection.response(9, "h9").toBuilder()
                .setJson(ByteString.copyFromUtf8("{\"ok\":true}"))
                .putUids("frank", "0x2a")
                .build();
        conn.onQuery = r -> CompletableFuture.completedFuture(foreign);
        Result<QueryResponse> r = await(txn.mutate("{\"uid\":\"_:frank\"}", null, false));
        assertTrue(r.isFailed());
        assertTrue(r.hasError(StartTsMismatch.class));
        assertNotNull(r.getValue());
        assertEquals("{\"ok\":true}", r.getValue().getJson());
        assertEquals("0x2a", r.getValue().getUids().get("frank"));
    }

    @Test
    public void testDiscardIsIdempotent() throws Exception {
        logger.info("testDiscardIsIdempotent");
        for (TransactionState state : TransactionState.values()) {
            Transaction txn = transactionIn(state);
            Result<Void> first = await(txn.discard());
            TransactionState after = txn.getTransactionState();
            Result<Void> second = await(txn.discard());
            assertTrue(first.isSuccess(), state.name());
            assertTrue(second.isSuccess(), state.name());
            assertEquals(after, txn.getTransactionState());
        }
    }

    @Test
    public void testDiscardSendsAbortOnce() throws Exception {
        logger.info("testDiscardSendsAbortOnce");
        Transaction txn = client.newTransaction();
        await(txn.mutate("{\"name\":\"gina\"}", null, false));
        assertTrue(await(txn.discard()).isSuccess());
        assertTrue(await(txn.discard()).isSuccess());
        assertEquals(1, conn.commits.size());
        assertTrue(conn.commits.get(0).getAborted());
        assertEquals(TransactionState.ABORTED, txn.getTransactionState());
    }

    @Test
    public void testTerminalStatesRejectOperations() throws Exception {
        logger.info("testTerminalStatesRejectOperations");
        for (TransactionState state : new TransactionState[]{
                TransactionState.COMMITTED, TransactionState.ABORTED, TransactionState.ERROR}) {
            Transaction txn = transactionIn(state);
            int queries = conn.queries.size();
            int commits = conn.commits.size();

            Result<QueryResponse> q = await(txn.query("{ q(func: has(name)) { name } }"));
            Result<QueryResponse> m = await(txn.mutate("{\"name\":\"x\"}", null, false));
            Result<Void> c = await(txn.commit());
            for (Result<?> r : List.of(q, m, c)) {
                assertTrue(r.isFailed());
                assertTrue(r.getError() instanceof TransactionNotOK);
                assertEquals(state.name(), ((TransactionNotOK) r.getError()).getState());
            }
            assertEquals(queries, conn.queries.size());
            assertEquals(commits, conn.commits.size());
        }
    }

    @Test
    public void testCloseDiscardsInBackground() throws Exception {
        logger.info("testCloseDiscardsInBackground");
        CompletableFuture<TxnContext> aborted = new CompletableFuture<>();
        conn.onCommitOrAbort = c -> {
            aborted.complete(c);
            return CompletableFuture.completedFuture(c);
        };
        Transaction txn = client.newTransaction();
        await(txn.mutate("{\"name\":\"hank\"}", null, false));

        txn.close();
        assertTrue(aborted.get(5, TimeUnit.SECONDS).getAborted());
        txn.close();
        assertEquals(1, conn.commits.size());

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> await(txn.query("{ q(func: has(name)) { name } }")));
        assertTrue(e.getCause() instanceof ObjectDisposedException);
        assertTrue(await(txn.discard()).isSuccess());
    }

    @Test
    public void testCloseAsyncWaitsForDiscard() throws Exception {
        logger.info("testCloseAsyncWaitsForDiscard");
        Transaction txn = client.newTransaction();
        await(txn.mutate("{\"name\":\"ivy\"}", null, false));
        conn.onCommitOrAbort = c -> FakeDgraphConnection.failed(unavailable());

        Result<Void> r = await(txn.closeAsync());
        assertTrue(r.isFailed());
        assertTrue(r.getError() instanceof TransportError);
        assertEquals(TransactionState.ABORTED, txn.getTransactionState());
        assertTrue(await(txn.closeAsync()).isSuccess());
        assertEquals(1, conn.commits.size());
    }

    @Test
    public void testCloseAfterCommitSendsNothing() throws Exception {
        logger.info("testCloseAfterCommitSendsNothing");
        try (Transaction txn = client.newTransaction()) {
            await(txn.mutate("{\"name\":\"jack\"}", null, false));
            assertTrue(await(txn.commit()).isSuccess());
        }
        assertEquals(1, conn.commits.size());
        assertFalse(conn.commits.get(0).getAborted());
    }

    @Test
    public void testClosedClientFailsTransactionCalls() throws Exception {
        logger.info("testClosedClientFailsTransactionCalls");
        Transaction txn = client.newTransaction();
        client.close();
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> await(txn.query("{ q(func: has(name)) { name } }")));
        assertTrue(e.getCause() instanceof ObjectDisposedException);
        // Closing the transaction afterwards must not throw.
        txn.close();
    }

    @Test
    public void testDiscardAfterClientClosed() throws Exception {
        logger.info("testDiscardAfterClientClosed");
        Transaction txn = client.newTransaction();
        await(txn.mutate("{\"name\":\"kate\"}", null, false));
        client.close();

        Result<Void> r = await(txn.discard());
        assertTrue(r.isFailed());
        assertTrue(r.getError() instanceof ClientDisposed);
        assertEquals(TransactionState.ABORTED, txn.getTransactionState());
        assertTrue(conn.commits.isEmpty());

        assertTrue(await(txn.closeAsync()).isSuccess());
    }

    @Test
    public void testCloseAsyncAfterClientClosed() throws Exception {
        logger.info("testCloseAsyncAfterClientClosed");
        Transaction txn = client.newTransaction();
        await(txn.mutate("{\"name\":\"liam\"}", null, false));
        client.close();

        Result<Void> r = await(txn.closeAsync());
        assertTrue(r.hasError(ClientDisposed.class));
        assertEquals(TransactionState.ABORTED, txn.getTransactionState());
    }
}
