package org.dbos.dgraph.connection;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageLite;
import com.google.protobuf.Parser;
import org.dbos.dgraph.api.Check;
import org.dbos.dgraph.api.LoginRequest;
import org.dbos.dgraph.api.Operation;
import org.dbos.dgraph.api.Payload;
import org.dbos.dgraph.api.Request;
import org.dbos.dgraph.api.Response;
import org.dbos.dgraph.api.RpcMethod;
import org.dbos.dgraph.api.RpcReply;
import org.dbos.dgraph.api.RpcRequest;
import org.dbos.dgraph.api.StatusCode;
import org.dbos.dgraph.api.TxnContext;
import org.dbos.dgraph.api.Version;
import org.dbos.dgraph.utilities.DgraphConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import org.zeromq.ZMQException;
import zmq.ZError;

import java.time.Duration;
import java.util.Collections;
import java.util.Deque;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link DgraphConnection} over a ZeroMQ DEALER socket. Every call is wrapped in an {@link RpcRequest} envelope and
 * matched to its {@link RpcReply} by call ID. A single I/O thread owns the socket; callers only touch concurrent
 * queues, so this class is thread-safe.
 */
public class ZmqDgraphConnection implements DgraphConnection {
    private static final Logger logger = LoggerFactory.getLogger(ZmqDgraphConnection.class);

    private final String address;
    private final ZContext zContext;
    private final boolean ownsContext;
    private final long defaultDeadlineNanos;  // Zero means no deadline.

    private final AtomicLong callIDs = new AtomicLong(0);
    // Calls waiting for the I/O thread to send them.
    private final Deque<PendingCall<?>> outgoingQueue = new ConcurrentLinkedDeque<>();
    // Calls sent or queued, not yet answered, expired or cancelled.
    private final Map<Long, PendingCall<?>> pendingCalls = new ConcurrentHashMap<>();
    // Unanswered calls by cancellation signal. Weak keys, so abandoned signals are dropped.
    private final Map<CompletionStage<?>, Set<Long>> cancellableCalls = Collections.synchronizedMap(new WeakHashMap<>());

    private final ExecutorService callbackPool;
    private final Thread ioThread;
    private volatile boolean running = true;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Connect to a Dgraph alpha using a private {@link ZContext}.
     * @param address   <code>host</code> or <code>host:port</code> of the alpha.
     */
    public ZmqDgraphConnection(String address) {
        this(new ZContext(DgraphConfig.ioThreads), true, address, defaultDeadline());
    }

    /**
     * Connect to a Dgraph alpha using a private {@link ZContext}, with a connection-level deadline.
     * @param address           <code>host</code> or <code>host:port</code> of the alpha.
     * @param defaultDeadline   deadline applied to calls that carry none, or <code>null</code> for no deadline.
     */
    public ZmqDgraphConnection(String address, Duration defaultDeadline) {
        this(new ZContext(DgraphConfig.ioThreads), true, address, defaultDeadline);
    }

    /**
     * Connect to a Dgraph alpha using a shared {@link ZContext}. The context is not closed with this connection.
     * @param zContext          the ZContext to create the socket in.
     * @param address           <code>host</code> or <code>host:port</code> of the alpha.
     * @param defaultDeadline   deadline applied to calls that carry none, or <code>null</code> for no deadline.
     */
    public ZmqDgraphConnection(ZContext zContext, String address, Duration defaultDeadline) {
        this(zContext, false, address, defaultDeadline);
    }

    private ZmqDgraphConnection(ZContext zContext, boolean ownsContext, String address, Duration defaultDeadline) {
        String endpoint;
        try {
            if (address == null || address.isEmpty()) {
                throw new IllegalArgumentException("Address must not be empty");
            }
            endpoint = DgraphConfig.formatAddress(address);
        } catch (IllegalArgumentException e) {
            if (ownsContext) {
                zContext.close();
            }
            throw e;
        }
        this.zContext = zContext;
        this.ownsContext = ownsContext;
        this.address = endpoint;
        this.defaultDeadlineNanos = defaultDeadline == null ? 0L : defaultDeadline.toNanos();

        AtomicInteger threadIDs = new AtomicInteger(0);
        this.callbackPool = Executors.newFixedThreadPool(DgraphConfig.callbackThreads, r -> {
            Thread t = new Thread(r, "dgraph-callback-" + threadIDs.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.ioThread = new Thread(this::ioThread, "dgraph-zmq-" + this.address);
        this.ioThread.setDaemon(true);
        this.ioThread.start();
    }

    public String getAddress() {
        return address;
    }

    /** Public Interface **/

    @Override
    public CompletableFuture<Response> query(Request request, CallOptions options) {
        return call(RpcMethod.QUERY, request, Response.parser(), options);
    }

    @Override
    public CompletableFuture<TxnContext> commitOrAbort(TxnContext context, CallOptions options) {
        return call(RpcMethod.COMMIT_OR_ABORT, context, TxnContext.parser(), options);
    }

    @Override
    public CompletableFuture<Payload> alter(Operation operation, CallOptions options) {
        return call(RpcMethod.ALTER, operation, Payload.parser(), options);
    }

    @Override
    public CompletableFuture<Version> checkVersion(Check check, CallOptions options) {
        return call(RpcMethod.CHECK_VERSION, check, Version.parser(), options);
    }

    @Override
    public CompletableFuture<Response> login(LoginRequest request, CallOptions options) {
        return call(RpcMethod.LOGIN, request, Response.parser(), options);
    }

    /**
     * Stop the I/O thread and fail every outstanding call with <code>UNAVAILABLE</code>. Safe to call repeatedly.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        running = false;
        try {
            ioThread.join(DgraphConfig.shutdownTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        failAll(StatusCode.UNAVAILABLE, "Connection to " + address + " closed");
        callbackPool.shutdown();
        if (ownsContext) {
            zContext.close();
        }
        logger.debug("Closed connection to {}", address);
    }

    /* --------------------------- Internal functions ------------------------------- */

    private static Duration defaultDeadline() {
        return DgraphConfig.defaultDeadlineMs > 0 ? Duration.ofMillis(DgraphConfig.defaultDeadlineMs) : null;
    }

    private <T> CompletableFuture<T> call(RpcMethod method, MessageLite message, Parser<T> parser, CallOptions options) {
        CallOptions opts = CallOptions.orDefault(options);
        CompletableFuture<T> future = new CompletableFuture<>();
        if (!running) {
            future.completeExceptionally(new RpcException(StatusCode.UNAVAILABLE, "Connection to " + address + " closed"));
            return future;
        }
        long callID = callIDs.incrementAndGet();
        byte[] reqBytes = RpcRequest.newBuilder()
                .setCallId(callID)
                .setMethod(method)
                .setPayload(message.toByteString())
                .build().toByteArray();
        PendingCall<T> call = new PendingCall<>(callID, reqBytes, parser, deadlineNanos(opts), future);
        pendingCalls.put(callID, call);
        outgoingQueue.add(call);
        // The I/O thread may have drained the pending map between the check above and the put.
        if (!running) {
            fail(callID, new RpcException(StatusCode.UNAVAILABLE, "Connection to " + address + " closed"));
        }
        if (opts.getCancellation() != null) {
            watchCancellation(opts.getCancellation(), callID, future);
        }
        return future;
    }

    // Registers one callback per signal, however many calls share it.
    private void watchCancellation(CompletionStage<?> signal, long callID, CompletableFuture<?> future) {
        Set<Long> calls;
        boolean first;
        synchronized (cancellableCalls) {
            calls = cancellableCalls.get(signal);
            first = calls == null;
            if (first) {
                calls = ConcurrentHashMap.newKeySet();
                cancellableCalls.put(signal, calls);
            }
            calls.add(callID);
        }
        Set<Long> watched = calls;
        future.whenComplete((r, e) -> watched.remove(callID));
        if (first) {
            signal.whenComplete((r, e) -> cancelAll(signal));
        }
    }

    private void cancelAll(CompletionStage<?> signal) {
        Set<Long> calls = cancellableCalls.remove(signal);
        if (calls == null) {
            return;
        }
        for (Long callID : calls) {
            fail(callID, new RpcException(StatusCode.CANCELLED, "Call " + callID + " cancelled"));
        }
    }

    private long deadlineNanos(CallOptions opts) {
        long timeout = opts.getDeadline() != null ? opts.getDeadline().toNanos() : defaultDeadlineNanos;
        return timeout > 0 ? System.nanoTime() + timeout : 0L;
    }

    private void fail(long callID, RpcException e) {
        PendingCall<?> call = pendingCalls.remove(callID);
        if (call != null) {
            runCallback(() -> call.future.completeExceptionally(e));
        }
    }

    private void failAll(StatusCode code, String message) {
        outgoingQueue.clear();
        for (Long callID : pendingCalls.keySet()) {
            fail(callID, new RpcException(code, message));
        }
    }

    private void runCallback(Runnable r) {
        try {
            callbackPool.execute(r);
        } catch (RejectedExecutionException e) {
            // Pool already shut down by close().
            r.run();
        }
    }

    private void ioThread() {
        ZMQ.Socket socket = zContext.createSocket(SocketType.DEALER);
        socket.setLinger(DgraphConfig.lingerMs);
        socket.setHWM(DgraphConfig.highWaterMark);
        String identity = String.format("%04X-%04X", ThreadLocalRandom.current().nextInt(), ThreadLocalRandom.current().nextInt());
        socket.setIdentity(identity.getBytes(ZMQ.CHARSET));
        socket.connect(address);
        ZMQ.Poller poller = zContext.createPoller(1);
        poller.register(socket, ZMQ.Poller.POLLIN);
        logger.debug("Connected {} to {}", identity, address);

        try {
            while (running) {
                int prs = poller.poll(DgraphConfig.pollIntervalMs);
                if (prs == -1) {
                    break;
                }
                if (poller.pollin(0)) {
                    receiveReplies(socket);
                }
                sendOutgoing(socket);
                expireDeadlines();
            }
        } catch (ZMQException e) {
            if (e.getErrorCode() != ZMQ.Error.ETERM.getCode() && e.getErrorCode() != ZMQ.Error.EINTR.getCode()) {
                logger.error("I/O thread for {} stopped", address, e);
            }
        } finally {
            running = false;
            failAll(StatusCode.UNAVAILABLE, "Connection to " + address + " is not running");
            poller.close();
            zContext.destroySocket(socket);
        }
    }

    private void receiveReplies(ZMQ.Socket socket) {
        byte[] replyBytes;
        while ((replyBytes = socket.recv(ZMQ.DONTWAIT)) != null) {
            RpcReply reply;
            try {
                reply = RpcReply.parseFrom(replyBytes);
            } catch (InvalidProtocolBufferException e) {
                logger.warn("Dropping malformed reply from {}", address, e);
                continue;
            }
            PendingCall<?> call = pendingCalls.remove(reply.getCallId());
            if (call == null) {
                // Expired or cancelled before the reply arrived.
                logger.debug("No pending call {} for reply from {}", reply.getCallId(), address);
                continue;
            }
            runCallback(() -> call.completeWith(reply));
        }
    }

    private void sendOutgoing(ZMQ.Socket socket) {
        PendingCall<?> call;
        while ((call = outgoingQueue.poll()) != null) {
            if (!pendingCalls.containsKey(call.callID)) {
                continue;
            }
            boolean sent = socket.send(call.request, ZMQ.DONTWAIT);
            if (!sent) {
                int errno = socket.errno();
                if (errno == ZError.EAGAIN) {
                    outgoingQueue.addFirst(call);
                    break;
                }
                logger.info("Socket failed to send, errno == {}", errno);
                fail(call.callID, new RpcException(StatusCode.UNAVAILABLE, "Send to " + address + " failed, errno == " + errno));
            }
        }
    }

    private void expireDeadlines() {
        long now = System.nanoTime();
        for (PendingCall<?> call : pendingCalls.values()) {
            if (call.deadlineNanos != 0L && now - call.deadlineNanos >= 0) {
                fail(call.callID, new RpcException(StatusCode.DEADLINE_EXCEEDED, "Deadline exceeded for call " + call.callID));
            }
        }
    }

    private static final class PendingCall<T> {
        final long callID;
        final byte[] request;
        final Parser<T> parser;
        final long deadlineNanos;
        final CompletableFuture<T> future;

        PendingCall(long callID, byte[] request, Parser<T> parser, long deadlineNanos, CompletableFuture<T> future) {
            this.callID = callID;
            this.request = request;
            this.parser = parser;
            this.deadlineNanos = deadlineNanos;
            this.future = future;
        }

        void completeWith(RpcReply reply) {
            if (reply.getCode() != StatusCode.OK) {
                future.completeExceptionally(new RpcException(reply.getCode(), reply.getErrorMsg()));
                return;
            }
            try {
                future.complete(parser.parseFrom(reply.getPayload()));
            } catch (InvalidProtocolBufferException e) {
                future.completeExceptionally(new RpcException(StatusCode.INTERNAL, "Malformed reply payload", e));
            }
        }
    }
}
