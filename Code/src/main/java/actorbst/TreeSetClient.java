package actorbst;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import actorbst.Operation.Contains;
import actorbst.Operation.Insert;
import actorbst.Operation.Remove;
import actorbst.OperationReply.ContainsResult;
import actorbst.OperationReply.OperationFinished;

/**
 * Future-based view of a {@link BinaryTreeSet}. Allocates ids, acts as the
 * requester of every operation it issues and completes the matching future
 * when the reply comes back.
 */
public final class TreeSetClient implements Handle, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TreeSetClient.class);

    private final Dispatcher dispatcher;
    private final Handle set;
    private final AtomicInteger nextId = new AtomicInteger();
    private final Map<Integer, CompletableFuture<OperationReply>> pending = new ConcurrentHashMap<>();

    public TreeSetClient(TreeSetConfig config) {
        this.dispatcher = new Dispatcher(config);
        this.set = new BinaryTreeSet(dispatcher);
    }

    /** Talks to {@code set} instead of a coordinator of its own. */
    TreeSetClient(Dispatcher dispatcher, Handle set) {
        this.dispatcher = dispatcher;
        this.set = set;
    }

    public TreeSetClient() {
        this(TreeSetConfig.fromSystemProperties());
    }

    //--------------------------------------------------------------------------------
    // Operations
    //--------------------------------------------------------------------------------

    public CompletableFuture<Void> insert(int elem) {
        int id = nextId.getAndIncrement();
        return submit(new Insert(this, id, elem)).thenApply(TreeSetClient::finished);
    }

    public CompletableFuture<Boolean> contains(int elem) {
        int id = nextId.getAndIncrement();
        return submit(new Contains(this, id, elem)).thenApply(reply -> {
            if (!(reply instanceof ContainsResult))
                throw new IllegalStateException("Expected a contains result, got " + reply);
            return ((ContainsResult) reply).result();
        });
    }

    public CompletableFuture<Void> remove(int elem) {
        int id = nextId.getAndIncrement();
        return submit(new Remove(this, id, elem)).thenApply(TreeSetClient::finished);
    }

    /** Starts a garbage collection cycle, unless one is running. Returns immediately. */
    public void collectGarbage() {
        set.tell(BinaryTreeSet.Command.GC, this);
    }

    private static Void finished(OperationReply reply) {
        if (!(reply instanceof OperationFinished))
            throw new IllegalStateException("Expected operation finished, got " + reply);
        return null;
    }

    private CompletableFuture<OperationReply> submit(Operation op) {
        CompletableFuture<OperationReply> future = new CompletableFuture<>();
        if (dispatcher.isShutdown()) {
            future.completeExceptionally(new IllegalStateException("Tree set client is closed"));
            return future;
        }
        pending.put(op.id(), future);
        // close() may have swept pending between the check above and the put
        if (dispatcher.isShutdown()) {
            if (pending.remove(op.id(), future))
                future.completeExceptionally(new IllegalStateException("Tree set client is closed"));
            return future;
        }
        set.tell(op, this);
        return future;
    }

    @Override
    public void tell(Object message, Handle sender) {
        if (!(message instanceof OperationReply)) {
            logger.warn("Unexpected message {} from {}", message, sender);
            return;
        }
        OperationReply reply = (OperationReply) message;
        CompletableFuture<OperationReply> future = pending.remove(reply.id());
        if (future == null) {
            logger.warn("Reply {} does not match any pending operation", reply);
            return;
        }
        future.complete(reply);
    }

    //--------------------------------------------------------------------------------
    // Introspection and lifecycle
    //--------------------------------------------------------------------------------

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    /** Operations issued and not yet answered. */
    public int pendingOperations() {
        return pending.size();
    }

    @Override
    public void close() {
        dispatcher.close();
        for (Integer id : pending.keySet()) {
            CompletableFuture<OperationReply> future = pending.remove(id);
            if (future != null)
                future.completeExceptionally(new CancellationException("Tree set client closed"));
        }
    }

    @Override
    public String toString() {
        return "client";
    }
}
