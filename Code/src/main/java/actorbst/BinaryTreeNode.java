package actorbst;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import actorbst.Operation.Contains;
import actorbst.Operation.Insert;
import actorbst.Operation.Remove;
import actorbst.OperationReply.ContainsResult;
import actorbst.OperationReply.OperationFinished;

/**
 * One element of the tree. Owns its tombstone and its (at most two) children,
 * and answers or forwards operations by comparing them with {@link #elem}.
 *
 * During garbage collection the node copies itself and its subtree into a new
 * tree (see {@link CopyTo}) while it keeps answering operations from the old one.
 */
public final class BinaryTreeNode extends MessageTask {
    private static final Logger logger = LoggerFactory.getLogger(BinaryTreeNode.class);

    public enum Position { LEFT, RIGHT }

    /** Control messages of the copy protocol. */
    public enum Signal {
        /** Sent to the parent once this node and its whole subtree are replicated. */
        COPY_FINISHED,
        /** Stops the receiving node and, transitively, its subtree. */
        TERMINATE
    }

    /** Asks a node to replicate its live elements, subtree included, into {@code newRoot}. */
    public static final class CopyTo {
        private final Handle newRoot;

        public CopyTo(Handle newRoot) {
            this.newRoot = newRoot;
        }

        public Handle newRoot() {
            return newRoot;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("newRoot", newRoot).toString();
        }
    }

    //--------------------------------------------------------------------------------
    // State
    //--------------------------------------------------------------------------------

    private enum Kind { NORMAL, COPYING }

    /**
     * NORMAL, or COPYING with the handles still to hear from (children plus the
     * parent as a stand-in for this node's own element) and whether this node's
     * element is confirmed in the new tree.
     */
    private static final class State {
        static final State NORMAL = new State(Kind.NORMAL, ImmutableSet.<Handle>of(), false, 0);

        final Kind kind;
        final ImmutableSet<Handle> expected;
        final boolean insertConfirmed;
        final int replicationId;

        private State(Kind kind, ImmutableSet<Handle> expected, boolean insertConfirmed, int replicationId) {
            this.kind = kind;
            this.expected = expected;
            this.insertConfirmed = insertConfirmed;
            this.replicationId = replicationId;
        }

        static State copying(ImmutableSet<Handle> expected, boolean insertConfirmed, int replicationId) {
            return new State(Kind.COPYING, expected, insertConfirmed, replicationId);
        }

        State withInsertConfirmed() {
            return copying(expected, true, replicationId);
        }

        State without(Handle confirmed) {
            return copying(ImmutableSet.copyOf(Sets.difference(expected, ImmutableSet.of(confirmed))), insertConfirmed, replicationId);
        }
    }

    private final int elem;
    private boolean removed;
    private final Map<Position, Handle> children = new EnumMap<>(Position.class);
    private State state = State.NORMAL;

    BinaryTreeNode(Dispatcher dispatcher, int elem, boolean initiallyRemoved) {
        super(dispatcher, "node(" + elem + ")");
        this.elem = elem;
        this.removed = initiallyRemoved;
    }

    /** Null when {@code target} is this node's own element. */
    Position evaluate(int target) {
        int cmp = Integer.compare(target, elem);
        if (cmp == 0)
            return null;
        return cmp > 0 ? Position.RIGHT : Position.LEFT;
    }

    @Override
    protected void receive(Object message, Handle sender) {
        if (message instanceof Operation) {
            handleOperation((Operation) message);
            return;
        }
        switch (state.kind) {
            case NORMAL:
                normal(message, sender);
                break;
            case COPYING:
                copying(message, sender);
                break;
        }
    }

    //--------------------------------------------------------------------------------
    // Operations, answered the same way in both states
    //--------------------------------------------------------------------------------

    private void handleOperation(Operation op) {
        Position position = evaluate(op.elem());
        if (position == null) {
            settle(op);
            return;
        }
        Handle child = children.get(position);
        if (child != null) {
            child.tell(op, self());
        } else if (op instanceof Insert) {
            children.put(position, new BinaryTreeNode(dispatcher, op.elem(), false));
            op.requester().tell(new OperationFinished(op.id()), self());
        } else if (op instanceof Contains) {
            op.requester().tell(new ContainsResult(op.id(), false), self());
        } else {
            op.requester().tell(new OperationFinished(op.id()), self());
        }
    }

    private void settle(Operation op) {
        if (op instanceof Insert) {
            removed = false;
            op.requester().tell(new OperationFinished(op.id()), self());
        } else if (op instanceof Remove) {
            removed = true;
            op.requester().tell(new OperationFinished(op.id()), self());
        } else {
            op.requester().tell(new ContainsResult(op.id(), !removed), self());
        }
    }

    //--------------------------------------------------------------------------------
    // Copy protocol
    //--------------------------------------------------------------------------------

    private void normal(Object message, Handle sender) {
        if (message instanceof CopyTo) {
            startCopy(((CopyTo) message).newRoot(), sender);
        } else if (message == Signal.TERMINATE) {
            // nodes created while their parent was copying are still NORMAL
            terminate();
        } else {
            logger.debug("{} ignoring {} from {}", this, message, sender);
        }
    }

    private void startCopy(Handle newRoot, Handle parent) {
        ImmutableSet<Handle> expected = ImmutableSet.<Handle>builder().addAll(children.values()).add(parent).build();
        int replicationId = ThreadLocalRandom.current().nextInt();
        state = State.copying(expected, removed, replicationId);
        logger.trace("{} copying to {}, waiting for {} children, tombstoned={}", this, newRoot, children.size(), removed);

        for (Handle child : children.values())
            child.tell(new CopyTo(newRoot), self());
        if (!removed)
            newRoot.tell(new Insert(self(), replicationId, elem), self());

        // a tombstoned leaf has nothing to wait for
        maybeReportCopied();
    }

    private void copying(Object message, Handle sender) {
        if (message instanceof OperationFinished && ((OperationFinished) message).id() == state.replicationId) {
            state = state.withInsertConfirmed();
            maybeReportCopied();
        } else if (message == Signal.COPY_FINISHED && state.expected.size() > 1 && state.expected.contains(sender)) {
            state = state.without(sender);
            maybeReportCopied();
        } else if (message == Signal.TERMINATE) {
            terminate();
        } else {
            logger.trace("{} discarding {} from {} while copying", this, message, sender);
        }
    }

    private void maybeReportCopied() {
        if (state.expected.size() == 1 && state.insertConfirmed) {
            Handle parent = state.expected.iterator().next();
            logger.trace("{} and its subtree are copied, notifying {}", this, parent);
            parent.tell(Signal.COPY_FINISHED, self());
        }
    }

    private void terminate() {
        for (Handle child : children.values())
            child.tell(Signal.TERMINATE, self());
        stop();
    }
}
