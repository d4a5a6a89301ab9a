package actorbst;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the set: routes every {@link Operation} to the current root
 * and runs garbage collection cycles.
 *
 * A cycle starts on {@link Command#GC}: a fresh root is created and the old
 * tree is asked to copy its live elements into it. Operations keep going to the
 * old tree until it reports {@link BinaryTreeNode.Signal#COPY_FINISHED}; then the
 * root is swapped and the old tree is terminated. Callers get no notification.
 */
public final class BinaryTreeSet extends MessageTask {
    private static final Logger logger = LoggerFactory.getLogger(BinaryTreeSet.class);

    public enum Command {
        /** Compacts the tree, dropping tombstoned elements. */
        GC
    }

    private enum Kind { NORMAL, COLLECTING_GARBAGE }

    private static final class State {
        static final State NORMAL = new State(Kind.NORMAL, null);

        final Kind kind;
        final Handle newRoot;

        private State(Kind kind, Handle newRoot) {
            this.kind = kind;
            this.newRoot = newRoot;
        }

        static State collectingGarbage(Handle newRoot) {
            return new State(Kind.COLLECTING_GARBAGE, newRoot);
        }
    }

    private final int rootElem;
    private Handle root;
    private State state = State.NORMAL;
    private long cycles;

    public BinaryTreeSet(Dispatcher dispatcher) {
        super(dispatcher, "coordinator");
        this.rootElem = dispatcher.config().rootElem();
        this.root = createRoot();
    }

    private Handle createRoot() {
        return new BinaryTreeNode(dispatcher, rootElem, true);
    }

    @Override
    protected void receive(Object message, Handle sender) {
        if (message instanceof Operation) {
            // during a cycle too: the old tree stays authoritative until the swap
            root.tell(message, self());
            return;
        }
        switch (state.kind) {
            case NORMAL:
                normal(message, sender);
                break;
            case COLLECTING_GARBAGE:
                collectingGarbage(message, sender);
                break;
        }
    }

    private void normal(Object message, Handle sender) {
        if (message == Command.GC) {
            Handle newRoot = createRoot();
            state = State.collectingGarbage(newRoot);
            logger.info("Starting garbage collection cycle {}", cycles + 1);
            root.tell(new BinaryTreeNode.CopyTo(newRoot), self());
        } else {
            logger.debug("Ignoring {} from {}", message, sender);
        }
    }

    private void collectingGarbage(Object message, Handle sender) {
        if (message == BinaryTreeNode.Signal.COPY_FINISHED) {
            Handle oldRoot = root;
            root = state.newRoot;
            state = State.NORMAL;
            cycles++;
            oldRoot.tell(BinaryTreeNode.Signal.TERMINATE, self());
            logger.info("Garbage collection cycle {} finished", cycles);
        } else if (message == Command.GC) {
            logger.debug("Garbage collection already in progress, ignoring trigger from {}", sender);
        } else {
            logger.debug("Ignoring {} from {} while collecting garbage", message, sender);
        }
    }
}
