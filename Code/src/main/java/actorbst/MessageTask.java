package actorbst;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A unit of execution with private state and an inbound mailbox.
 *
 * Messages are handled one at a time, in arrival order, by whichever
 * dispatcher thread currently owns the mailbox; {@link #receive} never runs
 * concurrently with itself, so subclasses keep plain (non-volatile) fields.
 * Hand-over between threads goes through the mailbox queue and the
 * {@code scheduled} flag, which gives the happens-before edge.
 *
 * If {@link #receive} throws, the failure is logged, the message is dropped
 * and the task carries on with its state as it was.
 */
public abstract class MessageTask implements Handle {
    private static final Logger logger = LoggerFactory.getLogger(MessageTask.class);

    private static final class Envelope {
        final Object message;
        final Handle sender;

        Envelope(Object message, Handle sender) {
            this.message = message;
            this.sender = sender;
        }
    }

    protected final Dispatcher dispatcher;
    private final String name;
    private final int throughput;
    private final Queue<Envelope> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private volatile boolean stopped;

    protected MessageTask(Dispatcher dispatcher, String name) {
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.name = name;
        this.throughput = dispatcher.config().throughput();
        dispatcher.taskStarted(this);
    }

    /** Handles one message. Called by a single thread at a time. */
    protected abstract void receive(Object message, Handle sender);

    @Override
    public final void tell(Object message, Handle sender) {
        Objects.requireNonNull(message, "message");
        if (stopped) {
            dispatcher.deadLetter(this, message);
            return;
        }
        mailbox.offer(new Envelope(message, sender));
        trySchedule();
    }

    /**
     * Stops this task once the current message is handled. Anything left in, or
     * later sent to, the mailbox becomes a dead letter. Only call from {@link #receive}.
     */
    protected final void stop() {
        if (!stopped) {
            stopped = true;
            dispatcher.taskStopped(this);
        }
    }

    protected final Handle self() {
        return this;
    }

    public final boolean isStopped() {
        return stopped;
    }

    //--------------------------------------------------------------------------------
    // Mailbox scheduling
    //--------------------------------------------------------------------------------

    private void trySchedule() {
        if (scheduled.compareAndSet(false, true)) {
            if (!dispatcher.schedule(this::drain)) {
                scheduled.set(false);
                discardMailbox();
            }
        }
    }

    private void drain() {
        try {
            for (int i = 0; i < throughput; i++) {
                if (stopped) {
                    discardMailbox();
                    return;
                }
                Envelope envelope = mailbox.poll();
                if (envelope == null)
                    return;
                deliver(envelope);
            }
        } finally {
            scheduled.set(false);
            if (!mailbox.isEmpty())
                trySchedule();
        }
    }

    private void deliver(Envelope envelope) {
        try {
            receive(envelope.message, envelope.sender);
        } catch (RuntimeException e) {
            logger.error("{} failed handling {} from {}, message dropped", this, envelope.message, envelope.sender, e);
        }
    }

    private void discardMailbox() {
        Envelope envelope;
        while ((envelope = mailbox.poll()) != null)
            dispatcher.deadLetter(this, envelope.message);
    }

    @Override
    public String toString() {
        return name;
    }
}
