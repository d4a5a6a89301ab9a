package actorbst;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class MessageTaskTest {

    /** Records every message; fails on "boom", stops on "stop", counts overlapping calls. */
    static final class RecordingTask extends MessageTask {
        final List<Object> received = new ArrayList<>();
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        final AtomicInteger handled = new AtomicInteger();

        RecordingTask(Dispatcher dispatcher) {
            super(dispatcher, "recorder");
        }

        @Override
        protected void receive(Object message, Handle sender) {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                if ("boom".equals(message))
                    throw new IllegalStateException("boom");
                if ("stop".equals(message)) {
                    stop();
                    return;
                }
                received.add(message);
            } finally {
                inFlight.decrementAndGet();
                handled.incrementAndGet();
            }
        }
    }

    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new Dispatcher(TreeSetConfig.defaults().withDispatcherThreads(4).withThroughput(3));
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    @Test
    void messages_from_one_sender_are_handled_in_order() {
        RecordingTask task = new RecordingTask(dispatcher);
        for (int i = 0; i < 10_000; i++) {
            task.tell(i, null);
        }
        await().atMost(10, TimeUnit.SECONDS).until(() -> task.handled.get() == 10_000);

        for (int i = 0; i < 10_000; i++) {
            assertEquals(i, task.received.get(i));
        }
    }

    @Test
    void a_task_never_handles_two_messages_at_once() throws Exception {
        RecordingTask task = new RecordingTask(dispatcher);
        int senders = 8;
        int perSender = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(senders);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < senders; t++) {
            final int base = t * perSender;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perSender; i++) {
                    task.tell(base + i, null);
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        await().atMost(10, TimeUnit.SECONDS).until(() -> task.handled.get() == senders * perSender);
        assertEquals(1, task.maxInFlight.get());
        assertEquals(senders * perSender, task.received.size());
    }

    @Test
    void failing_message_is_dropped_and_the_task_resumes() {
        RecordingTask task = new RecordingTask(dispatcher);
        task.tell("a", null);
        task.tell("boom", null);
        task.tell("b", null);

        await().atMost(5, TimeUnit.SECONDS).until(() -> task.handled.get() == 3);
        assertEquals(List.of("a", "b"), task.received);
        assertFalse(task.isStopped());
    }

    @Test
    void stopped_task_turns_messages_into_dead_letters() {
        RecordingTask task = new RecordingTask(dispatcher);
        assertEquals(1, dispatcher.liveTasks());

        task.tell("a", null);
        task.tell("stop", null);
        await().atMost(5, TimeUnit.SECONDS).until(task::isStopped);
        assertEquals(0, dispatcher.liveTasks());
        assertEquals(1, dispatcher.spawnedTasks());

        long before = dispatcher.deadLetters();
        task.tell("late", null);
        task.tell("later", null);
        assertEquals(before + 2, dispatcher.deadLetters());
        assertEquals(List.of("a"), task.received);
    }

    @Test
    void messages_after_shutdown_are_dead_letters() {
        RecordingTask task = new RecordingTask(dispatcher);
        dispatcher.close();
        assertTrue(dispatcher.isShutdown());

        task.tell("a", null);
        assertEquals(1, dispatcher.deadLetters());
        assertTrue(task.received.isEmpty());
    }

    @Test
    void null_message_is_rejected() {
        RecordingTask task = new RecordingTask(dispatcher);
        assertThrows(NullPointerException.class, () -> task.tell(null, null));
    }
}
