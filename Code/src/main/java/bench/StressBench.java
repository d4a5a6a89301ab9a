package bench;

import actorbst.TreeSetClient;
import actorbst.TreeSetConfig;

import java.util.Random;
import java.util.TreeSet;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Throughput of the message-passing tree set under a mixed workload with
 * periodic garbage collection, followed by a single-threaded check against
 * java.util.TreeSet.
 *
 * Usage: StressBench [threads] [seconds] [keyRange]
 */
public class StressBench {

    private static final long GC_PERIOD_MILLIS = 250;
    private static final long OP_TIMEOUT_SECONDS = 10;
    private static final long QUIESCENCE_SAMPLE_MILLIS = 200;
    private static final int QUIESCENCE_MAX_SAMPLES = 50;

    public static void main(String[] args) throws Exception {
        int threads = (args.length >= 1) ? Integer.parseInt(args[0]) : Runtime.getRuntime().availableProcessors();
        int seconds = (args.length >= 2) ? Integer.parseInt(args[1]) : 3;
        int keyRange = (args.length >= 3) ? Integer.parseInt(args[2]) : 10_000;

        System.out.println("========================================");
        System.out.println("Message-passing tree set stress bench");
        System.out.println(threads + " client threads, " + seconds + " seconds, keys 0-" + (keyRange - 1));
        System.out.println("========================================\n");

        try (TreeSetClient set = new TreeSetClient(TreeSetConfig.fromSystemProperties())) {
            runWorkload(set, threads, seconds, keyRange);
            awaitQuiescence(set);
            verify(set, keyRange);
        }
    }

    static void runWorkload(TreeSetClient set, int threads, int seconds, int keyRange) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        ScheduledExecutorService gcTimer = Executors.newSingleThreadScheduledExecutor();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch stop = new CountDownLatch(threads);
        AtomicLong gcTriggers = new AtomicLong();

        final long endAt = System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds);
        final ConcurrentLinkedQueue<Long> counts = new ConcurrentLinkedQueue<>();

        for (int t = 0; t < threads; t++) {
            final int tid = t + 1;
            pool.submit(() -> {
                try {
                    Random rnd = new Random(tid * 1000);
                    long ops = 0;
                    start.await();
                    while (System.nanoTime() < endAt) {
                        int key = rnd.nextInt(keyRange);
                        int r = rnd.nextInt(100);
                        // 30% inserts, 20% removes, 50% contains
                        if (r < 30) { set.insert(key).get(OP_TIMEOUT_SECONDS, TimeUnit.SECONDS); }
                        else if (r < 50) { set.remove(key).get(OP_TIMEOUT_SECONDS, TimeUnit.SECONDS); }
                        else { set.contains(key).get(OP_TIMEOUT_SECONDS, TimeUnit.SECONDS); }
                        ops++;
                    }
                    counts.add(ops);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (ExecutionException | TimeoutException e) {
                    System.err.printf("[Thread %d] operation failed: %s%n", tid, e);
                } finally {
                    stop.countDown();
                }
            });
        }

        gcTimer.scheduleAtFixedRate(() -> {
            set.collectGarbage();
            gcTriggers.incrementAndGet();
        }, GC_PERIOD_MILLIS, GC_PERIOD_MILLIS, TimeUnit.MILLISECONDS);

        start.countDown();
        stop.await();
        gcTimer.shutdownNow();
        pool.shutdown();

        long totalOps = counts.stream().mapToLong(Long::longValue).sum();
        double kopsPerSec = totalOps / (double) seconds / 1_000.0;

        System.out.printf("Threads=%d, Time=%ds, TotalOps=%d, Throughput=%.2f Kops/s, GC triggers=%d%n",
                threads, seconds, totalOps, kopsPerSec, gcTriggers.get());
        System.out.printf("Live tasks=%d, dead letters=%d%n",
                set.dispatcher().liveTasks(), set.dispatcher().deadLetters());
    }

    // A cycle still running drops writes made against the old tree, so wait until
    // no tasks are being created or stopped before building the reference.
    static void awaitQuiescence(TreeSetClient set) throws InterruptedException {
        long spawned = -1;
        int live = -1;
        for (int i = 0; i < QUIESCENCE_MAX_SAMPLES; i++) {
            long nowSpawned = set.dispatcher().spawnedTasks();
            int nowLive = set.dispatcher().liveTasks();
            if (nowSpawned == spawned && nowLive == live)
                return;
            spawned = nowSpawned;
            live = nowLive;
            Thread.sleep(QUIESCENCE_SAMPLE_MILLIS);
        }
        System.err.println("Tree did not settle, verification may report false mismatches");
    }

    static void verify(TreeSetClient set, int keyRange) throws Exception {
        System.out.println("\n========== Verification against TreeSet ==========");
        TreeSet<Integer> reference = new TreeSet<>();
        for (int k = 0; k < keyRange; k++) {
            if (set.contains(k).get(OP_TIMEOUT_SECONDS, TimeUnit.SECONDS))
                reference.add(k);
        }

        Random rnd = new Random(42);
        for (int i = 0; i < keyRange; i++) {
            int key = rnd.nextInt(keyRange);
            if (rnd.nextBoolean()) {
                set.insert(key).get(OP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                reference.add(key);
            } else {
                set.remove(key).get(OP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                reference.remove(key);
            }
        }
        set.collectGarbage();

        int mismatches = 0;
        for (int k = 0; k < keyRange; k++) {
            if (set.contains(k).get(OP_TIMEOUT_SECONDS, TimeUnit.SECONDS) != reference.contains(k))
                mismatches++;
        }

        if (mismatches == 0) {
            System.out.printf("✅ VERIFICATION PASSED: %d members match the reference%n", reference.size());
        } else {
            System.err.printf("❌ VERIFICATION FAILED: %d mismatching keys%n", mismatches);
        }
    }
}
