package actorbst;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tunables for a tree set and the dispatcher running it.
 *
 * Defaults can be overridden with JVM system properties, e.g.
 * {@code -Dactorbst.dispatcher_threads=4}.
 */
public final class TreeSetConfig {
    public static final String PROPERTY_PREFIX = "actorbst.";
    public static final String DISPATCHER_THREADS_PROPERTY = PROPERTY_PREFIX + "dispatcher_threads";
    public static final String THROUGHPUT_PROPERTY = PROPERTY_PREFIX + "throughput";
    public static final String ROOT_ELEM_PROPERTY = PROPERTY_PREFIX + "root_elem";

    private static final int DEFAULT_THROUGHPUT = 32;
    private static final int DEFAULT_ROOT_ELEM = 0;

    private final int dispatcherThreads;
    private final int throughput;
    private final int rootElem;

    private TreeSetConfig(int dispatcherThreads, int throughput, int rootElem) {
        checkArgument(dispatcherThreads > 0, "dispatcher threads must be positive, got %s", dispatcherThreads);
        checkArgument(throughput > 0, "throughput must be positive, got %s", throughput);
        this.dispatcherThreads = dispatcherThreads;
        this.throughput = throughput;
        this.rootElem = rootElem;
    }

    public static TreeSetConfig defaults() {
        return new TreeSetConfig(Runtime.getRuntime().availableProcessors(), DEFAULT_THROUGHPUT, DEFAULT_ROOT_ELEM);
    }

    public static TreeSetConfig fromSystemProperties() {
        TreeSetConfig d = defaults();
        return new TreeSetConfig(Integer.getInteger(DISPATCHER_THREADS_PROPERTY, d.dispatcherThreads),
                                 Integer.getInteger(THROUGHPUT_PROPERTY, d.throughput),
                                 Integer.getInteger(ROOT_ELEM_PROPERTY, d.rootElem));
    }

    public TreeSetConfig withDispatcherThreads(int threads) {
        return new TreeSetConfig(threads, throughput, rootElem);
    }

    public TreeSetConfig withThroughput(int messagesPerSlot) {
        return new TreeSetConfig(dispatcherThreads, messagesPerSlot, rootElem);
    }

    public TreeSetConfig withRootElem(int elem) {
        return new TreeSetConfig(dispatcherThreads, throughput, elem);
    }

    public int dispatcherThreads() {
        return dispatcherThreads;
    }

    /** Messages a task handles before yielding its thread. */
    public int throughput() {
        return throughput;
    }

    /** Element held by the sentinel root of every tree generation. */
    public int rootElem() {
        return rootElem;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("dispatcherThreads", dispatcherThreads)
                          .add("throughput", throughput)
                          .add("rootElem", rootElem)
                          .toString();
    }
}
