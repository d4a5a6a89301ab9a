package actorbst;

import com.google.common.base.MoreObjects;

/**
 * Answer to an {@link Operation}, correlated by id.
 */
public abstract class OperationReply {
    private final int id;

    private OperationReply(int id) {
        this.id = id;
    }

    public final int id() {
        return id;
    }

    /** Completion of an insert or a remove. */
    public static final class OperationFinished extends OperationReply {
        public OperationFinished(int id) {
            super(id);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof OperationFinished && ((OperationFinished) o).id() == id();
        }

        @Override
        public int hashCode() {
            return id();
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("id", id()).toString();
        }
    }

    /** {@code result} is true iff the element was present when the request was answered. */
    public static final class ContainsResult extends OperationReply {
        private final boolean result;

        public ContainsResult(int id, boolean result) {
            super(id);
            this.result = result;
        }

        public boolean result() {
            return result;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ContainsResult))
                return false;
            ContainsResult that = (ContainsResult) o;
            return that.id() == id() && that.result == result;
        }

        @Override
        public int hashCode() {
            return 31 * id() + (result ? 1 : 0);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("id", id()).add("result", result).toString();
        }
    }
}
