package actorbst;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Client request against the set. The node that settles the request sends
 * exactly one {@link OperationReply} carrying {@link #id()} to {@link #requester()}.
 *
 * Ids are chosen by the caller and are neither checked nor deduplicated.
 */
public abstract class Operation {
    private final Handle requester;
    private final int id;
    private final int elem;

    private Operation(Handle requester, int id, int elem) {
        this.requester = Objects.requireNonNull(requester, "requester");
        this.id = id;
        this.elem = elem;
    }

    public final Handle requester() {
        return requester;
    }

    public final int id() {
        return id;
    }

    public final int elem() {
        return elem;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Operation that = (Operation) o;
        return requester == that.requester && id == that.id && elem == that.elem;
    }

    @Override
    public final int hashCode() {
        return Objects.hash(getClass(), System.identityHashCode(requester), id, elem);
    }

    @Override
    public final String toString() {
        return MoreObjects.toStringHelper(this).add("id", id).add("elem", elem).add("requester", requester).toString();
    }

    /** Adds {@code elem}; answered with {@link OperationReply.OperationFinished}. */
    public static final class Insert extends Operation {
        public Insert(Handle requester, int id, int elem) {
            super(requester, id, elem);
        }
    }

    /** Membership test; answered with {@link OperationReply.ContainsResult}. */
    public static final class Contains extends Operation {
        public Contains(Handle requester, int id, int elem) {
            super(requester, id, elem);
        }
    }

    /** Removes {@code elem}, a no-op if absent; answered with {@link OperationReply.OperationFinished}. */
    public static final class Remove extends Operation {
        public Remove(Handle requester, int id, int elem) {
            super(requester, id, elem);
        }
    }
}
