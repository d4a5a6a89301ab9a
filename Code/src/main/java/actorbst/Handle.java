package actorbst;

/**
 * Address of something that accepts messages: a tree node, the coordinator,
 * or a client waiting for replies.
 *
 * Handles compare by identity.
 */
@FunctionalInterface
public interface Handle {

    /**
     * Delivers {@code message} asynchronously. {@code sender} may be null when
     * the message has no meaningful origin.
     */
    void tell(Object message, Handle sender);
}
