package actorbst;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import actorbst.Operation.Contains;
import actorbst.Operation.Insert;
import actorbst.Operation.Remove;
import actorbst.OperationReply.ContainsResult;
import actorbst.OperationReply.OperationFinished;

import static org.junit.jupiter.api.Assertions.*;

class BinaryTreeSetBasicTests {

    private Dispatcher dispatcher;
    private BinaryTreeSet set;
    private ReplyProbe requester;

    @BeforeEach
    void setUp() {
        dispatcher = new Dispatcher(TreeSetConfig.defaults().withDispatcherThreads(4));
        set = new BinaryTreeSet(dispatcher);
        requester = new ReplyProbe("requester");
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private Object ask(Operation op) throws InterruptedException {
        set.tell(op, requester);
        return requester.expectMessage();
    }

    @Test
    void insert_contains_remove_sequence() throws Exception {
        assertEquals(new OperationFinished(1), ask(new Insert(requester, 1, 5)));
        assertEquals(new OperationFinished(2), ask(new Insert(requester, 2, 3)));
        assertEquals(new OperationFinished(3), ask(new Insert(requester, 3, 8)));
        assertEquals(new ContainsResult(4, true), ask(new Contains(requester, 4, 3)));
        assertEquals(new OperationFinished(5), ask(new Remove(requester, 5, 3)));
        assertEquals(new ContainsResult(6, false), ask(new Contains(requester, 6, 3)));
        assertEquals(new ContainsResult(7, true), ask(new Contains(requester, 7, 5)));
        assertEquals(new ContainsResult(8, true), ask(new Contains(requester, 8, 8)));
    }

    @Test
    void empty_set_contains_nothing() throws Exception {
        for (int i = -3; i <= 3; i++) {
            assertEquals(new ContainsResult(i, false), ask(new Contains(requester, i, i)));
        }
    }

    @Test
    void removing_absent_element_is_a_successful_noop() throws Exception {
        assertEquals(new OperationFinished(1), ask(new Remove(requester, 1, 42)));
        assertEquals(new OperationFinished(2), ask(new Insert(requester, 2, 10)));
        assertEquals(new OperationFinished(3), ask(new Remove(requester, 3, 42)));
        assertEquals(new ContainsResult(4, false), ask(new Contains(requester, 4, 42)));
        assertEquals(new ContainsResult(5, true), ask(new Contains(requester, 5, 10)));
    }

    @Test
    void repeated_insert_is_idempotent() throws Exception {
        for (int id = 1; id <= 3; id++) {
            assertEquals(new OperationFinished(id), ask(new Insert(requester, id, 7)));
        }
        assertEquals(new ContainsResult(4, true), ask(new Contains(requester, 4, 7)));

        // a single remove undoes any number of inserts
        assertEquals(new OperationFinished(5), ask(new Remove(requester, 5, 7)));
        assertEquals(new ContainsResult(6, false), ask(new Contains(requester, 6, 7)));

        assertEquals(new OperationFinished(7), ask(new Insert(requester, 7, 7)));
        assertEquals(new ContainsResult(8, true), ask(new Contains(requester, 8, 7)));
    }

    @Test
    void sentinel_value_behaves_like_any_element() throws Exception {
        int sentinel = dispatcher.config().rootElem();
        assertEquals(new ContainsResult(1, false), ask(new Contains(requester, 1, sentinel)));
        assertEquals(new OperationFinished(2), ask(new Insert(requester, 2, sentinel)));
        assertEquals(new ContainsResult(3, true), ask(new Contains(requester, 3, sentinel)));
        assertEquals(new OperationFinished(4), ask(new Remove(requester, 4, sentinel)));
        assertEquals(new ContainsResult(5, false), ask(new Contains(requester, 5, sentinel)));
    }

    @Test
    void extreme_values_are_ordered_without_overflow() throws Exception {
        assertEquals(new OperationFinished(1), ask(new Insert(requester, 1, Integer.MAX_VALUE)));
        assertEquals(new OperationFinished(2), ask(new Insert(requester, 2, Integer.MIN_VALUE)));
        assertEquals(new OperationFinished(3), ask(new Insert(requester, 3, Integer.MAX_VALUE - 1)));
        assertEquals(new ContainsResult(4, true), ask(new Contains(requester, 4, Integer.MAX_VALUE)));
        assertEquals(new ContainsResult(5, true), ask(new Contains(requester, 5, Integer.MIN_VALUE)));
        assertEquals(new ContainsResult(6, true), ask(new Contains(requester, 6, Integer.MAX_VALUE - 1)));
        assertEquals(new ContainsResult(7, false), ask(new Contains(requester, 7, Integer.MIN_VALUE + 1)));
    }

    @Test
    void reply_goes_to_requester_not_sender() throws Exception {
        ReplyProbe sender = new ReplyProbe("sender");
        set.tell(new Insert(requester, 1, 4), sender);
        assertEquals(new OperationFinished(1), requester.expectMessage());
        set.tell(new Contains(requester, 2, 4), sender);
        assertEquals(new ContainsResult(2, true), requester.expectMessage());
        sender.expectNoMessage(100);
    }

    @Test
    void ids_are_echoed_verbatim_even_when_reused() throws Exception {
        assertEquals(new OperationFinished(-17), ask(new Insert(requester, -17, 1)));
        assertEquals(new OperationFinished(-17), ask(new Insert(requester, -17, 2)));
        assertEquals(new ContainsResult(-17, true), ask(new Contains(requester, -17, 2)));
    }

    @Test
    void every_node_is_a_task() throws Exception {
        assertEquals(2, dispatcher.liveTasks(), "coordinator and sentinel root");
        for (int i = 1; i <= 10; i++) {
            ask(new Insert(requester, i, i * 10));
        }
        ask(new Insert(requester, 11, 50));
        assertEquals(12, dispatcher.liveTasks());
    }
}
