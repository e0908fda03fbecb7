package org.e2immu.analyzer.incremental.engine.unit;

import org.e2immu.analyzer.incremental.common.ProtocolViolationException;
import org.e2immu.analyzer.incremental.engine.CommonTest;
import org.e2immu.analyzer.incremental.engine.StepNode;
import org.e2immu.analyzer.incremental.engine.StepTree;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.log.AnalysisListener;
import org.e2immu.analyzer.incremental.engine.scope.DeclarativeEnvironmentRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.e2immu.analyzer.incremental.engine.StepNode.step;
import static org.junit.jupiter.api.Assertions.*;

public class TestWorkQueue extends CommonTest {
    private WorkQueue queue;
    private AnalysisUnit u1;
    private AnalysisUnit u2;

    @BeforeEach
    public void beforeEachQueue() {
        queue = new WorkQueue(AnalysisListener.NONE);
        ProjectEntry m = analyzer.addEntry("m");
        StepTree tree = tree("m", step("c1", (ddg, n) -> {
        }), step("c2", (ddg, n) -> {
        }));
        m.updateTree(tree);
        StepNode root = (StepNode) tree.root();
        u1 = new AnalysisUnit(root.child(0), new DeclarativeEnvironmentRecord(m.module().arena(),
                m.module().scope(), "c1"), UnitKind.COMPREHENSION);
        u2 = new AnalysisUnit(root.child(1), new DeclarativeEnvironmentRecord(m.module().arena(),
                m.module().scope(), "c2"), UnitKind.COMPREHENSION);
    }

    @Test
    public void testIdempotent() {
        assertTrue(queue.enqueue(u1));
        assertFalse(queue.enqueue(u1));
        assertEquals(1, queue.size());
        assertTrue(u1.isInQueue());
    }

    @Test
    public void testFifo() {
        queue.enqueue(u2);
        queue.enqueue(u1);
        assertEquals(List.of(u2, u1), queue.contents());
        assertSame(u2, queue.dequeue());
        assertFalse(u2.isInQueue());
        assertTrue(u1.isInQueue());

        // may re-enter once it has left
        assertTrue(queue.enqueue(u2));
        assertSame(u1, queue.dequeue());
        assertSame(u2, queue.dequeue());
        assertNull(queue.dequeue());
        assertTrue(queue.isEmpty());
    }

    @Test
    public void testPushFront() {
        queue.enqueue(u1);
        queue.enqueue(u2);
        AnalysisUnit head = queue.dequeue();
        assertSame(u1, head);
        queue.pushFront(head);
        assertTrue(u1.isInQueue());
        assertEquals(List.of(u1, u2), queue.contents());
    }

    @Test
    public void testEvalOnlyNeverEnters() {
        AnalysisUnit query = u1.copyForQuery();
        assertThrows(ProtocolViolationException.class, () -> queue.enqueue(query));
        query.enqueue();
        assertTrue(analyzer.queue().contents().stream().noneMatch(u -> u == query));
        assertFalse(query.isInQueue());
    }

    @Test
    public void testUnitEnqueueFromSeveralThreads() throws InterruptedException {
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            Thread thread = new Thread(() -> {
                for (int j = 0; j < 100; j++) u1.enqueue();
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads) thread.join();
        assertEquals(1, analyzer.queue().contents().stream().filter(u -> u == u1).count());
        assertTrue(u1.isInQueue());
    }
}
