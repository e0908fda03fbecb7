package org.e2immu.analyzer.incremental.engine.unit;

import org.e2immu.analyzer.incremental.common.ProtocolViolationException;
import org.e2immu.analyzer.incremental.engine.log.AnalysisListener;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/*
FIFO of analysis units awaiting (re-)analysis. A unit is in the queue at most once: membership is the in-queue
flag of the unit, which is set and cleared together with the insertion and removal.
 */
public class WorkQueue {
    private final Deque<AnalysisUnit> deque = new ArrayDeque<>();
    private final AnalysisListener listener;

    public WorkQueue(AnalysisListener listener) {
        this.listener = listener;
    }

    /**
     * @return false when the unit was queued already
     */
    public synchronized boolean enqueue(AnalysisUnit unit) {
        if (unit.isForEval()) {
            throw new ProtocolViolationException("Eval-only units never enter the queue: " + unit);
        }
        if (unit.isInQueue()) return false;
        unit.setInQueue(true);
        deque.addLast(unit);
        listener.enqueued(unit, deque.size());
        return true;
    }

    // put a unit that was dequeued but not analyzed back at the head
    public synchronized void pushFront(AnalysisUnit unit) {
        if (unit.isInQueue()) return;
        unit.setInQueue(true);
        deque.addFirst(unit);
    }

    @Nullable
    public synchronized AnalysisUnit dequeue() {
        AnalysisUnit unit = deque.pollFirst();
        if (unit == null) return null;
        if (!unit.isInQueue()) {
            throw new ProtocolViolationException("Dequeued unit without in-queue flag: " + unit);
        }
        unit.setInQueue(false);
        listener.dequeued(unit, deque.size());
        return unit;
    }

    public synchronized int size() {
        return deque.size();
    }

    public synchronized boolean isEmpty() {
        return deque.isEmpty();
    }

    public synchronized List<AnalysisUnit> contents() {
        return List.copyOf(deque);
    }
}
