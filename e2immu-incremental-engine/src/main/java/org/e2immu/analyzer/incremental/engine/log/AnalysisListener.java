package org.e2immu.analyzer.incremental.engine.log;

import org.e2immu.analyzer.incremental.engine.scope.EnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;

/**
 * Observability hook of the engine: queue traffic, the time spent per unit, and variable eviction.
 * Called on the analysis thread; implementations must not modify the engine's state.
 */
public interface AnalysisListener {

    AnalysisListener NONE = new AnalysisListener() {
    };

    default void enqueued(AnalysisUnit unit, int queueSize) {
    }

    default void dequeued(AnalysisUnit unit, int queueSize) {
    }

    default void unitAnalyzed(AnalysisUnit unit, long nanos) {
    }

    default void variableRemoved(EnvironmentRecord scope, String name) {
    }
}
