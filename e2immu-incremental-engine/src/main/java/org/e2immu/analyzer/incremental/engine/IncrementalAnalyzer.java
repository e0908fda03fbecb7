package org.e2immu.analyzer.incremental.engine;

import org.e2immu.analyzer.incremental.common.AnalyzerException;
import org.e2immu.analyzer.incremental.common.CancellationToken;
import org.e2immu.analyzer.incremental.engine.ddg.DDG;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.log.AnalysisListener;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.unit.WorkQueue;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;

/**
 * Owns the project entries and the work queue, and drains the queue until a fixed point has been reached.
 * Draining and structural edits (tree updates, entry removal) are serialized on one lock.
 */
public interface IncrementalAnalyzer {

    interface Configuration {
        // 0 means: no limit
        int maxUnitAnalyses();

        boolean storeErrors();

        long slowUnitThresholdMillis();
    }

    interface Output {
        int unitsAnalyzed();

        // true when the queue was drained completely
        boolean completed();

        boolean cancelled();

        int remainingInQueue();

        List<AnalyzerException> analyzerExceptions();
    }

    ProjectEntry addEntry(String name);

    @Nullable
    ProjectEntry entry(String name);

    Collection<ProjectEntry> entries();

    void removeEntry(ProjectEntry entry);

    // the unit is enqueued when an entry with that name is added
    void awaitEntry(String name, AnalysisUnit unit);

    WorkQueue queue();

    AnalysisListener listener();

    Output analyzeQueue(DDG ddg, CancellationToken cancellationToken);

    default Output analyzeQueue(DDG ddg) {
        return analyzeQueue(ddg, CancellationToken.NONE);
    }
}
