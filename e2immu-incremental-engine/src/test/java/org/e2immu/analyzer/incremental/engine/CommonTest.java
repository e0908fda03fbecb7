package org.e2immu.analyzer.incremental.engine;

import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.impl.IncrementalAnalyzerImpl;
import org.e2immu.analyzer.incremental.engine.log.LoggingAnalysisListener;
import org.e2immu.analyzer.incremental.engine.scope.EnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.value.TypeValue;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

public abstract class CommonTest {
    protected static final TypeValue NUMBER = new TypeValue("Number");
    protected static final TypeValue STRING = new TypeValue("String");

    protected final boolean storeErrors;
    protected final int maxUnitAnalyses;

    protected IncrementalAnalyzer analyzer;
    protected StepDDG ddg;
    protected final List<AnalysisUnit> enqueued = new ArrayList<>();
    protected final List<String> removedVariables = new ArrayList<>();

    protected CommonTest() {
        this(false, 0);
    }

    protected CommonTest(boolean storeErrors, int maxUnitAnalyses) {
        this.storeErrors = storeErrors;
        this.maxUnitAnalyses = maxUnitAnalyses;
    }

    @BeforeEach
    public void beforeEach() {
        IncrementalAnalyzer.Configuration configuration = new IncrementalAnalyzerImpl.ConfigurationBuilder()
                .setStoreErrors(storeErrors)
                .setMaxUnitAnalyses(maxUnitAnalyses)
                .build();
        analyzer = new IncrementalAnalyzerImpl(configuration, new LoggingAnalysisListener(500) {
            @Override
            public void enqueued(AnalysisUnit unit, int queueSize) {
                super.enqueued(unit, queueSize);
                enqueued.add(unit);
            }

            @Override
            public void variableRemoved(EnvironmentRecord scope, String name) {
                super.variableRemoved(scope, name);
                removedVariables.add(name);
            }
        });
        ddg = new StepDDG();
    }

    protected static StepTree tree(String name, StepNode... steps) {
        return new StepTree(name, StepNode.block(name, steps));
    }

    protected ProjectEntry entry(String name, StepNode... steps) {
        ProjectEntry entry = analyzer.addEntry(name);
        entry.updateTree(tree(name, steps));
        return entry;
    }

    protected IncrementalAnalyzer.Output drain() {
        IncrementalAnalyzer.Output output = analyzer.analyzeQueue(ddg);
        assertTrue(output.completed());
        assertTrue(analyzer.queue().isEmpty());
        return output;
    }

    protected void clearEvents() {
        enqueued.clear();
        removedVariables.clear();
    }
}
