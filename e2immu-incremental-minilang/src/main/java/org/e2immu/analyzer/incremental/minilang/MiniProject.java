package org.e2immu.analyzer.incremental.minilang;

import org.e2immu.analyzer.incremental.common.CancellationToken;
import org.e2immu.analyzer.incremental.engine.IncrementalAnalyzer;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.impl.IncrementalAnalyzerImpl;
import org.e2immu.analyzer.incremental.engine.query.ModuleAnalysis;
import org.e2immu.analyzer.incremental.engine.value.AnalysisSet;
import org.e2immu.analyzer.incremental.minilang.analysis.MiniDDG;
import org.e2immu.analyzer.incremental.minilang.ast.MiniTree;
import org.e2immu.analyzer.incremental.minilang.parser.MiniParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A project of mini language sources, one module per source. Sources are parsed when they are set;
 * {@link #analyze()} drains the work queue until the analysis has reached a fixed point again.
 */
public class MiniProject {
    private static final Logger LOGGER = LoggerFactory.getLogger(MiniProject.class);

    private final IncrementalAnalyzer analyzer;
    private final MiniDDG ddg;

    public MiniProject(IncrementalAnalyzer.Configuration configuration) {
        this.analyzer = new IncrementalAnalyzerImpl(configuration);
        this.ddg = new MiniDDG(analyzer);
    }

    public IncrementalAnalyzer analyzer() {
        return analyzer;
    }

    /**
     * Add a new module, or replace the source of an existing one.
     * A source that does not parse leaves the project as it was.
     */
    public ProjectEntry setSource(String name, String source) {
        MiniTree tree = MiniParser.parse(name, source);
        ProjectEntry entry = analyzer.entry(name);
        if (entry == null) {
            entry = analyzer.addEntry(name);
            LOGGER.info("Added module {}", name);
        }
        entry.updateTree(tree);
        return entry;
    }

    public void removeSource(String name) {
        ProjectEntry entry = analyzer.entry(name);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown module " + name);
        }
        analyzer.removeEntry(entry);
    }

    public IncrementalAnalyzer.Output analyze() {
        return analyzer.analyzeQueue(ddg);
    }

    public IncrementalAnalyzer.Output analyze(CancellationToken cancellationToken) {
        return analyzer.analyzeQueue(ddg, cancellationToken);
    }

    public ModuleAnalysis moduleAnalysis(String name) {
        ProjectEntry entry = analyzer.entry(name);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown module " + name);
        }
        return new ModuleAnalysis(entry, ddg);
    }

    // evaluate an expression in the scope of the module
    public AnalysisSet evaluate(String moduleName, String expression) {
        return moduleAnalysis(moduleName).evaluate(MiniParser.parseExpression(expression));
    }
}
