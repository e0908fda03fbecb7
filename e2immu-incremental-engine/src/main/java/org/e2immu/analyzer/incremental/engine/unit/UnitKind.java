package org.e2immu.analyzer.incremental.engine.unit;

/*
The closed set of analysis unit variants. They share all state in AnalysisUnit, and differ only in their pass.
 */
public enum UnitKind {
    MODULE(new ModuleAnalysisPass()),
    FUNCTION(new FunctionAnalysisPass()),
    COMPREHENSION(new ScopeAnalysisPass()),
    QUERY(new QueryAnalysisPass());

    private final AnalysisPass pass;

    UnitKind(AnalysisPass pass) {
        this.pass = pass;
    }

    AnalysisPass pass() {
        return pass;
    }
}
