package org.e2immu.analyzer.incremental.engine.unit;

import org.e2immu.analyzer.incremental.engine.ddg.DDG;

/*
Units nested in a module walk their node, and sweep their own scope.
 */
class ScopeAnalysisPass implements AnalysisPass {

    @Override
    public void analyze(AnalysisUnit unit, DDG ddg) {
        ddg.setCurrentUnit(unit);
        unit.ast().walk(ddg);

        StaleValueSweeper.sweep(unit, unit.scope());
    }
}
