package org.e2immu.analyzer.incremental.engine.unit;

import org.e2immu.analyzer.incremental.engine.ddg.DDG;
import org.e2immu.analyzer.incremental.engine.scope.ModuleEnvironmentRecord;

/*
The linked variables are an index derived during the walk, so they are rebuilt on every pass.
After the walk, every variable of the module scope is swept, not only the ones touched in this pass.
 */
class ModuleAnalysisPass implements AnalysisPass {

    @Override
    public void analyze(AnalysisUnit unit, DDG ddg) {
        ModuleEnvironmentRecord moduleScope = unit.declaringModule().scope();
        moduleScope.clearLinkedVariables();

        ddg.setCurrentUnit(unit);
        unit.ast().walk(ddg);

        StaleValueSweeper.sweep(unit, moduleScope);
    }
}
