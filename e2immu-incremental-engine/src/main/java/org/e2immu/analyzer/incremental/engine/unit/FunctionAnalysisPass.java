package org.e2immu.analyzer.incremental.engine.unit;

import org.e2immu.analyzer.incremental.common.ProtocolViolationException;
import org.e2immu.analyzer.incremental.engine.ddg.DDG;
import org.e2immu.analyzer.incremental.engine.scope.FunctionEnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.value.FunctionValue;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;

class FunctionAnalysisPass extends ScopeAnalysisPass {

    @Override
    public void analyze(AnalysisUnit unit, DDG ddg) {
        if (!(unit.scope() instanceof FunctionEnvironmentRecord functionScope)) {
            throw new ProtocolViolationException("Function unit " + unit + " does not execute in a function scope");
        }
        FunctionValue function = functionScope.function();
        for (String parameter : function.parameters()) {
            functionScope.getVariable(unit.ast(), unit, parameter, true);
        }
        super.analyze(unit, ddg);

        VariableDef returnValue = function.returnValue();
        if (returnValue.clearOldValues()) {
            returnValue.enqueueDependents();
        } else {
            returnValue.forgetFormerDependents();
        }
    }
}
