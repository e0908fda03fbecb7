package org.e2immu.analyzer.incremental.engine.value;

import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.scope.EnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.scope.FunctionEnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.scope.ScopeArena;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.unit.UnitKind;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;

import java.util.List;

/**
 * The value of a function declaration. There is exactly one per declaration node and tree; it owns the
 * function's scope, the unit that analyzes the body, and the variable collecting the returned values.
 * <p>
 * A call merges the argument sets into the parameters, under the caller's unit, and reads the return variable.
 * The function unit is a dependent of its parameters, so a call with new argument values re-queues it;
 * the caller is a dependent of the return variable.
 */
public class FunctionValue implements AnalysisValue {
    private final String name;
    private final List<String> parameters;
    private final FunctionEnvironmentRecord scope;
    private final AnalysisUnit unit;
    private final VariableDef returnValue;

    public FunctionValue(String name, List<String> parameters, EnvironmentRecord parentScope, ScopeArena arena,
                         Node body) {
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.scope = new FunctionEnvironmentRecord(arena, parentScope, this);
        this.unit = new AnalysisUnit(body, scope, UnitKind.FUNCTION);
        this.returnValue = new VariableDef("<return " + name + ">");
    }

    public String name() {
        return name;
    }

    public List<String> parameters() {
        return parameters;
    }

    public FunctionEnvironmentRecord scope() {
        return scope;
    }

    public AnalysisUnit unit() {
        return unit;
    }

    public VariableDef returnValue() {
        return returnValue;
    }

    @Override
    public String description() {
        return "Function " + name;
    }

    @Override
    public AnalysisSet call(Node node, AnalysisUnit caller, List<AnalysisSet> arguments) {
        if (!caller.isForEval()) {
            int n = Math.min(parameters.size(), arguments.size());
            for (int i = 0; i < n; i++) {
                VariableDef parameter = scope.getVariable(node, caller, parameters.get(i), true);
                assert parameter != null;
                parameter.addTypes(caller, arguments.get(i));
            }
            ProjectEntry callerEntry = caller.projectEntry();
            if (n > 0 && callerEntry != unit.projectEntry()) {
                callerEntry.addContributionTarget(unit);
            }
        }
        returnValue.addReference(node, caller);
        return returnValue.types();
    }

    @Override
    public String toString() {
        return description();
    }
}
