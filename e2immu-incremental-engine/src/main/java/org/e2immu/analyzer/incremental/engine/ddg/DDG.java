package org.e2immu.analyzer.incremental.engine.ddg;

import org.e2immu.analyzer.incremental.common.ProtocolViolationException;
import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.common.syntax.Visitor;
import org.e2immu.analyzer.incremental.engine.scope.DeclarativeEnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.scope.EnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.scope.FunctionEnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.unit.UnitKind;
import org.e2immu.analyzer.incremental.engine.value.AnalysisSet;
import org.e2immu.analyzer.incremental.engine.value.FunctionValue;
import org.e2immu.analyzer.incremental.engine.value.ModuleValue;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Data dependency graph builder: walks the syntax node of the current analysis unit and applies the inference
 * rules of the language. The rules themselves live in subclasses; this class provides the operations through
 * which the rules must read and write analysis state, so that every read is tracked as a dependency and every
 * write is a monotonic merge.
 * <p>
 * When the current unit is eval-only, the operations read without registering, and never write.
 */
public abstract class DDG implements Visitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(DDG.class);

    private AnalysisUnit currentUnit;

    public void setCurrentUnit(AnalysisUnit currentUnit) {
        this.currentUnit = currentUnit;
    }

    public AnalysisUnit currentUnit() {
        if (currentUnit == null) {
            throw new ProtocolViolationException("Walking a syntax tree without current analysis unit");
        }
        return currentUnit;
    }

    /**
     * The value-set of an expression. Called by rules for sub-expressions, and by queries.
     */
    public abstract AnalysisSet evaluate(Node expression);

    public AnalysisSet evaluateInUnit(AnalysisUnit unit, Node expression) {
        AnalysisUnit previous = currentUnit;
        currentUnit = unit;
        try {
            return evaluate(expression);
        } finally {
            currentUnit = previous;
        }
    }

    protected AnalysisSet lookup(Node node, String name) {
        return currentUnit().findValueByName(node, name);
    }

    protected ModuleValue module() {
        return currentUnit().declaringModule();
    }

    /**
     * Declare a variable in the scope of the current unit. In eval mode, only an existing variable is returned.
     */
    @Nullable
    protected VariableDef declare(Node node, String name) {
        AnalysisUnit unit = currentUnit();
        return unit.scope().getVariable(node, unit, name, !unit.isForEval());
    }

    /**
     * Merge values into the variable the name resolves to; an undeclared name is assigned in the module scope.
     */
    protected void assign(Node node, String name, AnalysisSet values) {
        AnalysisUnit unit = currentUnit();
        if (unit.isForEval()) return;
        EnvironmentRecord outermost = null;
        for (EnvironmentRecord scope : unit.scope().enumerateTowardsGlobal()) {
            VariableDef variable = scope.getVariable(node, unit, name, false);
            if (variable != null) {
                variable.addTypes(unit, values);
                return;
            }
            outermost = scope;
        }
        VariableDef variable = outermost.getVariable(node, unit, name, true);
        assert variable != null;
        variable.addTypes(unit, values);
    }

    /**
     * One function value per declaration node and tree. A new function's unit is registered with the module
     * and enqueued. In eval mode, only an existing function value is returned.
     */
    @Nullable
    protected FunctionValue declareFunction(Node declaration, Node body, String name, List<String> parameters) {
        AnalysisUnit unit = currentUnit();
        ModuleValue module = unit.declaringModule();
        FunctionValue functionValue = module.nodeValue(declaration, FunctionValue.class);
        if (functionValue != null || unit.isForEval()) return functionValue;

        FunctionValue created = new FunctionValue(name, parameters, unit.scope(), module.arena(), body);
        module.getOrCreateNodeValue(declaration, FunctionValue.class, () -> created);
        module.registerUnit(created.unit());
        LOGGER.debug("New function {} in {}", name, unit);
        created.unit().enqueue();
        return created;
    }

    /**
     * One comprehension unit per comprehension node and tree, executing in its own scope nested in the current
     * one. Its syntax node is the comprehension node itself. In eval mode, only an existing unit is returned.
     */
    @Nullable
    protected AnalysisUnit declareComprehension(Node node, String name) {
        AnalysisUnit unit = currentUnit();
        ModuleValue module = unit.declaringModule();
        AnalysisUnit comprehension = module.nodeValue(node, AnalysisUnit.class);
        if (comprehension != null || unit.isForEval()) return comprehension;

        DeclarativeEnvironmentRecord scope = new DeclarativeEnvironmentRecord(module.arena(), unit.scope(), name);
        AnalysisUnit created = new AnalysisUnit(node, scope, UnitKind.COMPREHENSION);
        module.getOrCreateNodeValue(node, AnalysisUnit.class, () -> created);
        module.registerUnit(created);
        created.enqueue();
        return created;
    }

    /**
     * Merge values into the return variable of the innermost enclosing function.
     */
    protected void returnValues(Node node, AnalysisSet values) {
        AnalysisUnit unit = currentUnit();
        for (EnvironmentRecord scope : unit.scope().enumerateTowardsGlobal()) {
            if (scope instanceof FunctionEnvironmentRecord functionScope) {
                functionScope.function().returnValue().addTypes(unit, values);
                return;
            }
        }
        LOGGER.debug("Return outside function in {}", unit);
    }

    /**
     * Make <code>alias</code> a name in the module scope for the variable <code>target</code> resolves to.
     * Readers of the alias also depend on the target variable. Linked variables are rebuilt by every module pass.
     */
    protected void linkVariable(Node node, String alias, String target) {
        AnalysisUnit unit = currentUnit();
        AnalysisSet values = unit.findValueByName(node, target);
        if (unit.isForEval()) return;
        EnvironmentRecord moduleScope = unit.declaringModule().scope();
        for (EnvironmentRecord scope : unit.scope().enumerateTowardsGlobal()) {
            VariableDef targetVariable = scope.getVariable(node, unit, target, false);
            if (targetVariable != null) {
                moduleScope.addLinkedVariable(alias, targetVariable);
                break;
            }
        }
        VariableDef aliasVariable = moduleScope.getVariable(node, unit, alias, true);
        assert aliasVariable != null;
        aliasVariable.addTypes(unit, values);
    }
}
