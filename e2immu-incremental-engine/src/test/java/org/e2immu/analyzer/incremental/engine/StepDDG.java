package org.e2immu.analyzer.incremental.engine;

import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.engine.ddg.DDG;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.value.AnalysisSet;
import org.e2immu.analyzer.incremental.engine.value.FunctionValue;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;

import java.util.List;

// runs the code of the step nodes, and makes the protected operations of the DDG available to them
public class StepDDG extends DDG {

    @Override
    public boolean walk(Node node) {
        return ((StepNode) node).run(this);
    }

    @Override
    public AnalysisSet evaluate(Node expression) {
        return ((StepNode) expression).evaluate(this);
    }

    public AnalysisSet read(Node node, String name) {
        return lookup(node, name);
    }

    public VariableDef declareVariable(Node node, String name) {
        return declare(node, name);
    }

    public void write(Node node, String name, AnalysisSet values) {
        assign(node, name, values);
    }

    public FunctionValue function(StepNode declaration, String name, String... parameters) {
        return declareFunction(declaration, declaration.child(0), name, List.of(parameters));
    }

    public void returns(Node node, AnalysisSet values) {
        returnValues(node, values);
    }

    public AnalysisUnit comprehension(Node node, String name) {
        return declareComprehension(node, name);
    }

    public void link(Node node, String alias, String target) {
        linkVariable(node, alias, target);
    }
}
