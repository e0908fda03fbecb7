package org.e2immu.analyzer.incremental.minilang.analysis;

import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.value.AnalysisSet;
import org.e2immu.analyzer.incremental.engine.value.AnalysisValue;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;

/*
One array value per array literal or comprehension, per tree. All elements share one variable;
iterating registers the reader as a dependent of that variable.
 */
public class ArrayValue implements AnalysisValue {
    private final VariableDef elements;

    public ArrayValue(String position) {
        this.elements = new VariableDef("<elements " + position + ">");
    }

    public void addElements(AnalysisUnit unit, AnalysisSet values) {
        elements.addTypes(unit, values);
    }

    public AnalysisSet elementTypes() {
        return elements.types();
    }

    @Override
    public String description() {
        return "Array";
    }

    @Override
    public AnalysisSet getMember(Node node, AnalysisUnit unit, String name) {
        if ("length".equals(name)) return AnalysisSet.of(BuiltinTypes.NUMBER);
        return AnalysisSet.EMPTY;
    }

    @Override
    public AnalysisSet iterate(Node node, AnalysisUnit unit) {
        elements.addReference(node, unit);
        return elements.types();
    }

    @Override
    public String toString() {
        return "Array of " + elements.types();
    }
}
