package org.e2immu.analyzer.incremental.engine.value;

/*
A value known only by the name of its type: Number, String, ...
Two type values with the same name are the same value shape.
 */
public record TypeValue(String typeName) implements AnalysisValue {

    @Override
    public String description() {
        return typeName;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
