package org.e2immu.analyzer.incremental.engine.scope;

import org.e2immu.analyzer.incremental.engine.value.FunctionValue;

public class FunctionEnvironmentRecord extends EnvironmentRecord {
    private final FunctionValue function;

    public FunctionEnvironmentRecord(ScopeArena arena, EnvironmentRecord parent, FunctionValue function) {
        super(arena, parent);
        this.function = function;
    }

    public FunctionValue function() {
        return function;
    }

    @Override
    public String name() {
        return function.name();
    }
}
