package org.e2immu.analyzer.incremental.minilang.ast;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public class VarStatement extends MiniNode {
    private final String name;
    private final MiniNode initializer;

    public VarStatement(int line, int column, String name, @Nullable MiniNode initializer) {
        super(line, column);
        this.name = name;
        this.initializer = initializer;
    }

    public String name() {
        return name;
    }

    @Nullable
    public MiniNode initializer() {
        return initializer;
    }

    @Override
    public List<MiniNode> children() {
        return initializer == null ? List.of() : List.of(initializer);
    }
}
