package org.e2immu.analyzer.incremental.minilang.ast;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public class ReturnStatement extends MiniNode {
    private final MiniNode value;

    public ReturnStatement(int line, int column, @Nullable MiniNode value) {
        super(line, column);
        this.value = value;
    }

    @Nullable
    public MiniNode value() {
        return value;
    }

    @Override
    public List<MiniNode> children() {
        return value == null ? List.of() : List.of(value);
    }
}
