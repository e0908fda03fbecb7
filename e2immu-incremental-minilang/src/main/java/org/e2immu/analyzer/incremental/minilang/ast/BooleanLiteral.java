package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

public class BooleanLiteral extends MiniNode {
    private final boolean value;

    public BooleanLiteral(int line, int column, boolean value) {
        super(line, column);
        this.value = value;
    }

    public boolean value() {
        return value;
    }

    @Override
    public List<MiniNode> children() {
        return List.of();
    }
}
