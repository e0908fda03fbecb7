package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

public class StringLiteral extends MiniNode {
    private final String value;

    public StringLiteral(int line, int column, String value) {
        super(line, column);
        this.value = value;
    }

    public String value() {
        return value;
    }

    @Override
    public List<MiniNode> children() {
        return List.of();
    }
}
