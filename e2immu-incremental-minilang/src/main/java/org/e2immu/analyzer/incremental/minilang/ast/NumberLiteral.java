package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

public class NumberLiteral extends MiniNode {
    private final String text;

    public NumberLiteral(int line, int column, String text) {
        super(line, column);
        this.text = text;
    }

    public String text() {
        return text;
    }

    @Override
    public List<MiniNode> children() {
        return List.of();
    }
}
