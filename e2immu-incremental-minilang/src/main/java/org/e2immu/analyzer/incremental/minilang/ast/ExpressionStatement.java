package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

public class ExpressionStatement extends MiniNode {
    private final MiniNode expression;

    public ExpressionStatement(int line, int column, MiniNode expression) {
        super(line, column);
        this.expression = expression;
    }

    public MiniNode expression() {
        return expression;
    }

    @Override
    public List<MiniNode> children() {
        return List.of(expression);
    }
}
