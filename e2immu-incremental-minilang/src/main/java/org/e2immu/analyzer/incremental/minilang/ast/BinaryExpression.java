package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

public class BinaryExpression extends MiniNode {
    private final MiniNode left;
    private final String operator;
    private final MiniNode right;

    public BinaryExpression(int line, int column, MiniNode left, String operator, MiniNode right) {
        super(line, column);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public MiniNode left() {
        return left;
    }

    public String operator() {
        return operator;
    }

    public MiniNode right() {
        return right;
    }

    @Override
    public List<MiniNode> children() {
        return List.of(left, right);
    }
}
