package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.ArrayList;
import java.util.List;

public class CallExpression extends MiniNode {
    private final MiniNode callee;
    private final List<MiniNode> arguments;

    public CallExpression(int line, int column, MiniNode callee, List<MiniNode> arguments) {
        super(line, column);
        this.callee = callee;
        this.arguments = List.copyOf(arguments);
    }

    public MiniNode callee() {
        return callee;
    }

    public List<MiniNode> arguments() {
        return arguments;
    }

    @Override
    public List<MiniNode> children() {
        List<MiniNode> children = new ArrayList<>(arguments.size() + 1);
        children.add(callee);
        children.addAll(arguments);
        return children;
    }
}
