package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

public class NameExpression extends MiniNode {
    private final String name;

    public NameExpression(int line, int column, String name) {
        super(line, column);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public List<MiniNode> children() {
        return List.of();
    }
}
