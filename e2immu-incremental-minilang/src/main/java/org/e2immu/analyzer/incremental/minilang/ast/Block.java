package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

public class Block extends MiniNode {
    private final List<MiniNode> statements;

    public Block(int line, int column, List<MiniNode> statements) {
        super(line, column);
        this.statements = List.copyOf(statements);
    }

    public List<MiniNode> statements() {
        return statements;
    }

    @Override
    public List<MiniNode> children() {
        return statements;
    }
}
