package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

public class ArrayLiteral extends MiniNode {
    private final List<MiniNode> elements;

    public ArrayLiteral(int line, int column, List<MiniNode> elements) {
        super(line, column);
        this.elements = List.copyOf(elements);
    }

    public List<MiniNode> elements() {
        return elements;
    }

    @Override
    public List<MiniNode> children() {
        return elements;
    }
}
