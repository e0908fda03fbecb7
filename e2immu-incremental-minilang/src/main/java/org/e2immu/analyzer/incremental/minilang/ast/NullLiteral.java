package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

public class NullLiteral extends MiniNode {

    public NullLiteral(int line, int column) {
        super(line, column);
    }

    @Override
    public List<MiniNode> children() {
        return List.of();
    }
}
