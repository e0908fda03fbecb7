package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

// require("module")
public class RequireExpression extends MiniNode {
    private final String module;

    public RequireExpression(int line, int column, String module) {
        super(line, column);
        this.module = module;
    }

    public String module() {
        return module;
    }

    @Override
    public List<MiniNode> children() {
        return List.of();
    }
}
