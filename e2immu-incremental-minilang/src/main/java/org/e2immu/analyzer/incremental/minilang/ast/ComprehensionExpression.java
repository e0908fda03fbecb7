package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

// [for (variable of source) body]
public class ComprehensionExpression extends MiniNode {
    private final String variable;
    private final MiniNode source;
    private final MiniNode body;

    public ComprehensionExpression(int line, int column, String variable, MiniNode source, MiniNode body) {
        super(line, column);
        this.variable = variable;
        this.source = source;
        this.body = body;
    }

    public String variable() {
        return variable;
    }

    public MiniNode source() {
        return source;
    }

    public MiniNode body() {
        return body;
    }

    @Override
    public List<MiniNode> children() {
        return List.of(source, body);
    }
}
