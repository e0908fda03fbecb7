package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

public class MemberExpression extends MiniNode {
    private final MiniNode object;
    private final String member;

    public MemberExpression(int line, int column, MiniNode object, String member) {
        super(line, column);
        this.object = object;
        this.member = member;
    }

    public MiniNode object() {
        return object;
    }

    public String member() {
        return member;
    }

    @Override
    public List<MiniNode> children() {
        return List.of(object);
    }
}
