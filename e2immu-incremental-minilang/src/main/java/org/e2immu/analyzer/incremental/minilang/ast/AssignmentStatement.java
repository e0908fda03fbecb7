package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

// the target is a NameExpression or a MemberExpression
public class AssignmentStatement extends MiniNode {
    private final MiniNode target;
    private final MiniNode value;

    public AssignmentStatement(int line, int column, MiniNode target, MiniNode value) {
        super(line, column);
        this.target = target;
        this.value = value;
    }

    public MiniNode target() {
        return target;
    }

    public MiniNode value() {
        return value;
    }

    @Override
    public List<MiniNode> children() {
        return List.of(target, value);
    }
}
