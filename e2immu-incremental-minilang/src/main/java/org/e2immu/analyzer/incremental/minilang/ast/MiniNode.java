package org.e2immu.analyzer.incremental.minilang.ast;

import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.common.syntax.Tree;
import org.e2immu.analyzer.incremental.common.syntax.Visitor;

import java.util.List;

public abstract class MiniNode implements Node {
    private final int line;
    private final int column;
    private MiniTree tree;

    protected MiniNode(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    // in source order
    public abstract List<MiniNode> children();

    void attach(MiniTree tree) {
        this.tree = tree;
        for (MiniNode child : children()) {
            child.attach(tree);
        }
    }

    @Override
    public void walk(Visitor visitor) {
        if (visitor.walk(this)) {
            for (MiniNode child : children()) {
                child.walk(visitor);
            }
        }
        visitor.postWalk(this);
    }

    @Override
    public Tree globalParent() {
        return tree;
    }

    public String position() {
        return line + ":" + column;
    }
}
