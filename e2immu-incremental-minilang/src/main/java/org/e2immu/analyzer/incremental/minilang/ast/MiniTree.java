package org.e2immu.analyzer.incremental.minilang.ast;

import org.e2immu.analyzer.incremental.common.syntax.Tree;

public class MiniTree implements Tree {
    private final String name;
    private final Block root;

    public MiniTree(String name, Block root) {
        this.name = name;
        this.root = root;
        root.attach(this);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Block root() {
        return root;
    }
}
