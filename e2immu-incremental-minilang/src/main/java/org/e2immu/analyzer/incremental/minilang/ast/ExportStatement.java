package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

// export name as alias;
public class ExportStatement extends MiniNode {
    private final String name;
    private final String alias;

    public ExportStatement(int line, int column, String name, String alias) {
        super(line, column);
        this.name = name;
        this.alias = alias;
    }

    public String name() {
        return name;
    }

    public String alias() {
        return alias;
    }

    @Override
    public List<MiniNode> children() {
        return List.of();
    }
}
