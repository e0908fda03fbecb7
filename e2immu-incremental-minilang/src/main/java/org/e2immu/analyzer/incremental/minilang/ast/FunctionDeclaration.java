package org.e2immu.analyzer.incremental.minilang.ast;

import java.util.List;

public class FunctionDeclaration extends MiniNode {
    private final String name;
    private final List<String> parameters;
    private final Block body;

    public FunctionDeclaration(int line, int column, String name, List<String> parameters, Block body) {
        super(line, column);
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.body = body;
    }

    public String name() {
        return name;
    }

    public List<String> parameters() {
        return parameters;
    }

    public Block body() {
        return body;
    }

    @Override
    public List<MiniNode> children() {
        return List.of(body);
    }
}
