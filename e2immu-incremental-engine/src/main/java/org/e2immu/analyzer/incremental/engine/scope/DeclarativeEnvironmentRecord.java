package org.e2immu.analyzer.incremental.engine.scope;

/*
block and comprehension scopes
 */
public class DeclarativeEnvironmentRecord extends EnvironmentRecord {
    private final String name;

    public DeclarativeEnvironmentRecord(ScopeArena arena, EnvironmentRecord parent, String name) {
        super(arena, parent);
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }
}
