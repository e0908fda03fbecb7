package org.e2immu.analyzer.incremental.engine.scope;

import org.e2immu.analyzer.incremental.engine.value.ModuleValue;

public class ModuleEnvironmentRecord extends EnvironmentRecord {
    private final ModuleValue module;

    public ModuleEnvironmentRecord(ScopeArena arena, ModuleValue module) {
        super(arena, null);
        this.module = module;
    }

    public ModuleValue module() {
        return module;
    }

    @Override
    public String name() {
        return module.name();
    }
}
