package org.e2immu.analyzer.incremental.minilang.analysis;

import org.e2immu.analyzer.incremental.engine.value.TypeValue;

public final class BuiltinTypes {
    public static final TypeValue NUMBER = new TypeValue("Number");
    public static final TypeValue STRING = new TypeValue("String");
    public static final TypeValue BOOLEAN = new TypeValue("Boolean");
    public static final TypeValue NULL = new TypeValue("Null");

    private BuiltinTypes() {
    }
}
