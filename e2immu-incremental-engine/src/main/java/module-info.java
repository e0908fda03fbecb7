module org.e2immu.analyzer.incremental.engine {
    requires org.e2immu.analyzer.incremental.common;
    requires static org.jetbrains.annotations;
    requires org.slf4j;

    exports org.e2immu.analyzer.incremental.engine;
    exports org.e2immu.analyzer.incremental.engine.ddg;
    exports org.e2immu.analyzer.incremental.engine.entry;
    exports org.e2immu.analyzer.incremental.engine.impl;
    exports org.e2immu.analyzer.incremental.engine.log;
    exports org.e2immu.analyzer.incremental.engine.query;
    exports org.e2immu.analyzer.incremental.engine.scope;
    exports org.e2immu.analyzer.incremental.engine.unit;
    exports org.e2immu.analyzer.incremental.engine.value;
    exports org.e2immu.analyzer.incremental.engine.variable;
}
