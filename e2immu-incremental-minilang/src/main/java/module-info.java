module org.e2immu.analyzer.incremental.minilang {
    requires org.e2immu.analyzer.incremental.common;
    requires org.e2immu.analyzer.incremental.engine;
    requires static org.jetbrains.annotations;
    requires org.slf4j;

    exports org.e2immu.analyzer.incremental.minilang;
    exports org.e2immu.analyzer.incremental.minilang.analysis;
    exports org.e2immu.analyzer.incremental.minilang.ast;
    exports org.e2immu.analyzer.incremental.minilang.parser;
}
