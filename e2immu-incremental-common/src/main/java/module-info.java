module org.e2immu.analyzer.incremental.common {
    requires static org.jetbrains.annotations;

    exports org.e2immu.analyzer.incremental.common;
    exports org.e2immu.analyzer.incremental.common.syntax;
}
