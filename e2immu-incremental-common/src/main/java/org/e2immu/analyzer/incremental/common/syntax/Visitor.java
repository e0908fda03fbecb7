package org.e2immu.analyzer.incremental.common.syntax;

public interface Visitor {

    // return true to descend into the children of the node
    boolean walk(Node node);

    default void postWalk(Node node) {
        // nothing
    }
}
