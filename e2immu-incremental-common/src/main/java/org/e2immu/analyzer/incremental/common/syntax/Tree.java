package org.e2immu.analyzer.incremental.common.syntax;

/**
 * The result of parsing one project entry. A new parse produces a new tree; node identity is only
 * stable within one tree.
 */
public interface Tree {

    String name();

    Node root();
}
