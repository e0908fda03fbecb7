package org.e2immu.analyzer.incremental.common.syntax;

/**
 * Opaque syntax node, as handed to the engine by the parse layer.
 * The engine relies on two things only: a stable traversal, and a way back to the tree the node belongs to.
 */
public interface Node {

    /**
     * Visit this node; when {@link Visitor#walk(Node)} returns true, the children are visited in source order
     * before {@link Visitor#postWalk(Node)} is called.
     */
    void walk(Visitor visitor);

    Tree globalParent();

    default String nodeType() {
        return getClass().getSimpleName();
    }
}
