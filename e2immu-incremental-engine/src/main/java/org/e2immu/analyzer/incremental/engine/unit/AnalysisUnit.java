package org.e2immu.analyzer.incremental.engine.unit;

import org.e2immu.analyzer.incremental.common.CancellationToken;
import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.common.syntax.Tree;
import org.e2immu.analyzer.incremental.engine.ddg.DDG;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.scope.EnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.scope.ModuleEnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.value.AnalysisSet;
import org.e2immu.analyzer.incremental.engine.value.ModuleValue;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A single piece of code which can be analyzed: a module, a function body, or a comprehension.
 * The unit holds the syntax node to be analyzed, and the scope in which that code executes.
 * <p>
 * Dependency tracking works by analysis unit: when a name is resolved, the current unit becomes a dependent of
 * the variable. When the value-set of a variable grows, all of its dependents are enqueued again.
 * This proceeds until the queue is empty, i.e., a fixed point has been reached.
 * <p>
 * Units created by {@link #copyForQuery()} are eval-only: they neither register as dependents,
 * nor contribute values, nor enter the queue.
 */
public final class AnalysisUnit {
    private final Node ast;
    private final Tree tree;
    private final EnvironmentRecord scope;
    private final UnitKind kind;
    private final boolean forEval;

    // read and written by the work queue, under its lock
    private boolean inQueue;

    private final ModuleValue declaringModule;
    private int analysisCount;
    private long analysisNanos;

    public AnalysisUnit(Node ast, EnvironmentRecord scope, UnitKind kind) {
        this(ast, ast == null ? null : ast.globalParent(), scope, kind, false,
                scope == null ? null : findDeclaringModule(scope));
    }

    private AnalysisUnit(Node ast, Tree tree, EnvironmentRecord scope, UnitKind kind, boolean forEval,
                         ModuleValue declaringModule) {
        this.ast = ast;
        this.tree = tree;
        this.scope = scope;
        this.kind = kind;
        this.forEval = forEval;
        this.declaringModule = declaringModule;
    }

    // computed eagerly: once the tree of the module is replaced, the parent handles no longer resolve
    private static ModuleValue findDeclaringModule(EnvironmentRecord scope) {
        for (EnvironmentRecord s : scope.enumerateTowardsGlobal()) {
            if (s instanceof ModuleEnvironmentRecord moduleScope) {
                return moduleScope.module();
            }
        }
        return null;
    }

    public Node ast() {
        return ast;
    }

    public Tree tree() {
        return tree;
    }

    public EnvironmentRecord scope() {
        return scope;
    }

    public UnitKind kind() {
        return kind;
    }

    public boolean isForEval() {
        return forEval;
    }

    public boolean isInQueue() {
        return inQueue;
    }

    void setInQueue(boolean inQueue) {
        this.inQueue = inQueue;
    }

    public ModuleValue declaringModule() {
        return declaringModule;
    }

    public ProjectEntry projectEntry() {
        return declaringModule().projectEntry();
    }

    /**
     * @return false, without doing anything, when cancellation has been requested; true after a full pass
     */
    public boolean analyze(DDG ddg, CancellationToken cancel) {
        if (cancel.isCancellationRequested()) {
            return false;
        }
        long start = System.nanoTime();
        kind.pass().analyze(this, ddg);
        long elapsed = System.nanoTime() - start;
        analysisCount++;
        analysisNanos += elapsed;
        projectEntry().listener().unitAnalyzed(this, elapsed);
        return true;
    }

    public void enqueue() {
        if (!forEval) {
            projectEntry().queue().enqueue(this);
        }
    }

    /**
     * Look up a name with the normal lexical rules, starting in the scope of this unit.
     * <p>
     * This unit becomes a dependent of the variable found, and of every variable linked to it under that name.
     * A name that cannot be resolved yields the empty set. In that case, unless this unit is eval-only, an empty
     * placeholder is registered in the outermost scope, so that a later assignment to the name re-queues this
     * unit.
     */
    public AnalysisSet findValueByName(Node node, String name) {
        EnvironmentRecord outermost = null;
        for (EnvironmentRecord s : scope.enumerateTowardsGlobal()) {
            VariableDef variable = s.getVariable(node, this, name, false);
            if (variable != null) {
                variable.addReference(node, this);
                List<VariableDef> linkedVariables = s.getLinkedVariablesNoCreate(name);
                if (linkedVariables != null) {
                    for (VariableDef linkedVariable : linkedVariables) {
                        linkedVariable.addReference(node, this);
                    }
                }
                return variable.types();
            }
            outermost = s;
        }
        if (!forEval && outermost != null) {
            VariableDef placeholder = outermost.getVariable(node, this, name, true);
            assert placeholder != null;
            placeholder.addReference(node, this);
        }
        return AnalysisSet.EMPTY;
    }

    public AnalysisUnit copyForQuery() {
        return new AnalysisUnit(ast, tree, scope, UnitKind.QUERY, true, declaringModule);
    }

    /**
     * A unit is stale when the tree it was created for has been replaced, or its entry has been removed.
     * Stale units are never analyzed again.
     */
    public boolean isStale() {
        ProjectEntry entry = projectEntry();
        return entry.isRemoved() || tree != null && entry.tree() != tree;
    }

    public boolean isSoleMemberOf(Collection<?> units) {
        return units.size() == 1 && units.contains(this);
    }

    public int analysisCount() {
        return analysisCount;
    }

    public long analysisNanos() {
        return analysisNanos;
    }

    /**
     * @return the names of all scopes from the module inwards, separated by dots
     */
    public String fullName() {
        if (scope == null) return "<Unnamed unit>";
        return scope.enumerateFromGlobal().stream().map(EnvironmentRecord::name).collect(Collectors.joining("."));
    }

    @Override
    public String toString() {
        return "<" + kind + ": Name=" + fullName() + " (" + hashCode() + "), NodeType="
               + (ast == null ? "<unknown>" : ast.nodeType()) + ">";
    }
}
