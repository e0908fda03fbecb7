package org.e2immu.analyzer.incremental.engine.scope;

import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * One lexical scope: the variables declared directly in it, a handle to its parent, and the linked-variables
 * side table. Name resolution walks from the innermost scope towards the module scope and stops at the first
 * scope that holds the name.
 */
public abstract class EnvironmentRecord {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnvironmentRecord.class);

    private final ScopeArena arena;
    private final int handle;
    private final int parentHandle;
    private final Map<String, VariableDef> variables = new LinkedHashMap<>();
    private Map<String, List<VariableDef>> linkedVariables;

    protected EnvironmentRecord(ScopeArena arena, EnvironmentRecord parent) {
        arena.checkOwnership(parent);
        this.arena = arena;
        this.parentHandle = parent == null ? ScopeArena.NO_PARENT : parent.handle;
        this.handle = arena.register(this);
    }

    public abstract String name();

    public int handle() {
        return handle;
    }

    @Nullable
    public EnvironmentRecord parent() {
        return arena.get(parentHandle);
    }

    /**
     * @return the variable, or null when the name is not declared in this very scope and
     * <code>createIfMissing</code> is false. An existing variable may well have an empty value-set.
     */
    @Nullable
    public VariableDef getVariable(Node node, AnalysisUnit unit, String name, boolean createIfMissing) {
        VariableDef variable = variables.get(name);
        if (variable == null && createIfMissing) {
            variable = new VariableDef(name);
            variables.put(name, variable);
            LOGGER.debug("Create variable {} in scope {} for {}", name, name(), unit);
            enqueueReadersOfShadowedVariable(name);
        }
        return variable;
    }

    /*
    Units that resolved the name in an outer scope may now resolve it here.
     */
    private void enqueueReadersOfShadowedVariable(String name) {
        EnvironmentRecord scope = parent();
        while (scope != null) {
            VariableDef shadowed = scope.variables.get(name);
            if (shadowed != null) {
                shadowed.enqueueDependents();
                return;
            }
            scope = scope.parent();
        }
    }

    public boolean containsVariable(String name) {
        return variables.containsKey(name);
    }

    /**
     * Remove the variable, but only when the table still holds this very instance.
     *
     * @return false when the table changed in the meantime; the caller retries in a later pass
     */
    public boolean removeVariable(String name, VariableDef expected) {
        VariableDef current = variables.get(name);
        if (current != expected) return false;
        variables.remove(name);
        return true;
    }

    public Map<String, VariableDef> variables() {
        return Collections.unmodifiableMap(variables);
    }

    public void addLinkedVariable(String name, VariableDef variable) {
        if (linkedVariables == null) {
            linkedVariables = new HashMap<>();
        }
        List<VariableDef> list = linkedVariables.computeIfAbsent(name, n -> new ArrayList<>());
        if (!list.contains(variable)) list.add(variable);
    }

    @Nullable
    public List<VariableDef> getLinkedVariablesNoCreate(String name) {
        if (linkedVariables == null) return null;
        List<VariableDef> list = linkedVariables.get(name);
        return list == null ? null : Collections.unmodifiableList(list);
    }

    public void clearLinkedVariables() {
        linkedVariables = null;
    }

    public List<EnvironmentRecord> enumerateTowardsGlobal() {
        List<EnvironmentRecord> list = new ArrayList<>();
        EnvironmentRecord scope = this;
        while (scope != null) {
            list.add(scope);
            scope = scope.parent();
        }
        return list;
    }

    public List<EnvironmentRecord> enumerateFromGlobal() {
        List<EnvironmentRecord> list = enumerateTowardsGlobal();
        Collections.reverse(list);
        return list;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name() + "#" + handle + "]";
    }
}
