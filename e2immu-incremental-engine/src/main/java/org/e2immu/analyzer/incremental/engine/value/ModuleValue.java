package org.e2immu.analyzer.incremental.engine.value;

import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.common.syntax.Tree;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.scope.EnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.scope.ModuleEnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.scope.ScopeArena;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.unit.UnitKind;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Supplier;

/**
 * The value of a module, and the owner of everything the analysis of one project entry creates:
 * the module scope, the scope arena holding all nested scopes, the values created per syntax node,
 * and the analysis units.
 * <p>
 * The module scope survives a tree update; the variables in it carry values stamped with the analysis version
 * of the entry that contributed them, and the sweep of the module pass purges what is out of date.
 * Everything else is dropped when the tree is replaced.
 */
public class ModuleValue implements AnalysisValue {

    private record NodeKey(Node node, Class<?> type) {
    }

    private final ProjectEntry projectEntry;
    private final ScopeArena arena = new ScopeArena();
    private final ModuleEnvironmentRecord scope;
    private final Map<NodeKey, Object> nodeValues = new HashMap<>();
    private final List<AnalysisUnit> units = new ArrayList<>();
    private AnalysisUnit unit;

    public ModuleValue(ProjectEntry projectEntry) {
        this.projectEntry = projectEntry;
        this.scope = new ModuleEnvironmentRecord(arena, this);
    }

    public String name() {
        return projectEntry.name();
    }

    public ProjectEntry projectEntry() {
        return projectEntry;
    }

    public ScopeArena arena() {
        return arena;
    }

    public ModuleEnvironmentRecord scope() {
        return scope;
    }

    /**
     * @return the module unit of the current tree; null as long as no tree has been set
     */
    @Nullable
    public AnalysisUnit unit() {
        return unit;
    }

    public void resetForTree(Tree tree) {
        arena.retainOnly(scope);
        nodeValues.clear();
        units.clear();
        scope.clearLinkedVariables();
        unit = new AnalysisUnit(tree.root(), scope, UnitKind.MODULE);
        units.add(unit);
    }

    @Nullable
    public <T> T nodeValue(Node node, Class<T> type) {
        return type.cast(nodeValues.get(new NodeKey(node, type)));
    }

    public <T> T getOrCreateNodeValue(Node node, Class<T> type, Supplier<T> supplier) {
        NodeKey key = new NodeKey(node, type);
        Object inMap = nodeValues.get(key);
        if (inMap != null) return type.cast(inMap);
        T created = supplier.get();
        nodeValues.put(key, created);
        return created;
    }

    public void registerUnit(AnalysisUnit unit) {
        units.add(unit);
    }

    public List<AnalysisUnit> units() {
        return Collections.unmodifiableList(units);
    }

    @Nullable
    public AnalysisUnit unitFor(EnvironmentRecord environmentRecord) {
        for (AnalysisUnit u : units) {
            if (u.scope() == environmentRecord) return u;
        }
        return null;
    }

    @Override
    public String description() {
        return "Module " + name();
    }

    @Override
    public AnalysisSet getMember(Node node, AnalysisUnit reader, String name) {
        if (projectEntry.isRemoved()) return AnalysisSet.EMPTY;
        VariableDef variable = scope.getVariable(node, reader, name, !reader.isForEval());
        if (variable == null) return AnalysisSet.EMPTY;
        variable.addReference(node, reader);
        List<VariableDef> linkedVariables = scope.getLinkedVariablesNoCreate(name);
        if (linkedVariables != null) {
            for (VariableDef linkedVariable : linkedVariables) {
                linkedVariable.addReference(node, reader);
            }
        }
        return variable.types();
    }

    @Override
    public void setMember(Node node, AnalysisUnit writer, String name, AnalysisSet values) {
        if (writer.isForEval()) return;
        VariableDef variable = scope.getVariable(node, writer, name, true);
        assert variable != null;
        variable.addTypes(writer, values);
        ProjectEntry writerEntry = writer.projectEntry();
        if (writerEntry != projectEntry && unit != null) {
            writerEntry.addContributionTarget(unit);
        }
    }

    @Override
    public String toString() {
        return description();
    }
}
