package org.e2immu.analyzer.incremental.engine.variable;

import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.value.AnalysisSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;

/**
 * A named binding and everything the incremental analysis knows about it.
 * <p>
 * Values and dependents are recorded per project entry, stamped with the analysis version of that entry at the
 * time of recording. The value-set of the variable is the union over all entries. Within one analysis version
 * of an entry, its contribution only grows. Contributions shrink in two situations only: when the entry's
 * version has moved on (the entry is being re-analyzed, see {@link ProjectEntry#updateTree}), or when
 * {@link #clearOldValues()} purges entries that were removed or superseded.
 */
public class VariableDef {
    private static final Logger LOGGER = LoggerFactory.getLogger(VariableDef.class);

    private final String name;
    private final Map<ProjectEntry, DependencyInfo> dependencies = new LinkedHashMap<>();
    // units that were dependents in bookkeeping purged by clearOldValues; they are told when this variable goes
    private final Set<AnalysisUnit> formerDependents = new LinkedHashSet<>();
    private AnalysisSet typesCache;

    public VariableDef(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Register the unit as a dependent: a future change of the value-set re-queues it.
     * Registering the same unit twice has no further effect. Eval-only units are ignored.
     */
    public void addReference(Node node, AnalysisUnit unit) {
        if (unit.isForEval()) return;
        dependencyInfo(unit).dependentUnits().add(unit);
    }

    /**
     * Merge values observed by the unit into the contribution of the unit's project entry.
     * When the union over all entries grows, every dependent is enqueued.
     *
     * @return true when the value-set of the variable grew
     */
    public boolean addTypes(AnalysisUnit unit, AnalysisSet newTypes) {
        if (unit.isForEval() || newTypes.isEmpty()) return false;
        DependencyInfo info = dependencyInfo(unit);
        AnalysisSet merged = info.types().union(newTypes);
        if (merged == info.types()) return false;

        AnalysisSet before = types();
        info.setTypes(merged);
        typesCache = null;
        if (before.containsAll(merged)) {
            // another entry had contributed these already
            return false;
        }
        LOGGER.debug("Variable {} grows from {} to {} in {}", name, before, types(), unit);
        enqueueDependents();
        return true;
    }

    public AnalysisSet types() {
        if (typesCache == null) {
            AnalysisSet union = AnalysisSet.EMPTY;
            for (DependencyInfo info : dependencies.values()) {
                union = union.union(info.types());
            }
            typesCache = union;
        }
        return typesCache;
    }

    public Set<AnalysisUnit> dependents() {
        Set<AnalysisUnit> all = new LinkedHashSet<>();
        for (DependencyInfo info : dependencies.values()) {
            all.addAll(info.dependentUnits());
        }
        return all;
    }

    public boolean hasDependents() {
        for (DependencyInfo info : dependencies.values()) {
            if (!info.dependentUnits().isEmpty()) return true;
        }
        return false;
    }

    // a dead variable may be removed from its scope
    public boolean isDead() {
        return types().isEmpty() && !hasDependents();
    }

    /**
     * Enqueue every current dependent, and every dependent lost in an earlier purge, once.
     */
    public void enqueueDependents() {
        Set<AnalysisUnit> units = dependents();
        units.addAll(formerDependents);
        formerDependents.clear();
        for (AnalysisUnit unit : units) {
            unit.enqueue();
        }
    }

    public void forgetFormerDependents() {
        formerDependents.clear();
    }

    /**
     * Purge the bookkeeping of entries that were removed from the project, or whose analysis version moved on.
     * Dependents of purged bookkeeping are remembered as former dependents.
     *
     * @return true when the value-set shrank
     */
    public boolean clearOldValues() {
        return clearOldValues(e -> true);
    }

    /**
     * Purge the bookkeeping of one entry, when that entry was removed or its analysis version moved on.
     *
     * @return true when the value-set shrank
     */
    public boolean clearOldValues(ProjectEntry entry) {
        return clearOldValues(e -> e == entry);
    }

    private boolean clearOldValues(Predicate<ProjectEntry> consider) {
        int sizeBefore = types().size();
        Iterator<Map.Entry<ProjectEntry, DependencyInfo>> iterator = dependencies.entrySet().iterator();
        boolean removed = false;
        while (iterator.hasNext()) {
            Map.Entry<ProjectEntry, DependencyInfo> entry = iterator.next();
            ProjectEntry projectEntry = entry.getKey();
            DependencyInfo info = entry.getValue();
            if (consider.test(projectEntry) && isStale(projectEntry, info)) {
                formerDependents.addAll(info.dependentUnits());
                iterator.remove();
                removed = true;
            }
        }
        if (!removed) return false;
        typesCache = null;
        return types().size() < sizeBefore;
    }

    private static boolean isStale(ProjectEntry projectEntry, DependencyInfo info) {
        return projectEntry.isRemoved() || info.version() != projectEntry.analysisVersion();
    }

    /*
    The bookkeeping of the unit's entry at the entry's current analysis version. Bookkeeping recorded at an
    older version is replaced: it belongs to an analysis of the entry that has been superseded, and its
    dependents are units of that superseded analysis.
     */
    private DependencyInfo dependencyInfo(AnalysisUnit unit) {
        ProjectEntry entry = unit.projectEntry();
        DependencyInfo info = dependencies.get(entry);
        if (info != null && info.version() == entry.analysisVersion()) {
            return info;
        }
        int sizeBefore = types().size();
        DependencyInfo fresh = new DependencyInfo(entry.analysisVersion());
        dependencies.put(entry, fresh);
        if (info != null && !info.types().isEmpty()) {
            typesCache = null;
            if (types().size() < sizeBefore) {
                LOGGER.debug("Variable {} loses values of {} at version {}", name, entry, info.version());
                for (AnalysisUnit dependent : dependents()) {
                    if (dependent != unit) dependent.enqueue();
                }
            }
        }
        return fresh;
    }

    public Map<ProjectEntry, DependencyInfo> dependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    @Override
    public String toString() {
        return name + "=" + types();
    }
}
