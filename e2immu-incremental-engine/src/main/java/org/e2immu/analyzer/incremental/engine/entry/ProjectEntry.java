package org.e2immu.analyzer.incremental.engine.entry;

import org.e2immu.analyzer.incremental.common.syntax.Tree;
import org.e2immu.analyzer.incremental.engine.log.AnalysisListener;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.unit.WorkQueue;
import org.e2immu.analyzer.incremental.engine.value.ModuleValue;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.Lock;

/**
 * One source file of the project, i.e., one module. Every value a unit of this entry contributes to a variable,
 * wherever that variable lives, is recorded under this entry and stamped with its analysis version.
 * <p>
 * The analysis version increases whenever the entry is re-analyzed from scratch. Contributions stamped with an
 * older version are out of date: they are replaced as soon as the entry writes to the variable again, and purged
 * by the sweep of the scope holding the variable.
 */
public class ProjectEntry {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectEntry.class);

    private final String name;
    private final WorkQueue queue;
    private final AnalysisListener listener;
    private final Lock lock;
    private final ModuleValue module;
    // units of other entries whose scopes hold values contributed by this entry
    private final Set<AnalysisUnit> contributedTo = new LinkedHashSet<>();

    private Tree tree;
    private int analysisVersion;
    private volatile boolean removed;

    public ProjectEntry(String name, WorkQueue queue, AnalysisListener listener, Lock lock) {
        this.name = name;
        this.queue = queue;
        this.listener = listener;
        this.lock = lock;
        this.module = new ModuleValue(this);
    }

    public String name() {
        return name;
    }

    public WorkQueue queue() {
        return queue;
    }

    public AnalysisListener listener() {
        return listener;
    }

    public ModuleValue module() {
        return module;
    }

    @Nullable
    public Tree tree() {
        return tree;
    }

    public int analysisVersion() {
        return analysisVersion;
    }

    public boolean isRemoved() {
        return removed;
    }

    public void markRemoved() {
        removed = true;
    }

    /**
     * A new parse of this entry is available. Drop everything derived from the old tree, and schedule
     * the new module unit. The entries this entry contributed values to are scheduled as well, so that their
     * sweeps purge the contributions of the old tree.
     */
    public void updateTree(Tree tree) {
        lock.lock();
        try {
            this.tree = tree;
            ++analysisVersion;
            LOGGER.info("Update tree of {}, analysis version {}", name, analysisVersion);
            module.resetForTree(tree);
            module.unit().enqueue();
            enqueueContributionTargets();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Analyze the current tree again from scratch, without a new parse.
     */
    public void reanalyze() {
        lock.lock();
        try {
            ++analysisVersion;
            LOGGER.info("Re-analyze {}, analysis version {}", name, analysisVersion);
            for (AnalysisUnit unit : List.copyOf(module.units())) {
                unit.enqueue();
            }
            enqueueContributionTargets();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Analyze the current tree again in fresh scopes. Unlike {@link #reanalyze()}, nothing derived from
     * earlier passes survives, apart from the values other entries contributed to the module scope.
     */
    public void refresh() {
        lock.lock();
        try {
            if (tree != null) updateTree(tree);
        } finally {
            lock.unlock();
        }
    }

    public void addContributionTarget(AnalysisUnit unit) {
        contributedTo.add(unit);
    }

    public Set<AnalysisUnit> contributionTargets() {
        return Collections.unmodifiableSet(contributedTo);
    }

    /*
    A target whose own entry has moved to a new tree is represented by the module unit of that tree:
    the module scope is the only scope that survives the update.
     */
    private void enqueueContributionTargets() {
        for (AnalysisUnit target : List.copyOf(contributedTo)) {
            ModuleValue targetModule = target.declaringModule();
            if (targetModule.projectEntry().isRemoved()) {
                contributedTo.remove(target);
            } else if (target.isStale()) {
                contributedTo.remove(target);
                AnalysisUnit moduleUnit = targetModule.unit();
                if (moduleUnit != null) {
                    contributedTo.add(moduleUnit);
                    moduleUnit.enqueue();
                }
            } else {
                target.enqueue();
            }
        }
    }

    @Override
    public String toString() {
        return "ProjectEntry[" + name + "]";
    }
}
