package org.e2immu.analyzer.incremental.engine.impl;

import org.e2immu.analyzer.incremental.common.AnalyzerException;
import org.e2immu.analyzer.incremental.common.CancellationToken;
import org.e2immu.analyzer.incremental.common.ProtocolViolationException;
import org.e2immu.analyzer.incremental.engine.IncrementalAnalyzer;
import org.e2immu.analyzer.incremental.engine.ddg.DDG;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.log.AnalysisListener;
import org.e2immu.analyzer.incremental.engine.log.LoggingAnalysisListener;
import org.e2immu.analyzer.incremental.engine.scope.EnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.unit.WorkQueue;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

public class IncrementalAnalyzerImpl implements IncrementalAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(IncrementalAnalyzerImpl.class);

    private final Configuration configuration;
    private final AnalysisListener listener;
    private final WorkQueue queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ProjectEntry> entries = new LinkedHashMap<>();
    private final Map<String, Set<AnalysisUnit>> awaiting = new HashMap<>();

    public IncrementalAnalyzerImpl(Configuration configuration) {
        this(configuration, new LoggingAnalysisListener(configuration.slowUnitThresholdMillis()));
    }

    public IncrementalAnalyzerImpl(Configuration configuration, AnalysisListener listener) {
        this.configuration = configuration;
        this.listener = listener;
        this.queue = new WorkQueue(listener);
    }

    public record ConfigurationImpl(int maxUnitAnalyses,
                                    boolean storeErrors,
                                    long slowUnitThresholdMillis) implements Configuration {
    }

    public static class ConfigurationBuilder {
        private int maxUnitAnalyses;
        private boolean storeErrors;
        private long slowUnitThresholdMillis = 500;

        public ConfigurationBuilder setMaxUnitAnalyses(int maxUnitAnalyses) {
            this.maxUnitAnalyses = maxUnitAnalyses;
            return this;
        }

        public ConfigurationBuilder setStoreErrors(boolean storeErrors) {
            this.storeErrors = storeErrors;
            return this;
        }

        public ConfigurationBuilder setSlowUnitThresholdMillis(long slowUnitThresholdMillis) {
            this.slowUnitThresholdMillis = slowUnitThresholdMillis;
            return this;
        }

        public Configuration build() {
            return new ConfigurationImpl(maxUnitAnalyses, storeErrors, slowUnitThresholdMillis);
        }
    }

    public record OutputImpl(int unitsAnalyzed,
                             boolean completed,
                             boolean cancelled,
                             int remainingInQueue,
                             List<AnalyzerException> analyzerExceptions) implements Output {
    }

    @Override
    public ProjectEntry addEntry(String name) {
        lock.lock();
        try {
            if (entries.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate project entry " + name);
            }
            ProjectEntry entry = new ProjectEntry(name, queue, listener, lock);
            entries.put(name, entry);
            Set<AnalysisUnit> waiting = awaiting.remove(name);
            if (waiting != null) {
                waiting.stream().filter(u -> !u.isStale()).forEach(AnalysisUnit::enqueue);
            }
            return entry;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ProjectEntry entry(String name) {
        lock.lock();
        try {
            return entries.get(name);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Collection<ProjectEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.unlock();
        }
    }

    /*
    Entries that received values from the removed entry, or that read any of its variables, hold results derived
    from those values. Within one analysis version values only grow, so these entries are analyzed again in fresh
    scopes. Every other remaining module unit is enqueued, so that its sweep purges contributions of the removed
    entry to its module scope.
     */
    @Override
    public void removeEntry(ProjectEntry entry) {
        lock.lock();
        try {
            if (entries.remove(entry.name()) != entry) {
                throw new IllegalArgumentException("Unknown project entry " + entry.name());
            }
            Set<ProjectEntry> affected = affectedByRemovalOf(entry);
            entry.markRemoved();
            LOGGER.info("Removed project entry {}, re-analyzing {}", entry.name(), affected);
            for (ProjectEntry remaining : List.copyOf(entries.values())) {
                if (affected.contains(remaining)) {
                    remaining.refresh();
                } else {
                    AnalysisUnit moduleUnit = remaining.module().unit();
                    if (moduleUnit != null) moduleUnit.enqueue();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private static Set<ProjectEntry> affectedByRemovalOf(ProjectEntry entry) {
        Set<ProjectEntry> affected = new LinkedHashSet<>();
        for (AnalysisUnit target : entry.contributionTargets()) {
            affected.add(target.projectEntry());
        }
        for (EnvironmentRecord scope : entry.module().arena().scopes()) {
            for (VariableDef variable : scope.variables().values()) {
                for (AnalysisUnit dependent : variable.dependents()) {
                    affected.add(dependent.projectEntry());
                }
            }
        }
        affected.remove(entry);
        return affected;
    }

    @Override
    public void awaitEntry(String name, AnalysisUnit unit) {
        if (unit.isForEval()) return;
        lock.lock();
        try {
            awaiting.computeIfAbsent(name, n -> new LinkedHashSet<>()).add(unit);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public WorkQueue queue() {
        return queue;
    }

    @Override
    public AnalysisListener listener() {
        return listener;
    }

    @Override
    public Output analyzeQueue(DDG ddg, CancellationToken cancellationToken) {
        lock.lock();
        try {
            return drain(ddg, cancellationToken);
        } finally {
            lock.unlock();
        }
    }

    private Output drain(DDG ddg, CancellationToken cancellationToken) {
        LOGGER.info("Start analyzing queue of {} unit(s)", queue.size());
        List<AnalyzerException> analyzerExceptions = new LinkedList<>();
        int analyzed = 0;
        int skipped = 0;
        boolean cancelled = false;
        int max = configuration.maxUnitAnalyses();
        while (!queue.isEmpty()) {
            if (max > 0 && analyzed >= max) {
                LOGGER.warn("Stop analyzing queue: reached limit of {} unit analyses", max);
                break;
            }
            if (cancellationToken.isCancellationRequested()) {
                cancelled = true;
                break;
            }
            AnalysisUnit unit = queue.dequeue();
            if (unit == null) break;
            if (unit.isStale()) {
                ++skipped;
                continue;
            }
            try {
                if (!unit.analyze(ddg, cancellationToken)) {
                    queue.pushFront(unit);
                    cancelled = true;
                    break;
                }
                ++analyzed;
            } catch (ProtocolViolationException pve) {
                throw pve;
            } catch (RuntimeException re) {
                ++analyzed;
                AnalyzerException ae = new AnalyzerException(unit.fullName(), re);
                if (configuration.storeErrors()) {
                    LOGGER.error("Caught exception analyzing {}: {}", unit.fullName(), re.getMessage());
                    analyzerExceptions.add(ae);
                } else {
                    throw ae;
                }
            } finally {
                ddg.setCurrentUnit(null);
            }
        }
        int remaining = queue.size();
        LOGGER.info("Stop analyzing queue after {} unit(s), skipped {} stale, {} remaining, cancelled? {}",
                analyzed, skipped, remaining, cancelled);
        return new OutputImpl(analyzed, remaining == 0, cancelled, remaining, List.copyOf(analyzerExceptions));
    }
}
