package org.e2immu.analyzer.incremental.engine.value;

import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/*
Immutable set of analysis values. "No value known" is the empty set, never null.

Union returns the receiver when nothing is added; callers use that to detect growth cheaply.
 */
public final class AnalysisSet implements Iterable<AnalysisValue> {
    public static final AnalysisSet EMPTY = new AnalysisSet(Set.of());

    private final Set<AnalysisValue> values;

    private AnalysisSet(Set<AnalysisValue> values) {
        this.values = values;
    }

    public static AnalysisSet of(AnalysisValue... values) {
        return of(Arrays.asList(values));
    }

    public static AnalysisSet of(Collection<? extends AnalysisValue> values) {
        if (values.isEmpty()) return EMPTY;
        Set<AnalysisValue> set = new LinkedHashSet<>();
        for (AnalysisValue value : values) {
            set.add(Objects.requireNonNull(value));
        }
        return new AnalysisSet(Collections.unmodifiableSet(set));
    }

    public AnalysisSet add(AnalysisValue value) {
        if (values.contains(value)) return this;
        Set<AnalysisValue> set = new LinkedHashSet<>(values);
        set.add(Objects.requireNonNull(value));
        return new AnalysisSet(Collections.unmodifiableSet(set));
    }

    public AnalysisSet union(AnalysisSet other) {
        if (other.isEmpty() || values.containsAll(other.values)) return this;
        if (isEmpty()) return other;
        Set<AnalysisValue> set = new LinkedHashSet<>(values);
        set.addAll(other.values);
        return new AnalysisSet(Collections.unmodifiableSet(set));
    }

    public boolean contains(AnalysisValue value) {
        return values.contains(value);
    }

    public boolean containsAll(AnalysisSet other) {
        return values.containsAll(other.values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Stream<AnalysisValue> stream() {
        return values.stream();
    }

    @NotNull
    @Override
    public Iterator<AnalysisValue> iterator() {
        return values.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof AnalysisSet other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    // sorted, so that the output does not depend on the order in which values were discovered
    @Override
    public String toString() {
        return values.stream().map(AnalysisValue::description).sorted()
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
