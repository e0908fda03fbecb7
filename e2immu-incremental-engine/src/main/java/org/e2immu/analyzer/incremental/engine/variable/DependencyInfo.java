package org.e2immu.analyzer.incremental.engine.variable;

import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.value.AnalysisSet;

import java.util.LinkedHashSet;
import java.util.Set;

/*
What one project entry, at one analysis version, contributed to a variable:
the values it merged in, and the units of that entry that read the variable.
 */
public class DependencyInfo {
    private final int version;
    private AnalysisSet types = AnalysisSet.EMPTY;
    private final Set<AnalysisUnit> dependentUnits = new LinkedHashSet<>();

    DependencyInfo(int version) {
        this.version = version;
    }

    public int version() {
        return version;
    }

    public AnalysisSet types() {
        return types;
    }

    void setTypes(AnalysisSet types) {
        this.types = types;
    }

    public Set<AnalysisUnit> dependentUnits() {
        return dependentUnits;
    }

    @Override
    public String toString() {
        return "v" + version + ":" + types + ", " + dependentUnits.size() + " dependent(s)";
    }
}
