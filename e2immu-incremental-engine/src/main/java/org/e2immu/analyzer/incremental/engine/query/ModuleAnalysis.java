package org.e2immu.analyzer.incremental.engine.query;

import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.engine.ddg.DDG;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.scope.EnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.value.AnalysisSet;
import org.e2immu.analyzer.incremental.engine.value.ModuleValue;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the analysis results of one project entry. Every read goes through an eval-only copy of
 * a unit: nothing registers as a dependent, nothing is contributed, nothing is enqueued.
 */
public class ModuleAnalysis {
    private final ProjectEntry entry;
    private final DDG ddg;

    public ModuleAnalysis(ProjectEntry entry, DDG ddg) {
        this.entry = entry;
        this.ddg = ddg;
    }

    public AnalysisSet valuesOf(String name) {
        AnalysisUnit moduleUnit = entry.module().unit();
        if (moduleUnit == null) return AnalysisSet.EMPTY;
        return moduleUnit.copyForQuery().findValueByName(moduleUnit.ast(), name);
    }

    // resolution starts in the given scope, e.g. the scope of a function
    public AnalysisSet valuesOf(String name, EnvironmentRecord scope) {
        AnalysisUnit query = queryUnit(scope);
        return query.findValueByName(query.ast(), name);
    }

    public AnalysisSet evaluate(Node expression, EnvironmentRecord scope) {
        return ddg.evaluateInUnit(queryUnit(scope), expression);
    }

    public AnalysisSet evaluate(Node expression) {
        return evaluate(expression, entry.module().scope());
    }

    // the variables of the module scope that hold at least one value, sorted
    public List<String> variableNames() {
        return entry.module().scope().variables().entrySet().stream()
                .filter(e -> !e.getValue().types().isEmpty())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    private AnalysisUnit queryUnit(EnvironmentRecord scope) {
        ModuleValue module = entry.module();
        AnalysisUnit unit = module.unitFor(scope);
        if (unit == null) {
            throw new IllegalArgumentException("Scope " + scope + " has no analysis unit in " + entry.name());
        }
        return unit.copyForQuery();
    }

    @Nullable
    public VariableDef variable(String name) {
        return entry.module().scope().variables().get(name);
    }
}
