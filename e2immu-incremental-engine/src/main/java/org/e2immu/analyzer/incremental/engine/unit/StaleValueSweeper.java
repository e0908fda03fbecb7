package org.e2immu.analyzer.incremental.engine.unit;

import org.e2immu.analyzer.incremental.engine.log.AnalysisListener;
import org.e2immu.analyzer.incremental.engine.scope.EnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/*
Purge the values contributed by entries that were removed or superseded, from every variable of a scope.

A variable left without values and without dependents is removed from the scope. Anyone who read it before may
now see it gone (e.g., the user deleted the declaration), so its former dependents are enqueued.
A variable that survives, but lost values, enqueues its dependents as well.
 */
final class StaleValueSweeper {
    private static final Logger LOGGER = LoggerFactory.getLogger(StaleValueSweeper.class);

    private StaleValueSweeper() {
    }

    static void sweep(AnalysisUnit unit, EnvironmentRecord scope) {
        List<Map.Entry<String, VariableDef>> toRemove = null;
        for (Map.Entry<String, VariableDef> entry : List.copyOf(scope.variables().entrySet())) {
            VariableDef variable = entry.getValue();
            boolean shrank = variable.clearOldValues();
            if (variable.isDead()) {
                if (toRemove == null) {
                    toRemove = new ArrayList<>();
                }
                toRemove.add(entry);
            } else if (shrank) {
                variable.enqueueDependents();
            } else {
                variable.forgetFormerDependents();
            }
        }
        if (toRemove != null) {
            AnalysisListener listener = unit.projectEntry().listener();
            for (Map.Entry<String, VariableDef> entry : toRemove) {
                String name = entry.getKey();
                VariableDef variable = entry.getValue();
                if (scope.removeVariable(name, variable)) {
                    listener.variableRemoved(scope, name);
                    variable.enqueueDependents();
                } else {
                    LOGGER.debug("Removal of {} from {} deferred, the scope changed", name, scope);
                }
            }
        }
    }
}
