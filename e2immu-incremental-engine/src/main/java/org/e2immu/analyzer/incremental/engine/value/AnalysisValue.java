package org.e2immu.analyzer.incremental.engine.value;

import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;

import java.util.List;

/**
 * One distinguishable shape of a runtime value. Value-sets are sets of these; the analysis converges because
 * the number of distinguishable shapes in a program is finite.
 * <p>
 * The default implementations describe a value without members, which cannot be called or iterated.
 * Implementations that read state must register the reading unit as a dependent; implementations that write
 * state must merge under the writing unit, so that changes re-queue the readers.
 */
public interface AnalysisValue {

    String description();

    default AnalysisSet getMember(Node node, AnalysisUnit unit, String name) {
        return AnalysisSet.EMPTY;
    }

    default void setMember(Node node, AnalysisUnit unit, String name, AnalysisSet values) {
        // no members
    }

    default AnalysisSet call(Node node, AnalysisUnit unit, List<AnalysisSet> arguments) {
        return AnalysisSet.EMPTY;
    }

    default AnalysisSet iterate(Node node, AnalysisUnit unit) {
        return AnalysisSet.EMPTY;
    }
}
