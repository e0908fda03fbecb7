package org.e2immu.analyzer.incremental.engine.unit;

import org.e2immu.analyzer.incremental.common.ProtocolViolationException;
import org.e2immu.analyzer.incremental.engine.ddg.DDG;

/*
walk only; the unit is eval-only, so the walk neither contributes values nor registers dependents
 */
class QueryAnalysisPass implements AnalysisPass {

    @Override
    public void analyze(AnalysisUnit unit, DDG ddg) {
        if (!unit.isForEval()) {
            throw new ProtocolViolationException("Query pass on unit that is not eval-only: " + unit);
        }
        ddg.setCurrentUnit(unit);
        unit.ast().walk(ddg);
    }
}
