package org.e2immu.analyzer.incremental.engine.unit;

import org.e2immu.analyzer.incremental.engine.ddg.DDG;

interface AnalysisPass {

    void analyze(AnalysisUnit unit, DDG ddg);
}
