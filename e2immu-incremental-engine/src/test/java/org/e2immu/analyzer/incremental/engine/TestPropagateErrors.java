package org.e2immu.analyzer.incremental.engine;

import org.e2immu.analyzer.incremental.common.AnalyzerException;
import org.junit.jupiter.api.Test;

import static org.e2immu.analyzer.incremental.engine.StepNode.step;
import static org.junit.jupiter.api.Assertions.*;

public class TestPropagateErrors extends CommonTest {

    @Test
    public void test() {
        entry("m", step("throw", (ddg, n) -> {
            throw new IllegalArgumentException("bad rule");
        }));
        AnalyzerException ae = assertThrows(AnalyzerException.class, () -> analyzer.analyzeQueue(ddg));
        assertEquals("m", ae.getUnitName());
        assertInstanceOf(IllegalArgumentException.class, ae.getCause());
        assertThrows(Exception.class, () -> ddg.currentUnit(), "current unit is reset after a failure");
    }
}
