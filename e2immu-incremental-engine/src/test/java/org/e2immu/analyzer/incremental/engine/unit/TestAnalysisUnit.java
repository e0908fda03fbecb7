package org.e2immu.analyzer.incremental.engine.unit;

import org.e2immu.analyzer.incremental.common.CancellationToken;
import org.e2immu.analyzer.incremental.engine.CommonTest;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.query.ModuleAnalysis;
import org.e2immu.analyzer.incremental.engine.value.AnalysisSet;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.e2immu.analyzer.incremental.engine.StepNode.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestAnalysisUnit extends CommonTest {

    private ProjectEntry module() {
        ProjectEntry m = entry("m",
                step("x = 1", (ddg, n) -> ddg.write(n, "x", AnalysisSet.of(NUMBER))),
                declaration("function f", (ddg, n) -> ddg.function(n, "f", "p"),
                        block("body f", step("y = x", (ddg, n) -> ddg.write(n, "y", ddg.read(n, "x"))))));
        drain();
        return m;
    }

    @Test
    public void testNames() {
        ProjectEntry m = module();
        AnalysisUnit moduleUnit = m.module().unit();
        AnalysisUnit f = m.module().units().get(1);
        assertEquals("m", moduleUnit.fullName());
        assertEquals("m.f", f.fullName());
        assertTrue(f.toString().startsWith("<FUNCTION: Name=m.f ("), f.toString());
        assertTrue(f.toString().endsWith("NodeType=Step>"), f.toString());
        assertSame(m.module(), f.declaringModule());
        assertSame(m, f.projectEntry());
        assertEquals(UnitKind.FUNCTION, f.kind());
        assertSame(m.tree(), f.tree());
    }

    @Test
    public void testSoleMember() {
        ProjectEntry m = module();
        AnalysisUnit moduleUnit = m.module().unit();
        AnalysisUnit f = m.module().units().get(1);
        assertTrue(f.isSoleMemberOf(Set.of(f)));
        assertFalse(f.isSoleMemberOf(Set.of(f, moduleUnit)));
        assertFalse(f.isSoleMemberOf(List.of()));
        assertFalse(f.isSoleMemberOf(List.of(f.copyForQuery())));
    }

    @Test
    public void testEvalOnlyIsolation() {
        ProjectEntry m = module();
        AnalysisUnit f = m.module().units().get(1);
        VariableDef x = m.module().scope().variables().get("x");
        Set<AnalysisUnit> dependentsBefore = x.dependents();

        AnalysisUnit query = f.copyForQuery();
        assertTrue(query.isForEval());
        assertEquals(UnitKind.QUERY, query.kind());
        assertEquals("m.f", query.fullName());
        for (int i = 0; i < 5; i++) {
            assertEquals(AnalysisSet.of(NUMBER), query.findValueByName(f.ast(), "x"));
            assertEquals(AnalysisSet.EMPTY, query.findValueByName(f.ast(), "unknown"));
        }
        assertEquals(dependentsBefore, x.dependents());
        assertFalse(m.module().scope().containsVariable("unknown"), "no placeholder for queries");
        assertFalse(x.addTypes(query, AnalysisSet.of(STRING)));
        assertEquals(AnalysisSet.of(NUMBER), x.types());

        clearEvents();
        assertTrue(query.analyze(ddg, CancellationToken.NONE));
        assertTrue(enqueued.isEmpty());
        assertTrue(analyzer.queue().isEmpty());
        assertEquals(dependentsBefore, x.dependents());
    }

    @Test
    public void testPlaceholderOnMiss() {
        ProjectEntry m = module();
        AnalysisUnit f = m.module().units().get(1);
        assertEquals(AnalysisSet.EMPTY, f.findValueByName(f.ast(), "z"));
        VariableDef z = m.module().scope().variables().get("z");
        assertNotNull(z);
        assertEquals(Set.of(f), z.dependents());
        assertFalse(z.isDead());
    }

    @Test
    public void testCancelledAnalysis() {
        ProjectEntry m = module();
        AnalysisUnit f = m.module().units().get(1);
        int count = f.analysisCount();
        CancellationToken token = new CancellationToken();
        token.cancel();
        assertFalse(f.analyze(ddg, token));
        assertEquals(count, f.analysisCount());
    }

    @Test
    public void testStale() {
        ProjectEntry m = module();
        AnalysisUnit moduleUnit = m.module().unit();
        AnalysisUnit f = m.module().units().get(1);
        assertFalse(f.isStale());

        m.updateTree(tree("m"));
        assertTrue(f.isStale());
        assertTrue(moduleUnit.isStale());
        assertFalse(m.module().unit().isStale());
        assertFalse(m.module().arena().contains(f.scope()), "the scopes of the old tree are gone");
        assertEquals(1, m.module().arena().size());
        assertSame(m.module(), f.declaringModule());
        drain();
    }

    @Test
    public void testQueryThroughModuleAnalysis() {
        ProjectEntry m = module();
        AnalysisUnit f = m.module().units().get(1);
        ModuleAnalysis moduleAnalysis = new ModuleAnalysis(m, ddg);
        assertEquals(AnalysisSet.of(NUMBER), moduleAnalysis.valuesOf("x"));
        assertEquals(AnalysisSet.of(NUMBER), moduleAnalysis.valuesOf("y"));
        assertEquals(AnalysisSet.of(NUMBER), moduleAnalysis.valuesOf("x", f.scope()));
        assertEquals(AnalysisSet.EMPTY, moduleAnalysis.valuesOf("p", f.scope()));
        assertEquals(List.of("x", "y"), moduleAnalysis.variableNames());
        assertEquals(AnalysisSet.of(STRING), moduleAnalysis.evaluate(expression("'s'",
                d -> AnalysisSet.of(STRING))));
        assertEquals(AnalysisSet.of(NUMBER), moduleAnalysis.evaluate(expression("x",
                d -> d.read(f.ast(), "x")), f.scope()));
        assertTrue(analyzer.queue().isEmpty());
    }
}
