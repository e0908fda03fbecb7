package org.e2immu.analyzer.incremental.minilang;

import org.e2immu.analyzer.incremental.engine.query.ModuleAnalysis;
import org.e2immu.analyzer.incremental.engine.value.FunctionValue;
import org.e2immu.analyzer.incremental.minilang.parser.MiniParser;
import org.e2immu.analyzer.incremental.minilang.parser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestModuleAnalysis extends CommonTest {

    private static final String SOURCE = """
            var x = 1;
            function f(p) {
                var local = p + "";
                return p;
            }
            var r = f(x);
            var arr = [x];
            """;

    @Test
    public void testEvaluate() {
        project.setSource("m", SOURCE);
        analyze();
        assertEquals("{Number}", project.evaluate("m", "x + 1").toString());
        assertEquals("{String}", project.evaluate("m", "x + \"\"").toString());
        assertEquals("{Number}", project.evaluate("m", "f(\"s\")").toString());
        assertEquals("{}", project.evaluate("m", "[for (v of arr) v]").toString(), "queries create nothing");
        assertEquals("{Number}", project.evaluate("m", "arr.length").toString());

        FunctionValue f = single(project.moduleAnalysis("m").valuesOf("f"), FunctionValue.class);
        assertEquals("{Number}", f.scope().variables().get("p").types().toString(), "queries contribute nothing");
        assertTrue(project.analyzer().queue().isEmpty());
        assertEquals(0, project.analyze().unitsAnalyzed());
    }

    @Test
    public void testScopes() {
        project.setSource("m", SOURCE);
        analyze();
        ModuleAnalysis moduleAnalysis = project.moduleAnalysis("m");
        FunctionValue f = single(moduleAnalysis.valuesOf("f"), FunctionValue.class);
        assertEquals("{String}", moduleAnalysis.valuesOf("local", f.scope()).toString());
        assertEquals("{Number}", moduleAnalysis.valuesOf("x", f.scope()).toString());
        assertEquals("{}", moduleAnalysis.valuesOf("local").toString());
        assertEquals("{String}", moduleAnalysis.evaluate(
                MiniParser.parseExpression("local"), f.scope()).toString());
        assertEquals(List.of("arr", "f", "r", "x"), moduleAnalysis.variableNames());
    }

    @Test
    public void testErrors() {
        project.setSource("m", SOURCE);
        analyze();
        assertThrows(IllegalArgumentException.class, () -> project.moduleAnalysis("unknown"));
        assertThrows(ParseException.class, () -> project.evaluate("m", "x +"));
    }
}
