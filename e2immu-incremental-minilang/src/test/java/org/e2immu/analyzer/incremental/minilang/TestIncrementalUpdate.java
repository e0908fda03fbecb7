package org.e2immu.analyzer.incremental.minilang;

import org.e2immu.analyzer.incremental.engine.IncrementalAnalyzer;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.minilang.parser.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestIncrementalUpdate extends CommonTest {

    private static final String X_NUMBER = """
            var x = 1;
            function f() {
                return x;
            }
            var y = f();
            """;

    @DisplayName("a new value replaces the old one")
    @Test
    public void test1() {
        ProjectEntry m = project.setSource("m", X_NUMBER);
        analyze();
        assertEquals("{Number}", values("m", "y"));
        assertEquals(1, m.analysisVersion());

        project.setSource("m", """
                var x = "s";
                function f() {
                    return x;
                }
                var y = f();
                """);
        analyze();
        assertEquals(2, m.analysisVersion());
        assertEquals("{String}", values("m", "x"));
        assertEquals("{String}", values("m", "y"));
    }

    @DisplayName("removing a declaration removes the variable")
    @Test
    public void test2() {
        project.setSource("m", X_NUMBER);
        analyze();
        assertEquals(List.of("f", "x", "y"), project.moduleAnalysis("m").variableNames());

        project.setSource("m", """
                function f() {
                    return x;
                }
                var y = f();
                """);
        analyze();
        assertEquals("{}", values("m", "x"));
        assertEquals("{}", values("m", "y"));
        assertEquals(List.of("f"), project.moduleAnalysis("m").variableNames());
    }

    @DisplayName("only the changed module is analyzed again")
    @Test
    public void test3() {
        project.setSource("a", "var x = 1;");
        project.setSource("b", "var y = 2;");
        IncrementalAnalyzer.Output output = analyze();
        assertEquals(2, output.unitsAnalyzed());

        project.setSource("a", "var x = true;");
        IncrementalAnalyzer.Output output2 = analyze();
        assertEquals(1, output2.unitsAnalyzed());
        assertEquals("{Boolean}", values("a", "x"));
        assertEquals("{Number}", values("b", "y"));
    }

    @DisplayName("a source that does not parse leaves the project as it was")
    @Test
    public void test4() {
        ProjectEntry m = project.setSource("m", X_NUMBER);
        analyze();
        assertThrows(ParseException.class, () -> project.setSource("m", "var x = ;"));
        assertEquals(1, m.analysisVersion());
        assertTrue(project.analyzer().queue().isEmpty());
        assertEquals("{Number}", values("m", "y"));
    }

    @DisplayName("the same source gives the same result")
    @Test
    public void test5() {
        project.setSource("m", X_NUMBER);
        analyze();
        project.setSource("m", X_NUMBER);
        analyze();
        assertEquals("{Number}", values("m", "x"));
        assertEquals("{Number}", values("m", "y"));
        assertEquals("{Function f}", values("m", "f"));
    }
}
