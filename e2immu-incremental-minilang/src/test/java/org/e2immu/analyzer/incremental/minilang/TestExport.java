package org.e2immu.analyzer.incremental.minilang;

import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestExport extends CommonTest {

    @DisplayName("an exported name follows the variable it links to")
    @Test
    public void test1() {
        project.setSource("a", """
                var x = 1;
                export x as y;
                x = "s";
                """);
        ProjectEntry b = project.setSource("b", "var z = require(\"a\").y;");
        analyze();
        assertEquals("{Number, String}", values("a", "y"));
        assertEquals("{Number, String}", values("b", "z"));

        VariableDef x = project.moduleAnalysis("a").variable("x");
        assertNotNull(x);
        assertTrue(x.dependents().contains(b.module().unit()), "readers of y depend on x");
        assertNotNull(project.analyzer().entry("a").module().scope().getLinkedVariablesNoCreate("y"));
    }

    @DisplayName("removing the export removes the exported name")
    @Test
    public void test2() {
        project.setSource("a", """
                var x = 1;
                export x as y;
                """);
        project.setSource("b", "var z = require(\"a\").y;");
        analyze();
        assertEquals("{Number}", values("b", "z"));

        project.setSource("a", "var x = 1;");
        analyze();
        assertEquals("{}", values("a", "y"));
        assertNull(project.analyzer().entry("a").module().scope().getLinkedVariablesNoCreate("y"));
    }
}
