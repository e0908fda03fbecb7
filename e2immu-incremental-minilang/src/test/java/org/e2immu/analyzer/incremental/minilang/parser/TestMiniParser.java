package org.e2immu.analyzer.incremental.minilang.parser;

import org.e2immu.analyzer.incremental.minilang.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestMiniParser {

    @Test
    public void testStatements() {
        String source = """
                var x = 1;
                var s;
                function f(a, b) {
                    return a + b;
                }
                x = f(x, "s");
                m.y = [1, 'two'];
                export x as y;
                var c = [for (v of x) v + 1];
                require("other").z; // comment
                """;
        MiniTree tree = MiniParser.parse("test", source);
        assertEquals("test", tree.name());
        List<MiniNode> statements = tree.root().statements();
        assertEquals(8, statements.size());

        VarStatement x = assertInstanceOf(VarStatement.class, statements.get(0));
        assertEquals("x", x.name());
        assertEquals("1", assertInstanceOf(NumberLiteral.class, x.initializer()).text());
        assertNull(assertInstanceOf(VarStatement.class, statements.get(1)).initializer());

        FunctionDeclaration f = assertInstanceOf(FunctionDeclaration.class, statements.get(2));
        assertEquals(List.of("a", "b"), f.parameters());
        assertEquals(3, f.line());
        ReturnStatement rs = assertInstanceOf(ReturnStatement.class, f.body().statements().get(0));
        BinaryExpression plus = assertInstanceOf(BinaryExpression.class, rs.value());
        assertEquals("+", plus.operator());

        AssignmentStatement call = assertInstanceOf(AssignmentStatement.class, statements.get(3));
        CallExpression ce = assertInstanceOf(CallExpression.class, call.value());
        assertEquals(2, ce.arguments().size());
        assertEquals("s", assertInstanceOf(StringLiteral.class, ce.arguments().get(1)).value());

        AssignmentStatement member = assertInstanceOf(AssignmentStatement.class, statements.get(4));
        assertEquals("y", assertInstanceOf(MemberExpression.class, member.target()).member());
        assertEquals(2, assertInstanceOf(ArrayLiteral.class, member.value()).elements().size());

        ExportStatement export = assertInstanceOf(ExportStatement.class, statements.get(5));
        assertEquals("x", export.name());
        assertEquals("y", export.alias());

        VarStatement c = assertInstanceOf(VarStatement.class, statements.get(6));
        ComprehensionExpression comprehension = assertInstanceOf(ComprehensionExpression.class, c.initializer());
        assertEquals("v", comprehension.variable());
        assertEquals("9:9", comprehension.position());

        ExpressionStatement es = assertInstanceOf(ExpressionStatement.class, statements.get(7));
        MemberExpression me = assertInstanceOf(MemberExpression.class, es.expression());
        assertEquals("other", assertInstanceOf(RequireExpression.class, me.object()).module());
    }

    @Test
    public void testTreeOfNodes() {
        MiniTree tree = MiniParser.parse("t", "function f() { var z = [true, null]; }");
        FunctionDeclaration f = (FunctionDeclaration) tree.root().statements().get(0);
        VarStatement z = (VarStatement) f.body().statements().get(0);
        assertSame(tree, z.initializer().globalParent());
        assertSame(tree, tree.root().globalParent());
        assertEquals("VarStatement", z.nodeType());
    }

    @Test
    public void testPrecedence() {
        MiniNode e = MiniParser.parseExpression("a.b(1) + (c + d)");
        BinaryExpression plus = assertInstanceOf(BinaryExpression.class, e);
        assertInstanceOf(CallExpression.class, plus.left());
        assertInstanceOf(BinaryExpression.class, plus.right());
        assertNull(e.globalParent());
    }

    @Test
    public void testErrors() {
        ParseException pe = assertThrows(ParseException.class, () -> MiniParser.parse("t", "var = 3;"));
        assertEquals(1, pe.getLine());
        assertEquals(5, pe.getColumn());

        ParseException pe2 = assertThrows(ParseException.class, () -> MiniParser.parse("t", "var x;\n  1 = 2;"));
        assertEquals(2, pe2.getLine());
        assertEquals(3, pe2.getColumn());
        assertEquals("2:3: Cannot assign to this expression", pe2.getMessage());

        assertThrows(ParseException.class, () -> MiniParser.parse("t", "var s = \"abc;"));
        assertThrows(ParseException.class, () -> MiniParser.parse("t", "var for;"));
        assertThrows(ParseException.class, () -> MiniParser.parse("t", "function f() { return 1;"));
        assertThrows(ParseException.class, () -> MiniParser.parse("t", "var x = 1 # 2;"));
        assertThrows(ParseException.class, () -> MiniParser.parseExpression("a b"));
    }
}
