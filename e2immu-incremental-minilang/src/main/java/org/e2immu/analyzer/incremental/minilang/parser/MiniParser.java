package org.e2immu.analyzer.incremental.minilang.parser;

import org.e2immu.analyzer.incremental.minilang.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser of the mini language.
 * <pre>
 * program    := statement* EOF
 * statement  := 'var' name ('=' expression)? ';'
 *             | 'function' name '(' (name (',' name)*)? ')' block
 *             | 'return' expression? ';'
 *             | 'export' name 'as' name ';'
 *             | expression ('=' expression)? ';'
 * block      := '{' statement* '}'
 * expression := postfix ('+' postfix)*
 * postfix    := primary ('.' name | '(' arguments? ')')*
 * primary    := number | string | 'true' | 'false' | 'null' | 'require' '(' string ')' | name
 *             | '(' expression ')' | '[' 'for' '(' name 'of' expression ')' expression ']'
 *             | '[' (expression (',' expression)*)? ']'
 * </pre>
 */
public class MiniParser {
    private static final Set<String> RESERVED = Set.of("var", "function", "return", "export", "true", "false",
            "null", "require", "for");

    private final List<Token> tokens;
    private int index;

    private MiniParser(String source) {
        this.tokens = new Lexer(source).tokenize();
    }

    public static MiniTree parse(String name, String source) {
        MiniParser parser = new MiniParser(source);
        Block root = parser.program();
        return new MiniTree(name, root);
    }

    // a single expression, e.g. for a query; the result does not belong to a tree
    public static MiniNode parseExpression(String source) {
        MiniParser parser = new MiniParser(source);
        MiniNode expression = parser.expression();
        parser.expect(Token.Kind.EOF);
        return expression;
    }

    private Block program() {
        Token first = peek();
        List<MiniNode> statements = new ArrayList<>();
        while (peek().kind() != Token.Kind.EOF) {
            statements.add(statement());
        }
        return new Block(first.line(), first.column(), statements);
    }

    private MiniNode statement() {
        Token t = peek();
        if (t.isKeyword("var")) {
            next();
            String name = name();
            MiniNode initializer = null;
            if (accept("=")) {
                initializer = expression();
            }
            expectSymbol(";");
            return new VarStatement(t.line(), t.column(), name, initializer);
        }
        if (t.isKeyword("function")) {
            next();
            String name = name();
            expectSymbol("(");
            List<String> parameters = new ArrayList<>();
            if (!accept(")")) {
                do {
                    parameters.add(name());
                } while (accept(","));
                expectSymbol(")");
            }
            Block body = block();
            return new FunctionDeclaration(t.line(), t.column(), name, parameters, body);
        }
        if (t.isKeyword("return")) {
            next();
            MiniNode value = peek().isSymbol(";") ? null : expression();
            expectSymbol(";");
            return new ReturnStatement(t.line(), t.column(), value);
        }
        if (t.isKeyword("export")) {
            next();
            String name = name();
            Token as = next();
            if (!as.isKeyword("as")) throw error("Expected 'as'", as);
            String alias = name();
            expectSymbol(";");
            return new ExportStatement(t.line(), t.column(), name, alias);
        }
        MiniNode expression = expression();
        if (accept("=")) {
            if (!(expression instanceof NameExpression) && !(expression instanceof MemberExpression)) {
                throw error("Cannot assign to this expression", t);
            }
            MiniNode value = expression();
            expectSymbol(";");
            return new AssignmentStatement(t.line(), t.column(), expression, value);
        }
        expectSymbol(";");
        return new ExpressionStatement(t.line(), t.column(), expression);
    }

    private Block block() {
        Token open = expectSymbol("{");
        List<MiniNode> statements = new ArrayList<>();
        while (!accept("}")) {
            if (peek().kind() == Token.Kind.EOF) throw error("Expected '}'", peek());
            statements.add(statement());
        }
        return new Block(open.line(), open.column(), statements);
    }

    private MiniNode expression() {
        MiniNode left = postfix();
        while (peek().isSymbol("+")) {
            Token plus = next();
            MiniNode right = postfix();
            left = new BinaryExpression(plus.line(), plus.column(), left, "+", right);
        }
        return left;
    }

    private MiniNode postfix() {
        MiniNode expression = primary();
        while (true) {
            Token t = peek();
            if (accept(".")) {
                expression = new MemberExpression(t.line(), t.column(), expression, name());
            } else if (accept("(")) {
                List<MiniNode> arguments = new ArrayList<>();
                if (!accept(")")) {
                    do {
                        arguments.add(expression());
                    } while (accept(","));
                    expectSymbol(")");
                }
                expression = new CallExpression(t.line(), t.column(), expression, arguments);
            } else {
                return expression;
            }
        }
    }

    private MiniNode primary() {
        Token t = next();
        switch (t.kind()) {
            case NUMBER:
                return new NumberLiteral(t.line(), t.column(), t.text());
            case STRING:
                return new StringLiteral(t.line(), t.column(), t.text());
            case IDENTIFIER:
                return identifier(t);
            case SYMBOL:
                if (t.isSymbol("(")) {
                    MiniNode expression = expression();
                    expectSymbol(")");
                    return expression;
                }
                if (t.isSymbol("[")) {
                    return array(t);
                }
                break;
        }
        throw error("Unexpected " + t, t);
    }

    private MiniNode identifier(Token t) {
        switch (t.text()) {
            case "true":
                return new BooleanLiteral(t.line(), t.column(), true);
            case "false":
                return new BooleanLiteral(t.line(), t.column(), false);
            case "null":
                return new NullLiteral(t.line(), t.column());
            case "require": {
                expectSymbol("(");
                Token module = expect(Token.Kind.STRING);
                expectSymbol(")");
                return new RequireExpression(t.line(), t.column(), module.text());
            }
            default:
                if (RESERVED.contains(t.text())) throw error("Unexpected " + t, t);
                return new NameExpression(t.line(), t.column(), t.text());
        }
    }

    private MiniNode array(Token open) {
        if (peek().isKeyword("for")) {
            next();
            expectSymbol("(");
            String variable = name();
            Token of = next();
            if (!of.isKeyword("of")) throw error("Expected 'of'", of);
            MiniNode source = expression();
            expectSymbol(")");
            MiniNode body = expression();
            expectSymbol("]");
            return new ComprehensionExpression(open.line(), open.column(), variable, source, body);
        }
        List<MiniNode> elements = new ArrayList<>();
        if (!accept("]")) {
            do {
                elements.add(expression());
            } while (accept(","));
            expectSymbol("]");
        }
        return new ArrayLiteral(open.line(), open.column(), elements);
    }

    private String name() {
        Token t = expect(Token.Kind.IDENTIFIER);
        if (RESERVED.contains(t.text())) throw error("Reserved word " + t + " cannot be used as a name", t);
        return t.text();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token t = tokens.get(index);
        if (t.kind() != Token.Kind.EOF) index++;
        return t;
    }

    private boolean accept(String symbol) {
        if (peek().isSymbol(symbol)) {
            next();
            return true;
        }
        return false;
    }

    private Token expectSymbol(String symbol) {
        Token t = next();
        if (!t.isSymbol(symbol)) throw error("Expected '" + symbol + "' but got " + t, t);
        return t;
    }

    private Token expect(Token.Kind kind) {
        Token t = next();
        if (t.kind() != kind) throw error("Expected " + kind.name().toLowerCase() + " but got " + t, t);
        return t;
    }

    private static ParseException error(String message, Token t) {
        return new ParseException(message, t.line(), t.column());
    }
}
