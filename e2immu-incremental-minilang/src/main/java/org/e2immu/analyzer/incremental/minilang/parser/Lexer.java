package org.e2immu.analyzer.incremental.minilang.parser;

import java.util.ArrayList;
import java.util.List;

/*
Splits source text into tokens. Line comments start with //. Strings use single or double quotes,
with backslash escapes for the quote, the backslash, n and t.
 */
class Lexer {
    private static final String SYMBOLS = "(){}[],;.=+";

    private final String source;
    private int pos;
    private int line = 1;
    private int column = 1;

    Lexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Kind.EOF, "", line, column));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '/' && pos + 1 < source.length() && source.charAt(pos + 1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') advance();
            } else if (Character.isWhitespace(c)) {
                advance();
            } else {
                return;
            }
        }
    }

    private Token next() {
        int startLine = line;
        int startColumn = column;
        char c = source.charAt(pos);
        if (Character.isDigit(c)) {
            int start = pos;
            while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.'
                                             && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                advance();
            }
            return new Token(Token.Kind.NUMBER, source.substring(start, pos), startLine, startColumn);
        }
        if (Character.isJavaIdentifierStart(c)) {
            int start = pos;
            while (pos < source.length() && Character.isJavaIdentifierPart(source.charAt(pos))) advance();
            return new Token(Token.Kind.IDENTIFIER, source.substring(start, pos), startLine, startColumn);
        }
        if (c == '"' || c == '\'') {
            return string(c, startLine, startColumn);
        }
        if (SYMBOLS.indexOf(c) >= 0) {
            advance();
            return new Token(Token.Kind.SYMBOL, String.valueOf(c), startLine, startColumn);
        }
        throw new ParseException("Unexpected character '" + c + "'", startLine, startColumn);
    }

    private Token string(char quote, int startLine, int startColumn) {
        advance();
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= source.length() || source.charAt(pos) == '\n') {
                throw new ParseException("Unterminated string", startLine, startColumn);
            }
            char c = source.charAt(pos);
            advance();
            if (c == quote) break;
            if (c == '\\') {
                if (pos >= source.length()) throw new ParseException("Unterminated string", startLine, startColumn);
                char escaped = source.charAt(pos);
                advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case '\\', '"', '\'' -> sb.append(escaped);
                    default -> throw new ParseException("Unknown escape \\" + escaped, line, column - 2);
                }
            } else {
                sb.append(c);
            }
        }
        return new Token(Token.Kind.STRING, sb.toString(), startLine, startColumn);
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }
}
