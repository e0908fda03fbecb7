package org.e2immu.analyzer.incremental.minilang.parser;

record Token(Kind kind, String text, int line, int column) {

    enum Kind {NUMBER, STRING, IDENTIFIER, SYMBOL, EOF}

    boolean is(Kind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    boolean isSymbol(String symbol) {
        return is(Kind.SYMBOL, symbol);
    }

    boolean isKeyword(String keyword) {
        return is(Kind.IDENTIFIER, keyword);
    }

    @Override
    public String toString() {
        return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }
}
