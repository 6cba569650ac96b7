package com.xmas.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    final Object literal;
    public final Position position;

    Token(TokenType type, String lexeme, Object literal, Position position) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.position = position;
    }

    /** Number value for NUMBER, text for STRING/IDENTIFIER/COMMENT, null otherwise. */
    public Object literal() {
        return literal;
    }

    @Override
    public String toString() {
        return literal == null ? type.toString() : type + "(" + literal + ")";
    }
}
