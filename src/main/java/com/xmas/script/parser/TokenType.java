package com.xmas.script.parser;

public enum TokenType {
    // Keywords
    IF, FOR, OF, INPUT, LEN, MAX, MIN, FLOOR, CEIL,

    // Literals
    NUMBER, STRING, TRUE, FALSE, IDENTIFIER,

    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    TILDE, BANG,
    PIPE, PIPE_GREATER,
    AND_AND, OR_OR,
    LESS, GREATER, LESS_EQUAL, GREATER_EQUAL, EQUAL_EQUAL,

    // Compound assignment
    PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL, PERCENT_EQUAL,

    // Punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, EQUAL, DOT, DOT_DOT, UNDERSCORE,

    // Structural
    COMMENT, NEWLINE,

    // A character sequence with no meaning (a lone '&'); rejected by the parser.
    INVALID,

    EOF
}
