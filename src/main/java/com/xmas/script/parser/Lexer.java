package com.xmas.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns source text into a flat token list, one code point at a time. Never fails: characters with no
 * meaning are skipped, unterminated strings run to the end of input, and a lone
 * '&' becomes an {@link TokenType#INVALID} token for the parser to reject.
 * The list always ends with an EOF token.
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private Position startPosition;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("if", TokenType.IF);
        map.put("for", TokenType.FOR);
        map.put("of", TokenType.OF);
        map.put("input", TokenType.INPUT);
        map.put("len", TokenType.LEN);
        map.put("max", TokenType.MAX);
        map.put("min", TokenType.MIN);
        map.put("floor", TokenType.FLOOR);
        map.put("ceil", TokenType.CEIL);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startPosition = new Position(line, column);
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, new Position(line, column)));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '~': addToken(TokenType.TILDE); break;
            case '!': addToken(TokenType.BANG); break;
            case '+': addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS); break;
            case '-': addToken(match('=') ? TokenType.MINUS_EQUAL : TokenType.MINUS); break;
            case '*': addToken(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR); break;
            case '%': addToken(match('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '.': addToken(match('.') ? TokenType.DOT_DOT : TokenType.DOT); break;

            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                    addToken(TokenType.COMMENT, source.substring(start + 2, current));
                } else if (match('=')) {
                    addToken(TokenType.SLASH_EQUAL);
                } else {
                    addToken(TokenType.SLASH);
                }
                break;

            case '>':
                if (match('=')) addToken(TokenType.GREATER_EQUAL);
                else if (match('|')) addToken(TokenType.PIPE_GREATER);
                else addToken(TokenType.GREATER);
                break;

            case '|':
                if (match('>')) addToken(TokenType.PIPE_GREATER);
                else if (match('|')) addToken(TokenType.OR_OR);
                else addToken(TokenType.PIPE);
                break;

            case '&':
                addToken(match('&') ? TokenType.AND_AND : TokenType.INVALID);
                break;

            case '_':
                if (isAlphaNumeric(peek())) identifier();
                else addToken(TokenType.UNDERSCORE);
                break;

            case '\n':
                addToken(TokenType.NEWLINE);
                line++;
                column = 1;
                break;

            case ' ': case '\r': case '\t':
                break;

            case '"':
                string();
                break;

            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                // anything else carries no meaning and is dropped
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.get(text);
        if (type == null) addToken(TokenType.IDENTIFIER, text);
        else addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        long value;
        try {
            value = Long.parseLong(source.substring(start, current));
        } catch (NumberFormatException e) {
            // digits only, so this is an out-of-range literal
            value = 0L;
        }
        addToken(TokenType.NUMBER, value);
    }

    private void string() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            int from = current;
            char ch = advance();
            if (ch == '\n') {
                line++;
                column = 1;
            }
            if (ch == '\\' && !isAtEnd()) {
                switch (peek()) {
                    case 'n': advance(); sb.append('\n'); continue;
                    case 't': advance(); sb.append('\t'); continue;
                    case '\\': advance(); sb.append('\\'); continue;
                    case '"': advance(); sb.append('"'); continue;
                    default: break;
                }
            }
            sb.append(source, from, current);
        }
        if (!isAtEnd()) advance(); // closing quote
        addToken(TokenType.STRING, sb.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }

    /** Consumes one code point; columns count code points, not UTF-16 units. */
    private char advance() {
        column++;
        char c = source.charAt(current++);
        if (Character.isHighSurrogate(c) && !isAtEnd() && Character.isLowSurrogate(source.charAt(current))) {
            current++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startPosition));
    }
}
