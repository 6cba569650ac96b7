import com.xmas.script.parser.Lexer;
import com.xmas.script.parser.Position;
import com.xmas.script.parser.Token;
import com.xmas.script.parser.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class XmasLexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void compound_and_multi_char_operators_are_greedy() {
        assertEquals(List.of(
                TokenType.PLUS_EQUAL, TokenType.MINUS_EQUAL, TokenType.STAR_EQUAL, TokenType.SLASH_EQUAL,
                TokenType.PERCENT_EQUAL, TokenType.EQUAL_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                TokenType.PIPE_GREATER, TokenType.AND_AND, TokenType.OR_OR, TokenType.DOT_DOT, TokenType.EOF),
                types("+= -= *= /= %= == <= >= |> && || .."));
    }

    @Test
    void range_dots_are_not_part_of_a_number() {
        List<Token> tokens = new Lexer("5..10").tokenize();
        assertEquals(TokenType.NUMBER, tokens.get(0).type);
        assertEquals(5L, tokens.get(0).literal());
        assertEquals(TokenType.DOT_DOT, tokens.get(1).type);
        assertEquals(10L, tokens.get(2).literal());
    }

    @Test
    void underscore_alone_is_return_token_and_prefix_makes_identifier() {
        List<Token> tokens = new Lexer("_ _sum").tokenize();
        assertEquals(TokenType.UNDERSCORE, tokens.get(0).type);
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type);
        assertEquals("_sum", tokens.get(1).literal());
    }

    @Test
    void keywords_are_recognised() {
        assertEquals(List.of(TokenType.IF, TokenType.FOR, TokenType.OF, TokenType.INPUT, TokenType.LEN,
                TokenType.MAX, TokenType.MIN, TokenType.FLOOR, TokenType.CEIL, TokenType.TRUE, TokenType.FALSE,
                TokenType.IDENTIFIER, TokenType.EOF),
                types("if for of input len max min floor ceil true false rows"));
    }

    @Test
    void string_escapes_are_decoded() {
        Token t = new Lexer("\"a\\\"b\\n\\t\\\\\"").tokenize().get(0);
        assertEquals(TokenType.STRING, t.type);
        assertEquals("a\"b\n\t\\", t.literal());
    }

    @Test
    void unterminated_string_runs_to_end_of_input() {
        List<Token> tokens = new Lexer("x = \"abc").tokenize();
        assertEquals(TokenType.STRING, tokens.get(2).type);
        assertEquals("abc", tokens.get(2).literal());
        assertEquals(TokenType.EOF, tokens.get(3).type);
    }

    @Test
    void newlines_and_comments_are_tokens() {
        List<Token> tokens = new Lexer("x // note\ny").tokenize();
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type);
        assertEquals(TokenType.COMMENT, tokens.get(1).type);
        assertEquals(" note", tokens.get(1).literal());
        assertEquals(TokenType.NEWLINE, tokens.get(2).type);
        assertEquals(TokenType.IDENTIFIER, tokens.get(3).type);
    }

    @Test
    void positions_are_one_based_and_track_lines() {
        List<Token> tokens = new Lexer("x += 5\n  y").tokenize();
        assertEquals(new Position(1, 1), tokens.get(0).position);
        assertEquals(new Position(1, 3), tokens.get(1).position);
        assertEquals(new Position(1, 6), tokens.get(2).position);
        assertEquals(new Position(2, 3), tokens.get(4).position);
    }

    @Test
    void columns_count_code_points_outside_the_bmp() {
        List<Token> tokens = new Lexer("s = \"\uD83C\uDF84x\" & t").tokenize();
        assertEquals("\uD83C\uDF84x", tokens.get(2).literal());
        assertEquals(new Position(1, 5), tokens.get(2).position);
        assertEquals(TokenType.INVALID, tokens.get(3).type);
        assertEquals(new Position(1, 10), tokens.get(3).position);
        assertEquals(new Position(1, 12), tokens.get(4).position);
    }

    @Test
    void single_ampersand_is_invalid_and_unknown_characters_are_skipped() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.INVALID, TokenType.IDENTIFIER, TokenType.EOF),
                types("a & b"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF),
                types("a @ ; $ b"));
    }

    @Test
    void both_pipe_spellings_and_lone_bar() {
        assertEquals(List.of(TokenType.PIPE_GREATER, TokenType.PIPE_GREATER, TokenType.PIPE, TokenType.EOF),
                types("|> >| |"));
    }

    @Test
    void out_of_range_number_literal_becomes_zero() {
        Token t = new Lexer("99999999999999999999").tokenize().get(0);
        assertEquals(TokenType.NUMBER, t.type);
        assertEquals(0L, t.literal());
    }

    @Test
    void empty_source_yields_only_eof() {
        assertEquals(List.of(TokenType.EOF), types(""));
    }
}
