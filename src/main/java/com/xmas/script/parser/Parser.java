package com.xmas.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.xmas.script.parser.Expr.ArrayLiteral;
import com.xmas.script.parser.Expr.Binary;
import com.xmas.script.parser.Expr.Block;
import com.xmas.script.parser.Expr.Builtin;
import com.xmas.script.parser.Expr.Call;
import com.xmas.script.parser.Expr.ExprInterface;
import com.xmas.script.parser.Expr.For;
import com.xmas.script.parser.Expr.If;
import com.xmas.script.parser.Expr.Index;
import com.xmas.script.parser.Expr.IndexComponent;
import com.xmas.script.parser.Expr.InputRef;
import com.xmas.script.parser.Expr.Literal;
import com.xmas.script.parser.Expr.Logical;
import com.xmas.script.parser.Expr.MethodCall;
import com.xmas.script.parser.Expr.Pipe;
import com.xmas.script.parser.Expr.Range;
import com.xmas.script.parser.Expr.ReturnValueRef;
import com.xmas.script.parser.Expr.Unary;
import com.xmas.script.parser.Expr.Variable;
import com.xmas.script.parser.Statement.Assign;
import com.xmas.script.parser.Statement.AssignOp;
import com.xmas.script.parser.Statement.ExprStmt;
import com.xmas.script.parser.Statement.FunctionStmt;
import com.xmas.script.parser.Statement.Return;
import com.xmas.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser. Precedence, lowest first: pipe, {@code ||},
 * {@code &&}, comparison, additive, multiplicative, unary, postfix/primary.
 *
 * <p>Newlines separate statements at top level and directly inside a block.
 * Inside {@code ()} and {@code []} they are skipped.
 */
public class Parser {
    private final List<Token> tokens;
    private final String source;
    private int current = 0;
    // open () / [] groups since the innermost statement context
    private int groupDepth = 0;

    public Parser(List<Token> tokens) {
        this(tokens, "");
    }

    public Parser(List<Token> tokens, String source) {
        List<Token> filtered = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.type != TokenType.COMMENT) filtered.add(token);
        }
        if (filtered.isEmpty() || filtered.get(filtered.size() - 1).type != TokenType.EOF) {
            Position end = filtered.isEmpty() ? new Position(1, 1) : filtered.get(filtered.size() - 1).position;
            filtered.add(new Token(TokenType.EOF, "", null, end));
        }
        this.tokens = filtered;
        this.source = source;
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        skipNewlines();
        while (!isAtEnd()) {
            statements.add(statement());
            skipNewlines();
        }
        return statements;
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_PAREN) && isFunctionDefinition()) {
            return functionDefinition();
        }

        if ((check(TokenType.IDENTIFIER) || check(TokenType.UNDERSCORE)) && isAssignmentOperator(peekNext().type)) {
            Token name = advance();
            Token operator = advance();
            ExprInterface value = expression();

            if (operator.type != TokenType.EQUAL) {
                return new AssignOp(name, operator, value);
            }
            if (name.type == TokenType.UNDERSCORE) {
                return new Return(name, null, value);
            }
            if (Statement.isNamedReturn(name.lexeme)) {
                return new Return(name, name.lexeme.substring(1), value);
            }
            return new Assign(name, value);
        }

        return new ExprStmt(expression());
    }

    /** Scans past the balanced parameter list of {@code name(...)} and checks for '='. */
    private boolean isFunctionDefinition() {
        int i = current + 2;
        int parens = 1;
        while (parens > 0 && i < tokens.size() && tokens.get(i).type != TokenType.EOF) {
            TokenType type = tokens.get(i).type;
            if (type == TokenType.LEFT_PAREN) parens++;
            else if (type == TokenType.RIGHT_PAREN) parens--;
            i++;
        }
        return parens == 0 && i < tokens.size() && tokens.get(i).type == TokenType.EQUAL;
    }

    private Stmt functionDefinition() {
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");
        consume(TokenType.LEFT_PAREN, "Expected '(' after function name");
        groupDepth++;

        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                params.add(consume(TokenType.IDENTIFIER, "Expected parameter name"));
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters");
        groupDepth--;
        consume(TokenType.EQUAL, "Expected '=' after function definition");

        ExprInterface body = expression();
        return new FunctionStmt(name, params, body);
    }

    private static boolean isAssignmentOperator(TokenType type) {
        switch (type) {
            case EQUAL:
            case PLUS_EQUAL:
            case MINUS_EQUAL:
            case STAR_EQUAL:
            case SLASH_EQUAL:
            case PERCENT_EQUAL:
                return true;
            default:
                return false;
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression() { return pipe(); }

    private ExprInterface pipe() {
        ExprInterface expr = or();
        while (match(TokenType.PIPE_GREATER)) {
            Token operator = previous();
            ExprInterface right = or();
            expr = new Pipe(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR_OR)) {
            Token operator = previous();
            ExprInterface right = and();
            expr = new Logical(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = comparison();
        while (match(TokenType.AND_AND)) {
            Token operator = previous();
            ExprInterface right = comparison();
            expr = new Logical(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface comparison() {
        ExprInterface expr = additive();
        while (match(TokenType.LESS, TokenType.GREATER, TokenType.LESS_EQUAL,
                TokenType.GREATER_EQUAL, TokenType.EQUAL_EQUAL)) {
            Token operator = previous();
            ExprInterface right = additive();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            ExprInterface right = multiplicative();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token operator = previous();
            ExprInterface right = unary();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        skipNewlines();
        if (match(TokenType.TILDE, TokenType.BANG)) {
            Token operator = previous();
            ExprInterface right = unary();
            return new Unary(operator, right);
        }
        return primary();
    }

    private ExprInterface primary() {
        skipNewlines();
        Token token = peek();

        switch (token.type) {
            case NUMBER:
            case STRING:
                advance();
                return postfix(new Literal(token.literal));
            case TRUE:
                advance();
                return postfix(new Literal(Boolean.TRUE));
            case FALSE:
                advance();
                return postfix(new Literal(Boolean.FALSE));
            case INPUT:
                advance();
                return postfix(new InputRef(token));
            case UNDERSCORE:
                advance();
                return postfix(new ReturnValueRef(token));
            case IDENTIFIER:
                advance();
                if (check(TokenType.LEFT_PAREN)) {
                    return postfix(new Call(token, arguments("arguments")));
                }
                return postfix(new Variable(token));
            case LEFT_BRACKET:
                return postfix(bracketLiteral());
            case LEFT_BRACE:
                return block();
            case LEFT_PAREN: {
                advance();
                groupDepth++;
                ExprInterface expr = expression();
                consume(TokenType.RIGHT_PAREN, "Expected ')' after expression");
                groupDepth--;
                return postfix(expr);
            }
            case IF:
                return postfix(ifForm());
            case FOR:
                return postfix(forForm());
            case LEN:
            case FLOOR:
            case CEIL:
                return postfix(builtin(1));
            case MAX:
            case MIN:
                return postfix(builtin(2));
            case INVALID:
                throw error(token, "Unexpected character '" + token.lexeme + "'");
            case EOF:
                throw error(token, "Unexpected end of input");
            default:
                throw error(token, "Unexpected token '" + token.lexeme + "'");
        }
    }

    /** {@code [a, b, c]} or the inclusive range {@code [start..end]}. */
    private ExprInterface bracketLiteral() {
        advance(); // [
        groupDepth++;

        if (isRangeLiteral()) {
            ExprInterface start = expression();
            consume(TokenType.DOT_DOT, "Expected '..' in range literal");
            ExprInterface end = expression();
            consume(TokenType.RIGHT_BRACKET, "Expected ']' after range");
            groupDepth--;
            return new Range(start, end);
        }

        List<ExprInterface> elements = new ArrayList<>();
        if (!check(TokenType.RIGHT_BRACKET)) {
            do {
                elements.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_BRACKET, "Expected ']' after array elements");
        groupDepth--;
        return new ArrayLiteral(elements);
    }

    /** Tries {@code expr .. expr ]} from the current position, then rewinds. */
    private boolean isRangeLiteral() {
        int savedCurrent = current;
        int savedDepth = groupDepth;
        try {
            expression();
            if (!match(TokenType.DOT_DOT)) return false;
            expression();
            return check(TokenType.RIGHT_BRACKET);
        } catch (XmasSyntaxException e) {
            return false;
        } finally {
            current = savedCurrent;
            groupDepth = savedDepth;
        }
    }

    private ExprInterface block() {
        advance(); // {
        int savedDepth = groupDepth;
        groupDepth = 0;

        List<Stmt> statements = new ArrayList<>();
        skipNewlines();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
            skipNewlines();
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after block");

        groupDepth = savedDepth;
        return new Block(statements);
    }

    /** {@code if(condition, then[, else])} */
    private ExprInterface ifForm() {
        Token keyword = advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'");
        groupDepth++;
        ExprInterface condition = expression();
        consume(TokenType.COMMA, "Expected ',' after condition");
        ExprInterface thenBranch = expression();
        ExprInterface elseBranch = null;
        if (match(TokenType.COMMA)) {
            elseBranch = expression();
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after if expression");
        groupDepth--;
        return new If(keyword, condition, thenBranch, elseBranch);
    }

    /** {@code for(name of array, body[, initial])} */
    private ExprInterface forForm() {
        Token keyword = advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'for'");
        groupDepth++;
        Token variable = consume(TokenType.IDENTIFIER, "Expected variable name after 'for'");
        consume(TokenType.OF, "Expected 'of' after variable name");
        ExprInterface iterable = expression();
        consume(TokenType.COMMA, "Expected ',' after array");
        ExprInterface body = expression();
        ExprInterface initial = null;
        if (match(TokenType.COMMA)) {
            initial = expression();
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after for expression");
        groupDepth--;
        return new For(keyword, variable, iterable, body, initial);
    }

    private ExprInterface builtin(int arity) {
        Token name = advance();
        if (!check(TokenType.LEFT_PAREN)) {
            throw error(peek(), "Expected '(' after '" + name.lexeme + "'");
        }
        List<ExprInterface> args = arguments(name.lexeme + " arguments");
        if (args.size() != arity) {
            throw error(name, name.lexeme + " expects " + arity
                    + (arity == 1 ? " argument" : " arguments") + ", got " + args.size());
        }
        return new Builtin(name, args);
    }

    /** Parses {@code ( expr, ... )} starting at the open paren. */
    private List<ExprInterface> arguments(String what) {
        consume(TokenType.LEFT_PAREN, "Expected '('");
        groupDepth++;
        List<ExprInterface> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after " + what);
        groupDepth--;
        return args;
    }

    /** Any number of {@code [..]} index groups and {@code .method(args)} calls. */
    private ExprInterface postfix(ExprInterface expr) {
        while (true) {
            if (check(TokenType.LEFT_BRACKET)) {
                Token bracket = advance();
                groupDepth++;
                List<IndexComponent> components = new ArrayList<>();
                do {
                    components.add(indexComponent());
                } while (match(TokenType.COMMA));
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after index");
                groupDepth--;
                expr = new Index(expr, bracket, components);
            } else if (match(TokenType.DOT)) {
                Token method = consume(TokenType.IDENTIFIER, "Expected method name after '.'");
                expr = new MethodCall(expr, method, arguments("method arguments"));
            } else {
                return expr;
            }
        }
    }

    private IndexComponent indexComponent() {
        if (match(TokenType.DOT_DOT)) {
            return IndexComponent.slice(null, openEnd() ? null : expression());
        }
        ExprInterface first = expression();
        if (match(TokenType.DOT_DOT)) {
            return IndexComponent.slice(first, openEnd() ? null : expression());
        }
        return IndexComponent.single(first);
    }

    private boolean openEnd() {
        return check(TokenType.RIGHT_BRACKET) || check(TokenType.COMMA);
    }

    // -------------------------
    // Token cursor
    // -------------------------

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    /** Raw lookahead, used only at statement start where newlines are significant anyway. */
    private boolean checkNext(TokenType type) {
        return peekNext().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }

    private Token peek() {
        if (groupDepth > 0) {
            while (tokens.get(current).type == TokenType.NEWLINE) current++;
        }
        return tokens.get(current);
    }

    private Token peekNext() {
        int next = Math.min(current + 1, tokens.size() - 1);
        return tokens.get(next);
    }

    private Token previous() { return tokens.get(current - 1); }

    private void skipNewlines() {
        while (tokens.get(current).type == TokenType.NEWLINE) current++;
    }

    private XmasSyntaxException error(Token token, String message) {
        return new XmasSyntaxException(message, token.position, source);
    }
}
