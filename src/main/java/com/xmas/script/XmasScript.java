package com.xmas.script;

import java.util.List;

import com.xmas.debug.Debug;
import com.xmas.script.parser.Interpreter;
import com.xmas.script.parser.Lexer;
import com.xmas.script.parser.Parser;
import com.xmas.script.parser.Statement.Stmt;
import com.xmas.script.parser.Token;
import com.xmas.script.parser.TraceListener;
import com.xmas.script.parser.Value;

/**
 * xmas engine.
 *
 * - Terse, list-oriented syntax for grid and array puzzles
 * - Types: number (64-bit integer), bool, string, 1D array, 2D array
 * - One flat global scope; blocks, calls and loops scope only the return value {@code _}
 * - The optional puzzle input is exposed as {@code input}, a 2D array of characters
 *
 * Every run starts from a fresh interpreter, so nothing carries over between runs.
 * Syntax errors surface as {@link com.xmas.script.parser.XmasSyntaxException},
 * runtime faults as {@link com.xmas.script.parser.XmasRuntimeException}.
 */
public class XmasScript {

    private static final String TAG = "xmas.engine";

    private boolean debug = false;
    private TraceListener traceListener = null;

    public XmasScript() {}

    /** Routes the interpreter trace to {@link Debug} through a {@link DebugTraceListener}. */
    public void setDebug(boolean debug) { this.debug = debug; }

    /** Replaces the trace target; takes precedence over {@link #setDebug}. */
    public void setTraceListener(TraceListener listener) { this.traceListener = listener; }

    public List<Stmt> parse(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        List<Stmt> program = new Parser(tokens, source).parse();
        Debug.get().t(TAG, "parsed " + program.size() + " statements from " + tokens.size() + " tokens");
        return program;
    }

    public Value run(String source) {
        return run(source, null);
    }

    public Value run(String source, String input) {
        return runWithResult(source, input).getValue();
    }

    public RunResult runWithResult(String source, String input) {
        List<Stmt> program = parse(source);

        Interpreter interpreter = new Interpreter();
        interpreter.setTraceListener(effectiveTraceListener());
        interpreter.setInput(input);

        Value value = interpreter.interpret(program);
        Debug.get().t(TAG, "run finished: " + value.type);
        return new RunResult(value, interpreter.getEnvironment().snapshot());
    }

    private TraceListener effectiveTraceListener() {
        if (traceListener != null) return traceListener;
        return debug ? new DebugTraceListener() : TraceListener.NONE;
    }
}
