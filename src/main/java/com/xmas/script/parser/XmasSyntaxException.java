package com.xmas.script.parser;

/**
 * The first syntax error found by the {@link Parser}. The message carries the
 * position, the offending source line and a caret under the failing column:
 *
 * <pre>
 * Syntax error at line 2, column 5: Expected ')' after arguments
 *   f(1, 2
 *       ^
 * </pre>
 */
public class XmasSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String reason;
    private final int line;
    private final int column;

    public XmasSyntaxException(String reason, Position position, String source) {
        super(format(reason, position, source));
        this.reason = reason;
        this.line = position.line;
        this.column = position.column;
    }

    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    private static String format(String reason, Position position, String source) {
        StringBuilder sb = new StringBuilder();
        sb.append("Syntax error at line ").append(position.line)
          .append(", column ").append(position.column)
          .append(": ").append(reason);

        String sourceLine = lineOf(source, position.line);
        if (sourceLine != null) {
            sb.append('\n').append("  ").append(sourceLine);
            sb.append('\n').append("  ");
            for (int i = 1; i < position.column; i++) sb.append(' ');
            sb.append('^');
        }
        return sb.toString();
    }

    private static String lineOf(String source, int line) {
        if (source == null || source.isEmpty()) return null;
        String[] lines = source.split("\n", -1);
        if (line < 1 || line > lines.length) return null;
        String text = lines[line - 1];
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }
}
