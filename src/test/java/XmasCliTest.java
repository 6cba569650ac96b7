import com.xmas.script.XmasCli;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class XmasCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        return XmasCli.run(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() { return out.toString(StandardCharsets.UTF_8); }
    private String err() { return err.toString(StandardCharsets.UTF_8); }

    private Path write(String name, String content) throws Exception {
        Path p = dir.resolve(name);
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void runs_program_file_with_input_and_prints_value() throws Exception {
        Path program = write("sum.xmas", "for(row of input.rows(), { _ = _ + ~row }, 0)\n");
        Path input = write("input.txt", "12\n30\n");

        assertEquals(0, run("", program.toString(), "-i", input.toString()));
        assertEquals("42", out().trim());
        assertEquals("", err());
    }

    @Test
    void reads_program_from_stdin_when_no_file_given() {
        assertEquals(0, run("[1, \"a\", true]"));
        assertEquals("[1, a, true]", out().trim());
    }

    @Test
    void empty_array_result_prints_nothing() {
        assertEquals(0, run("x = 1"));
        assertEquals("", out());
    }

    @Test
    void json_flag_prints_json() {
        assertEquals(0, run("[1, \"a\"]", "--json"));
        assertEquals("[1,\"a\"]", out().trim());
    }

    @Test
    void runtime_error_exits_with_one() {
        assertEquals(1, run("5 / 0"));
        assertEquals("Runtime error: Division by zero", err().trim());
        assertEquals("", out());
    }

    @Test
    void syntax_error_exits_with_one() {
        assertEquals(1, run("x = (1"));
        assertTrue(err().startsWith("Syntax error at line 1, column 7: Expected ')' after expression"));
    }

    @Test
    void missing_program_file_exits_with_one() {
        assertEquals(1, run("", dir.resolve("nope.xmas").toString()));
        assertTrue(err().startsWith("Error reading file '"));
    }

    @Test
    void missing_input_file_warns_and_runs_with_empty_grid() throws Exception {
        Path program = write("p.xmas", "len(input)");
        assertEquals(0, run("", program.toString(), "--input", dir.resolve("missing.txt").toString()));
        assertTrue(err().startsWith("Warning: Could not read input file '"));
        assertEquals("[0, 0]", out().trim());
    }

    @Test
    void debug_flag_writes_trace_to_stderr() {
        assertEquals(0, run("x = 5\nx", "-d"));
        assertTrue(err().contains("DEBUG: x: undefined → 5"));
        assertFalse(err().contains("xmas.engine"));
        assertEquals("5", out().trim());
    }

    @Test
    void bad_arguments_exit_with_two() {
        assertEquals(2, run("", "--bogus"));
        assertTrue(err().contains("Usage: xmas"));
        assertEquals(2, run("", "-i"));
    }
}
