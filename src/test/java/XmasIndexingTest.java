import com.xmas.script.XmasScript;
import com.xmas.script.parser.Value;
import com.xmas.script.parser.XmasRuntimeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class XmasIndexingTest {

    private static final String GRID = "abc\ndef\nghi";

    private static Value run(String src) {
        return new XmasScript().run(src);
    }

    private static Value run(String src, String input) {
        return new XmasScript().run(src, input);
    }

    private static String error(String src) {
        return assertThrows(XmasRuntimeException.class, () -> run(src)).getMessage();
    }

    private static Value nums(long... ns) {
        List<Value> out = new ArrayList<>();
        for (long n : ns) out.add(Value.number(n));
        return Value.array(out);
    }

    private static Value chars(String... cs) {
        List<Value> out = new ArrayList<>();
        for (String c : cs) out.add(Value.string(c));
        return Value.array(out);
    }

    @Test
    void slices_are_zero_based_end_exclusive() {
        String arr = "arr = [1, 2, 3, 4, 5]\n";
        assertEquals(nums(2, 3, 4), run(arr + "arr[1..4]"));
        assertEquals(nums(3, 4, 5), run(arr + "arr[2..]"));
        assertEquals(nums(1, 2, 3), run(arr + "arr[..3]"));
        assertEquals(nums(1, 2, 3, 4, 5), run(arr + "arr[..]"));
    }

    @Test
    void slicing_from_a_zero_based_array() {
        String arr = "arr = [0, 1, 2, 3, 4, 5]\n";
        assertEquals(nums(1, 2, 3), run(arr + "arr[1..4]"));
        assertEquals(nums(2, 3, 4, 5), run(arr + "arr[2..]"));
    }

    @Test
    void slice_bounds_clamp_but_single_index_is_checked() {
        String arr = "arr = [1, 2, 3, 4, 5]\n";
        assertEquals(nums(4, 5), run(arr + "arr[3..10]"));
        assertEquals(nums(), run(arr + "arr[7..]"));
        assertEquals(nums(), run(arr + "arr[4..2]"));
        assertEquals("Index 10 out of bounds (array length: 5)", error(arr + "arr[10]"));
    }

    @Test
    void index_must_be_a_non_negative_number() {
        assertEquals("Array index must be non-negative integer", error("[1, 2][0 - 1]"));
        assertEquals("Array index must be a number", error("[1, 2][\"a\"]"));
        assertEquals("Cannot index non-array value: 5", error("x = 5\nx[0]"));
        assertEquals("Cannot slice non-array value", error("x = true\nx[0..]"));
    }

    @Test
    void strings_index_and_slice_by_character() {
        assertEquals(Value.string("e"), run("\"hello\"[1]"));
        assertEquals(Value.string("el"), run("\"hello\"[1..3]"));
        assertEquals(Value.string("llo"), run("\"hello\"[2..]"));
        assertEquals("Index 5 out of bounds", error("\"hi\"[5]"));
    }

    @Test
    void input_is_a_grid_of_characters() {
        assertEquals(chars("d", "e", "f"), run("input[1]", GRID));
        assertEquals(Value.string("f"), run("input[1][2]", GRID));
        assertEquals(Value.string("b"), run("input[0, 1]", GRID));
        assertEquals(2, run("input[0..2]", GRID).asMatrix().size());
        assertEquals("Index 3 out of bounds", assertThrows(XmasRuntimeException.class,
                () -> run("input[3]", GRID)).getMessage());
    }

    @Test
    void missing_input_is_an_empty_grid() {
        Value grid = run("input");
        assertEquals(Value.Type.MATRIX, grid.getType());
        assertTrue(grid.asMatrix().isEmpty());
    }

    @Test
    void input_lines_drop_trailing_newline_and_carriage_returns() {
        Value grid = run("input", "ab\r\ncd\n");
        assertEquals(2, grid.asMatrix().size());
        assertEquals(chars("a", "b"), Value.array(grid.asMatrix().get(0)));
    }

    @Test
    void range_then_single_index_on_grid_is_column_access() {
        assertEquals(chars("b", "e", "h"), run("input[.., 1]", GRID));
        assertEquals(chars("d", "g"), run("input[1.., 0]", GRID));
        assertEquals(chars("a", "d"), run("input[..2, 0]", GRID));
    }

    @Test
    void column_access_skips_short_rows() {
        assertEquals(chars("c", "i"), run("input[.., 2]", "abc\nd\nghi"));
    }

    @Test
    void column_access_result_can_be_indexed_further() {
        assertEquals(Value.string("h"), run("input[.., 1, 2]", GRID));
    }

    @Test
    void rows_turns_grid_into_array_of_rows() {
        Value rows = run("input.rows()", "ab\ncd");
        assertEquals(Value.Type.ARRAY, rows.getType());
        assertEquals(chars("c", "d"), rows.asArray().get(1));
        assertEquals(Value.number(2), run("len(input.rows())", "ab\ncd"));
        assertEquals("rows() method only works on 2D arrays", error("[1].rows()"));
        assertEquals("Unknown method: cols", error("x = [1]\nx.cols()"));
        assertEquals("rows() method takes no arguments", assertThrows(XmasRuntimeException.class,
                () -> run("input.rows(1)", GRID)).getMessage());
    }

    @Test
    void iterating_grid_rows_with_for() {
        String src = String.join("\n",
            "count = 0",
            "for(row of input.rows(), {",
            "  for(c of row, {",
            "    count += c == \"#\"",
            "  })",
            "})",
            "count"
        );
        assertEquals(Value.number(3), run(src, "#.#\n..#"));
    }
}
