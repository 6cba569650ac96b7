import com.xmas.script.RunResult;
import com.xmas.script.XmasScript;
import com.xmas.script.parser.Interpreter;
import com.xmas.script.parser.Statement.Stmt;
import com.xmas.script.parser.Value;
import com.xmas.script.parser.XmasRuntimeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class XmasFunctionsAndLoopsTest {

    private static Value run(String src) {
        return new XmasScript().run(src);
    }

    private static String error(String src) {
        return assertThrows(XmasRuntimeException.class, () -> run(src)).getMessage();
    }

    @Test
    void block_bodied_function_returns_through_underscore() {
        assertEquals(Value.number(15), run("add(a, b) = { _ = a + b }\nadd(5, 10)"));
    }

    @Test
    void expression_bodied_function_returns_its_value() {
        assertEquals(Value.number(6), run("addOne(x) = x + 1\naddOne(5)"));
    }

    @Test
    void recursion() {
        String src = String.join("\n",
            "fact(n) = if(n <= 1, 1, n * fact(n - 1))",
            "fact(10)"
        );
        assertEquals(Value.number(3628800), run(src));
    }

    @Test
    void parameters_shadow_globals_only_for_the_call() {
        RunResult r = new XmasScript().runWithResult(String.join("\n",
            "x = 1",
            "f(x) = x * 10",
            "r = f(5)",
            "x"
        ), null);
        assertEquals(Value.number(1), r.getValue());
        assertEquals(Value.number(50), r.getVariable("r"));
    }

    @Test
    void parameter_without_prior_global_is_removed_after_call() {
        assertEquals("Undefined variable: p", error("g(p) = p\ng(1)\np"));
    }

    @Test
    void function_bodies_see_and_mutate_globals() {
        assertEquals(Value.number(3), run("total = 0\nbump(n) = { total += n }\nbump(1)\nbump(2)\ntotal"));
    }

    @Test
    void arguments_are_evaluated_before_binding() {
        assertEquals(Value.number(12), run("a = 2\nf(a, b) = a * b\nf(3, a * 2)"));
    }

    @Test
    void arity_is_checked() {
        assertEquals("Function f expects 1 arguments, got 2", error("f(a) = a\nf(1, 2)"));
    }

    @Test
    void redefinition_overwrites() {
        assertEquals(Value.number(2), run("f() = 1\nf() = 2\nf()"));
    }

    @Test
    void call_restores_state_when_body_fails() {
        List<Stmt> program = new XmasScript().parse("a = 7\n_ = 1\nf(a) = { _ = a / 0 }\nf(1)");
        Interpreter interpreter = new Interpreter();
        XmasRuntimeException e = assertThrows(XmasRuntimeException.class, () -> interpreter.interpret(program));
        assertEquals("Division by zero", e.getMessage());
        assertEquals(Value.number(7), interpreter.getEnvironment().get("a"));
        assertEquals(Value.number(1), interpreter.getEnvironment().getReturnValue());
    }

    @Test
    void for_with_initial_value_accumulates_underscore() {
        assertEquals(Value.number(6), run("for(n of [1, 2, 3], { _ = _ + n }, 0)"));
        assertEquals(Value.number(16), run("for(n of [1, 2, 3], { _ += n }, 10)"));
        assertEquals(Value.number(5), run("for(n of [], { _ = _ + n }, 5)"));
    }

    @Test
    void for_without_initial_value_yields_empty_array_and_keeps_side_effects() {
        RunResult r = new XmasScript().runWithResult("x = 0\nfor(n of [1, 2, 3], { x = x + n })", null);
        assertTrue(r.getValue().isEmptyArray());
        assertEquals(Value.number(6), r.getVariable("x"));
    }

    @Test
    void for_without_initial_leaves_underscore_unset_inside() {
        assertEquals("No return value set", error("for(n of [1], { _ += n })"));
    }

    @Test
    void for_restores_outer_return_slot() {
        assertEquals(Value.number(1), run("_ = 1\nfor(n of [1, 2], { _ = _ + n }, 100)\n_"));
    }

    @Test
    void loop_variable_is_restored_or_removed() {
        assertEquals(Value.number(100), run("n = 100\nfor(n of [1, 2], { x = n })\nn"));
        assertEquals("Undefined variable: k", error("for(k of [1], { y = k })\nk"));
    }

    @Test
    void non_block_loop_body_is_evaluated_as_expression() {
        assertEquals(Value.number(3), run("c = 0\nbump() = { c += 1 }\nfor(n of [1, 2, 3], bump())\nc"));
    }

    @Test
    void for_requires_a_1d_array() {
        assertEquals("for loop requires 1D array", assertThrows(XmasRuntimeException.class,
                () -> new XmasScript().run("for(r of input, { x = 1 })", "ab")).getMessage());
        assertEquals("for loop requires array", error("for(r of 5, { x = 1 })"));
    }

    @Test
    void nested_loops_with_accumulators() {
        String src = String.join("\n",
            "total = for(i of [1..3], {",
            "  _ = _ + for(j of [1..i], { _ = _ + j }, 0)",
            "}, 0)",
            "total"
        );
        // 1 + (1+2) + (1+2+3)
        assertEquals(Value.number(10), run(src));
    }

    @Test
    void if_picks_one_branch() {
        assertEquals(Value.number(10), run("if(5 == 5, 10, 20)"));
        assertEquals(Value.number(20), run("if(5 == 3, 10, 20)"));
        assertTrue(run("if(false, 1)").isEmptyArray());
        assertEquals(Value.number(1), run("x = 0\nif(true, { x = 1 }, { x = 2 })\nx"));
        assertEquals(Value.string("yes"), run("if([1], \"yes\", \"no\")"));
    }

    @Test
    void if_branch_blocks_can_return() {
        assertEquals(Value.number(7), run("v = if(1 < 2, { _ = 7 }, { _ = 8 })\nv"));
    }

    @Test
    void aoc_style_dial_rotation() {
        String src = String.join("\n",
            "// count how often the dial lands on zero",
            "pos = 50",
            "hits = 0",
            "for(line of input.rows(), {",
            "  steps = ~line[1..]",
            "  pos = if(line[0] == \"L\", (pos - steps % 100 + 100) % 100, (pos + steps) % 100)",
            "  hits += pos == 0",
            "})",
            "hits"
        );
        String input = "L68\nL30\nR48\nL5\nR60\nL55\nL1\nL99\nR14\nL82\n";
        assertEquals(Value.number(3), new XmasScript().run(src, input));
    }
}
