package stepcalc.eval;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import stepcalc.ast.*;
import stepcalc.decimal.DecimalArithmetic;
import stepcalc.error.ErrorKind;
import stepcalc.error.EvaluationException;
import stepcalc.error.InvalidOperationException;
import stepcalc.error.InvalidOperationException.Reason;
import stepcalc.lexer.Lexer;
import stepcalc.parser.Parser;
import stepcalc.print.NumberFormatter;
import stepcalc.print.Printer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EvaluatorTest {

    private static final Evaluator evaluator = new Evaluator();
    private static final NumberFormatter fmt = new NumberFormatter();

    private static Node parse(String src) {
        return new Parser(new Lexer(src).tokenize(), src).parse();
    }

    private static String eval(String src) {
        return fmt.format(evaluator.evaluateRaw(parse(src)).value());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2+3            | 5",
            "-5             | -5",
            "2^3            | 8",
            "2**3           | 8",
            "2 ^ 3 ^ 2      | 512",
            "2 ** 3 ** 2    | 512",
            "(2 ^ 3) ^ 2    | 64",
            "0.1 + 0.2      | 0.3",
            "1 + 2 * 3      | 7",
            "(1 + 2) * 3    | 9",
            "10 - 4 - 3     | 3",
            "1 - (2 - 3)    | 2",
            "--5            | 5",
            "+-+5           | -5",
            "-2 ^ 2         | 4",
            "2 ^ -2         | 0.25",
            "1 / 3          | 0.333333333333",
            "2 / 3          | 0.666666666667",
            "-7 % 3         | -1",
            "7 % -3         | 1",
            "1_000 * 1,000  | 1000000",
            "(1 / 3) * 3    | 1"
    })
    void evaluates(String src, String expected) {
        assertEquals(expected, eval(src.trim()));
    }

    @Test
    void number_and_group_emit_no_steps() {
        assertEquals(List.of(), evaluator.evaluateRaw(parse("42")).steps());
        assertEquals(List.of(), evaluator.evaluateRaw(parse("((42))")).steps());
    }

    @Test
    void steps_are_post_order() {
        var raw = evaluator.evaluateRaw(parse("(1 + 2) * (3 - 4)"));
        assertEquals(3, raw.steps().size());

        var first = (BinaryStep) raw.steps().get(0);
        assertEquals(BinaryOp.ADD, first.op());
        assertEquals(0, BigDecimal.valueOf(3).compareTo(first.result()));

        var second = (BinaryStep) raw.steps().get(1);
        assertEquals(BinaryOp.SUB, second.op());

        var last = (BinaryStep) raw.steps().get(2);
        assertEquals(BinaryOp.MUL, last.op());
        assertEquals(0, BigDecimal.valueOf(3).compareTo(last.left()));
        assertEquals(0, BigDecimal.valueOf(-1).compareTo(last.right()));
        assertEquals(0, BigDecimal.valueOf(-3).compareTo(raw.value()));
        assertEquals(Range.of(0, 17), last.source().range());
    }

    @Test
    void unary_step_records_operand_and_result() {
        var raw = evaluator.evaluateRaw(parse("-(2 + 3)"));
        assertEquals(2, raw.steps().size());
        var u = (UnaryStep) raw.steps().get(1);
        assertEquals(UnaryOp.MINUS, u.op());
        assertEquals(0, BigDecimal.valueOf(5).compareTo(u.operand()));
        assertEquals(0, BigDecimal.valueOf(-5).compareTo(u.result()));

        var plus = (UnaryStep) evaluator.evaluateRaw(parse("+4")).steps().get(0);
        assertEquals(0, plus.operand().compareTo(plus.result()));
    }

    @Test
    void evaluate_formats_steps() {
        var ev = evaluator.evaluate(parse("2+3"));
        assertEquals(0, BigDecimal.valueOf(5).compareTo(ev.value()));
        assertEquals(List.of("2 + 3 = 5"), ev.steps());

        assertEquals(List.of("3 ^ 2 = 9", "2 ^ 9 = 512"), evaluator.evaluate(parse("2 ^ 3 ^ 2")).steps());
        assertEquals(List.of("2 + 3 = 5", "-(2 + 3) = -5"), evaluator.evaluate(parse("-(2 + 3)")).steps());
        assertEquals(List.of("-5 = -5", "-(-5) = 5"), evaluator.evaluate(parse("--5")).steps());
    }

    @Test
    void division_by_zero_carries_node_range() {
        var e = assertThrows(InvalidOperationException.class, () -> evaluator.evaluateRaw(parse("1 + 4 / 0")));
        assertEquals(Reason.DIVISION_BY_ZERO, e.reason());
        assertEquals(ErrorKind.INVALID_OPERATION, e.kind());
        assertEquals(Range.of(4, 9), e.range());
    }

    @Test
    void modulo_by_zero_fails() {
        var e = assertThrows(InvalidOperationException.class, () -> evaluator.evaluateRaw(parse("5 % (2 - 2)")));
        assertEquals(Reason.DIVISION_BY_ZERO, e.reason());
        assertEquals(Range.of(0, 11), e.range());
    }

    @Test
    void bad_exponents_fail() {
        var frac = assertThrows(InvalidOperationException.class, () -> evaluator.evaluateRaw(parse("4 ^ 0.5")));
        assertEquals(Reason.NON_INTEGER_EXPONENT, frac.reason());

        var big = assertThrows(InvalidOperationException.class, () -> evaluator.evaluateRaw(parse("2 ** 10000000")));
        assertEquals(Reason.EXPONENT_TOO_LARGE, big.reason());
        assertEquals(Range.of(0, 13), big.range());
    }

    @Test
    void unexpected_arithmetic_failure_is_wrapped() {
        // BigDecimal.pow refuses exponents above 999999999
        var unbounded = new Evaluator(new DecimalArithmetic(10, RoundingMode.HALF_UP, Integer.MAX_VALUE), new Printer());
        var e = assertThrows(EvaluationException.class, () -> unbounded.evaluateRaw(parse("1 + 10 ^ 1000000000")));
        assertEquals(ErrorKind.EVALUATION_ERROR, e.kind());
        assertEquals(Range.of(4, 19), e.range());
        assertTrue(e.getCause() instanceof ArithmeticException);
    }

    @Test
    void evaluates_hand_built_tree() {
        Node tree = new BinaryNode(BinaryOp.DIV,
                new NumberNode(BigDecimal.ONE, Range.of(0, 1)),
                new NumberNode(new BigDecimal("4"), Range.of(4, 5)));
        assertEquals("0.25", fmt.format(evaluator.evaluateRaw(tree).value()));
    }

    @Test
    void long_chain_records_every_step_in_order() {
        int n = 5000;
        String src = String.join("+", Collections.nCopies(n, "1"));
        RawEvaluation raw = evaluator.evaluateRaw(parse(src));

        assertEquals(0, BigDecimal.valueOf(n).compareTo(raw.value()));
        assertEquals(n - 1, raw.steps().size());
        for (int i = 0; i < raw.steps().size(); i++) {
            assertEquals(0, BigDecimal.valueOf(i + 2).compareTo(raw.steps().get(i).result()));
        }
    }

    @Test
    void results_are_immutable() {
        var raw = evaluator.evaluateRaw(parse("1 + 2"));
        assertThrows(UnsupportedOperationException.class, () -> raw.steps().clear());
    }
}
