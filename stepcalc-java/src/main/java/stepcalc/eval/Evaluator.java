package stepcalc.eval;

import stepcalc.ast.BinaryNode;
import stepcalc.ast.GroupNode;
import stepcalc.ast.Node;
import stepcalc.ast.NumberNode;
import stepcalc.ast.UnaryNode;
import stepcalc.ast.UnaryOp;
import stepcalc.decimal.DecimalArithmetic;
import stepcalc.error.EvaluationException;
import stepcalc.error.InvalidOperationException;
import stepcalc.print.Printer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Post-order evaluator. Steps are collected into a list owned by the current
 * {@link #evaluateRaw} call, so an instance holds no per-call state and can be shared.
 */
public final class Evaluator {

    private final DecimalArithmetic math;
    private final Printer printer;

    public Evaluator() {
        this(DecimalArithmetic.DEFAULT, new Printer());
    }

    public Evaluator(DecimalArithmetic math, Printer printer) {
        this.math = math;
        this.printer = printer;
    }

    public RawEvaluation evaluateRaw(Node ast) {
        List<Step> steps = new ArrayList<>();
        BigDecimal value = eval(ast, steps);
        return new RawEvaluation(value, steps);
    }

    public Evaluation evaluate(Node ast) {
        RawEvaluation raw = evaluateRaw(ast);
        List<String> lines = raw.steps().stream().map(printer::formatStep).toList();
        return new Evaluation(raw.value(), lines);
    }

    private BigDecimal eval(Node node, List<Step> steps) {
        if (node instanceof NumberNode n) {
            return n.value();
        }
        if (node instanceof GroupNode g) {
            return eval(g.inner(), steps);
        }
        if (node instanceof UnaryNode u) {
            BigDecimal v = eval(u.operand(), steps);
            BigDecimal out = u.op() == UnaryOp.MINUS ? math.negate(v) : v;
            steps.add(new UnaryStep(u.op(), v, out, u));
            return out;
        }
        if (node instanceof BinaryNode b) {
            BigDecimal l = eval(b.left(), steps);
            BigDecimal r = eval(b.right(), steps);
            BigDecimal out = apply(b, l, r);
            steps.add(new BinaryStep(b.op(), l, r, out, b));
            return out;
        }
        throw new IllegalStateException("Unknown node: " + node);
    }

    private BigDecimal apply(BinaryNode b, BigDecimal l, BigDecimal r) {
        try {
            return switch (b.op()) {
                case ADD -> math.add(l, r);
                case SUB -> math.subtract(l, r);
                case MUL -> math.multiply(l, r);
                case DIV -> math.divide(l, r);
                case MOD -> math.modulo(l, r);
                case POW, STAR_POW -> math.power(l, r);
            };
        } catch (InvalidOperationException e) {
            throw e.anchoredAt(b.range());
        } catch (ArithmeticException e) {
            String msg = e.getMessage() != null ? e.getMessage() : "arithmetic failure";
            throw new EvaluationException(msg, b.range(), e);
        }
    }
}
