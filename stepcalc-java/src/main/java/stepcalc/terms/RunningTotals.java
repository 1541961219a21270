package stepcalc.terms;

import stepcalc.ast.Node;
import stepcalc.decimal.DecimalArithmetic;
import stepcalc.eval.Evaluator;
import stepcalc.print.Printer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Progressive totals over the top-level terms of an expression.
 */
public final class RunningTotals {

    private final Evaluator evaluator;
    private final Printer printer;
    private final DecimalArithmetic math;

    public RunningTotals(Evaluator evaluator, Printer printer, DecimalArithmetic math) {
        this.evaluator = evaluator;
        this.printer = printer;
        this.math = math;
    }

    public List<TermSummary> summarize(Node ast) {
        List<Node> terms = TermExtractor.extractTopLevelTerms(ast);
        List<TermSummary> out = new ArrayList<>(terms.size());

        BigDecimal total = BigDecimal.ZERO;
        for (int i = 0; i < terms.size(); i++) {
            Node term = terms.get(i);
            BigDecimal value = evaluator.evaluateRaw(term).value();
            total = math.add(total, value);
            out.add(new TermSummary(i + 1, term, printer.exprToString(term), value, total));
        }
        return out;
    }
}
