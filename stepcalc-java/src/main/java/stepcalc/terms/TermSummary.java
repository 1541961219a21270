package stepcalc.terms;

import stepcalc.ast.Node;

import java.math.BigDecimal;

/**
 * @param index        1-based position of the term
 * @param runningTotal sum of this term and every term before it
 */
public record TermSummary(
        int index,
        Node term,
        String text,
        BigDecimal value,
        BigDecimal runningTotal
) {}
