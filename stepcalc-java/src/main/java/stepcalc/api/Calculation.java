package stepcalc.api;

import stepcalc.ast.Node;
import stepcalc.terms.TermSummary;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything a front end shows for one expression.
 *
 * @param source normalized text the tree was parsed from
 */
public record Calculation(
        String source,
        Node ast,
        BigDecimal value,
        String formattedValue,
        List<String> steps,
        List<TermSummary> terms
) {
    public Calculation {
        steps = List.copyOf(steps);
        terms = List.copyOf(terms);
    }
}
