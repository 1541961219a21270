package stepcalc.eval;

import java.math.BigDecimal;
import java.util.List;

/** Final value plus steps already rendered for display. */
public record Evaluation(
        BigDecimal value,
        List<String> steps
) {
    public Evaluation {
        steps = List.copyOf(steps);
    }
}
