package stepcalc.eval;

import java.math.BigDecimal;
import java.util.List;

public record RawEvaluation(
        BigDecimal value,
        List<Step> steps
) {
    public RawEvaluation {
        steps = List.copyOf(steps);
    }
}
