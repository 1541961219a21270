package stepcalc.ast;

import java.math.BigDecimal;

public record NumberNode(
        BigDecimal value,
        Range range
) implements Node {}
