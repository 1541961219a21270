package stepcalc.eval;

import java.math.BigDecimal;

/** One recorded sub-evaluation, in post-order. */
public sealed interface Step permits UnaryStep, BinaryStep {

    BigDecimal result();
}
