package stepcalc.eval;

import stepcalc.ast.UnaryNode;
import stepcalc.ast.UnaryOp;

import java.math.BigDecimal;

public record UnaryStep(
        UnaryOp op,
        BigDecimal operand,
        BigDecimal result,
        UnaryNode source
) implements Step {}
