package stepcalc.eval;

import stepcalc.ast.BinaryNode;
import stepcalc.ast.BinaryOp;

import java.math.BigDecimal;

public record BinaryStep(
        BinaryOp op,
        BigDecimal left,
        BigDecimal right,
        BigDecimal result,
        BinaryNode source
) implements Step {}
