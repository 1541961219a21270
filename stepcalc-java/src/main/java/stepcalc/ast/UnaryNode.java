package stepcalc.ast;

public record UnaryNode(
        UnaryOp op,
        Node operand,
        Range range
) implements Node {}
