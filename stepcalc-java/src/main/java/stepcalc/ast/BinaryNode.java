package stepcalc.ast;

public record BinaryNode(
        BinaryOp op,
        Node left,
        Node right,
        Range range
) implements Node {

    public BinaryNode(BinaryOp op, Node left, Node right) {
        this(op, left, right, left.range().union(right.range()));
    }
}
