package stepcalc.ast;

public sealed interface Node
        permits NumberNode, GroupNode, UnaryNode, BinaryNode {

    Range range();
}
