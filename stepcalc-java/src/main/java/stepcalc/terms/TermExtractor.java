package stepcalc.terms;

import stepcalc.ast.BinaryNode;
import stepcalc.ast.BinaryOp;
import stepcalc.ast.Node;
import stepcalc.ast.UnaryNode;
import stepcalc.ast.UnaryOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an expression into the operands of its top-level {@code +}/{@code -} chain.
 * Negative terms come back wrapped in a synthetic unary minus.
 */
public final class TermExtractor {
    private TermExtractor() {}

    public static List<Node> extractTopLevelTerms(Node ast) {
        List<Node> terms = new ArrayList<>();
        walk(ast, false, terms);
        return terms;
    }

    private static void walk(Node node, boolean negative, List<Node> out) {
        if (node instanceof BinaryNode b && b.op().isAdditive()) {
            walk(b.left(), negative, out);
            walk(b.right(), (b.op() == BinaryOp.SUB) != negative, out);
            return;
        }
        out.add(negative ? new UnaryNode(UnaryOp.MINUS, node, node.range()) : node);
    }
}
