package stepcalc.print;

import stepcalc.ast.BinaryNode;
import stepcalc.ast.BinaryOp;
import stepcalc.ast.GroupNode;
import stepcalc.ast.Node;
import stepcalc.ast.NumberNode;
import stepcalc.ast.UnaryNode;
import stepcalc.eval.BinaryStep;
import stepcalc.eval.Step;
import stepcalc.eval.UnaryStep;

/**
 * Canonical text for trees and evaluation steps. Inserts only the parentheses that
 * the operator table requires, plus those the user wrote as groups.
 */
public final class Printer {

    private final NumberFormatter numbers;

    public Printer() {
        this(new NumberFormatter());
    }

    public Printer(NumberFormatter numbers) {
        this.numbers = numbers;
    }

    public NumberFormatter numbers() {
        return numbers;
    }

    public String exprToString(Node node) {
        if (node instanceof NumberNode n) {
            return numbers.format(n.value());
        }
        if (node instanceof GroupNode g) {
            return "(" + exprToString(g.inner()) + ")";
        }
        if (node instanceof UnaryNode u) {
            Node operand = u.operand();
            boolean wrap = operand instanceof BinaryNode || operand instanceof UnaryNode;
            return u.op().symbol() + (wrap ? paren(operand) : exprToString(operand));
        }
        if (node instanceof BinaryNode b) {
            BinaryOp op = b.op();
            String ls = needsParenLeft(op, b.left()) ? paren(b.left()) : exprToString(b.left());
            String rs = needsParenRight(op, b.right()) ? paren(b.right()) : exprToString(b.right());
            return ls + " " + op.symbol() + " " + rs;
        }
        throw new IllegalStateException("Unknown node: " + node);
    }

    public String formatStep(Step step) {
        if (step instanceof UnaryStep u) {
            return exprToString(u.source()) + " = " + numbers.format(u.result());
        }
        if (step instanceof BinaryStep b) {
            return numbers.format(b.left()) + " " + b.op().symbol() + " " + numbers.format(b.right())
                    + " = " + numbers.format(b.result());
        }
        throw new IllegalStateException("Unknown step: " + step);
    }

    private String paren(Node node) {
        return "(" + exprToString(node) + ")";
    }

    private static boolean needsParenLeft(BinaryOp parent, Node child) {
        return child instanceof BinaryNode b && b.op().precedence() < parent.precedence();
    }

    // 1 - (2 - 3) keeps its parentheses, 2 ** 3 ** 2 gets none
    private static boolean needsParenRight(BinaryOp parent, Node child) {
        if (!(child instanceof BinaryNode b)) return false;
        int cp = b.op().precedence();
        return cp < parent.precedence() || (cp == parent.precedence() && !parent.isRightAssociative());
    }
}
