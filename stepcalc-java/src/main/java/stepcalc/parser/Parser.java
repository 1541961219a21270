package stepcalc.parser;

import stepcalc.ast.BinaryNode;
import stepcalc.ast.BinaryOp;
import stepcalc.ast.GroupNode;
import stepcalc.ast.Node;
import stepcalc.ast.NumberNode;
import stepcalc.ast.Range;
import stepcalc.ast.UnaryNode;
import stepcalc.ast.UnaryOp;
import stepcalc.error.SyntaxException;
import stepcalc.lexer.Token;
import stepcalc.lexer.TokenType;

import java.util.List;

/**
 * Precedence-climbing parser. Operator precedence and associativity come from
 * {@link BinaryOp}.
 */
public final class Parser {
    private final List<Token> tokens;
    private final String source;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        this(tokens, "");
    }

    /** @param source text used only to render carets in error messages */
    public Parser(List<Token> tokens, String source) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
        this.source = source == null ? "" : source;
    }

    // ---------- entry ----------
    public Node parse() {
        Node ast = parseExpression(0);
        if (!check(TokenType.EOF)) throw error(peek(), "trailing tokens");
        return ast;
    }

    // ---------- expressions ----------
    private Node parseExpression(int minPrec) {
        Node left = parsePrimary();
        while (true) {
            BinaryOp op = toBinOp(peek().type());
            if (op == null || op.precedence() < minPrec) break;
            advance();

            int nextMin = op.isRightAssociative() ? op.precedence() : op.precedence() + 1;
            Node right = parseExpression(nextMin);
            left = new BinaryNode(op, left, right);
        }
        return left;
    }

    private Node parsePrimary() {
        if (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token sign = advance();
            Node operand = parsePrimary();
            UnaryOp op = sign.type() == TokenType.MINUS ? UnaryOp.MINUS : UnaryOp.PLUS;
            return new UnaryNode(op, operand, sign.range().union(operand.range()));
        }
        if (match(TokenType.NUMBER)) {
            Token n = previous();
            return new NumberNode(n.value(), n.range());
        }
        if (match(TokenType.LPAREN)) {
            Token open = previous();
            Node inner = parseExpression(0);
            if (!check(TokenType.RPAREN)) throw error(open, "missing closing parenthesis");
            Token close = advance();
            return new GroupNode(inner, open.range().union(close.range()));
        }
        throw error(peek(), "expected an operand");
    }

    // ---------- helpers ----------
    private boolean match(TokenType t) {
        if (check(t)) { advance(); return true; }
        return false;
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private SyntaxException error(Token at, String msg) {
        return new SyntaxException(msg, source, at.range());
    }

    private static BinaryOp toBinOp(TokenType t) {
        return switch (t) {
            case PLUS      -> BinaryOp.ADD;
            case MINUS     -> BinaryOp.SUB;
            case STAR      -> BinaryOp.MUL;
            case SLASH     -> BinaryOp.DIV;
            case PERCENT   -> BinaryOp.MOD;
            case CARET     -> BinaryOp.POW;
            case STAR_STAR -> BinaryOp.STAR_POW;
            default -> null;
        };
    }
}
