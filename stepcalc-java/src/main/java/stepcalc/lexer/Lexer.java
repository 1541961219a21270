package stepcalc.lexer;

import stepcalc.ast.Range;
import stepcalc.error.SyntaxException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;

            int start = pos;
            char c = advance();

            switch (c) {
                case '+' -> add(TokenType.PLUS, start);
                case '-' -> add(TokenType.MINUS, start);
                case '/' -> add(TokenType.SLASH, start);
                case '%' -> add(TokenType.PERCENT, start);
                case '^' -> add(TokenType.CARET, start);
                case '(' -> add(TokenType.LPAREN, start);
                case ')' -> add(TokenType.RPAREN, start);

                case '*' -> add(match('*') ? TokenType.STAR_STAR : TokenType.STAR, start);

                default -> {
                    if (isDigit(c) || c == '.') numberLiteral(c, start);
                    else throw error("unsupported character '" + c + "'", Range.single(start));
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", Range.of(pos, pos)));
        return tokens;
    }

    // ================= helpers =================

    // digits with '_' or ',' as grouping separators and at most one '.'
    private void numberLiteral(char first, int start) {
        boolean seenDot = first == '.';

        while (!isAtEnd()) {
            char c = peek();
            if (c == '.') {
                if (seenDot) break;
                seenDot = true;
                advance();
            } else if (isDigit(c) || c == '_' || c == ',') {
                advance();
            } else {
                break;
            }
        }

        Range range = Range.of(start, pos);
        String raw = source.substring(start, pos);
        String cleaned = raw.replace("_", "").replace(",", "");
        if (cleaned.isEmpty() || cleaned.equals(".")) {
            throw error("invalid number", range);
        }

        BigDecimal value;
        try {
            value = new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw error("invalid number", range);
        }
        tokens.add(new Token(TokenType.NUMBER, raw, value, range));
    }

    private void skipWhitespace() {
        while (!isAtEnd() && isWhitespace(peek())) advance();
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        return source.charAt(pos++);
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private void add(TokenType type, int start) {
        tokens.add(new Token(type, source.substring(start, pos), Range.of(start, pos)));
    }

    private SyntaxException error(String message, Range range) {
        return new SyntaxException(message, source, range);
    }
}
