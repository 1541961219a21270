package stepcalc.lexer;

import stepcalc.ast.Range;

import java.math.BigDecimal;

/**
 * One lexical unit. {@code value} is set only for {@link TokenType#NUMBER}, where
 * {@code lexeme} keeps the raw text including grouping separators.
 */
public record Token(
        TokenType type,
        String lexeme,
        BigDecimal value,
        Range range
) {

    public Token(TokenType type, String lexeme, Range range) {
        this(type, lexeme, null, range);
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + range.start() + ".." + range.end();
    }
}
