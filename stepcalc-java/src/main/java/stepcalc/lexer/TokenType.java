package stepcalc.lexer;

public enum TokenType {

    // literals
    NUMBER,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    CARET, STAR_STAR,

    // symbols
    LPAREN, RPAREN,

    EOF
}
