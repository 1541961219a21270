package stepcalc.ast;

/**
 * Binary operators with their precedence and associativity. Both the parser and the
 * printer read these values, so they never disagree on grouping. Higher binds tighter.
 */
public enum BinaryOp {
    POW("^", 4, Associativity.RIGHT),
    STAR_POW("**", 4, Associativity.RIGHT),
    MUL("*", 3, Associativity.LEFT),
    DIV("/", 3, Associativity.LEFT),
    MOD("%", 3, Associativity.LEFT),
    ADD("+", 2, Associativity.LEFT),
    SUB("-", 2, Associativity.LEFT);

    public enum Associativity { LEFT, RIGHT }

    private final String symbol;
    private final int precedence;
    private final Associativity associativity;

    BinaryOp(String symbol, int precedence, Associativity associativity) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    public boolean isRightAssociative() {
        return associativity == Associativity.RIGHT;
    }

    public boolean isAdditive() {
        return this == ADD || this == SUB;
    }
}
