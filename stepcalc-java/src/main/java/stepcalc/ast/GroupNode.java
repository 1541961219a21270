package stepcalc.ast;

/** Parenthesized sub-expression; carries no meaning beyond {@code inner}. */
public record GroupNode(
        Node inner,
        Range range
) implements Node {}
