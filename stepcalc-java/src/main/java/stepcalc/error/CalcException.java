package stepcalc.error;

import stepcalc.ast.Range;

/**
 * Base of every failure raised by the calculator. Carries a stable kind tag and the
 * offending source range so callers can draw a caret under it.
 */
public abstract class CalcException extends RuntimeException {

    private final ErrorKind kind;
    private final Range range;

    protected CalcException(ErrorKind kind, String message, Range range) {
        this(kind, message, range, null);
    }

    protected CalcException(ErrorKind kind, String message, Range range, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.range = range;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Source span of the failure; {@code null} only before the evaluator anchors it. */
    public Range range() {
        return range;
    }
}
