package stepcalc.error;

import stepcalc.ast.Range;

public final class InvalidOperationException extends CalcException {

    public enum Reason {
        DIVISION_BY_ZERO("division by zero"),
        NON_INTEGER_EXPONENT("exponent must be an integer"),
        EXPONENT_TOO_LARGE("exponent is too large");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Reason reason;

    public InvalidOperationException(Reason reason) {
        this(reason, null);
    }

    public InvalidOperationException(Reason reason, Range range) {
        super(ErrorKind.INVALID_OPERATION, reason.message(), range);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    /** Same failure anchored at {@code at}; returns {@code this} when already anchored. */
    public InvalidOperationException anchoredAt(Range at) {
        if (range() != null) return this;
        InvalidOperationException anchored = new InvalidOperationException(reason, at);
        anchored.setStackTrace(getStackTrace());
        return anchored;
    }
}
