package stepcalc.error;

import stepcalc.ast.Range;

public final class SyntaxException extends CalcException {

    private final String reason;

    public SyntaxException(String reason, String source, Range range) {
        super(ErrorKind.SYNTAX_ERROR, describe(reason, source, range), range);
        this.reason = reason;
    }

    /** Short message without position or caret, e.g. {@code "unsupported character '@'"}. */
    public String reason() {
        return reason;
    }

    private static String describe(String reason, String source, Range range) {
        String head = reason + " @" + range.start();
        if (source == null || source.isEmpty()) return head;
        return head + "\n" + Carets.render(source, range);
    }
}
