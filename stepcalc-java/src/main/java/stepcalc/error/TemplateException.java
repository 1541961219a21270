package stepcalc.error;

import stepcalc.ast.Range;

public final class TemplateException extends CalcException {

    public TemplateException(String message) {
        // not tied to a span of the expression
        super(ErrorKind.TEMPLATE_ERROR, message, Range.EMPTY);
    }
}
