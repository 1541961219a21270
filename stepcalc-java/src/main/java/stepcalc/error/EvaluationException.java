package stepcalc.error;

import stepcalc.ast.Range;

/**
 * Unexpected failure inside the arithmetic layer, re-wrapped with the node it happened at.
 */
public final class EvaluationException extends CalcException {

    public EvaluationException(String message, Range range, Throwable cause) {
        super(ErrorKind.EVALUATION_ERROR, message, range, cause);
    }
}
