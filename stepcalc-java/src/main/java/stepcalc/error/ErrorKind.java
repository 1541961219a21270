package stepcalc.error;

public enum ErrorKind {
    SYNTAX_ERROR,
    INVALID_OPERATION,
    EVALUATION_ERROR,
    TEMPLATE_ERROR
}
