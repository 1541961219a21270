package stepcalc.error;

import stepcalc.ast.Range;

public final class Carets {
    private Carets() {}

    /**
     * Renders the line holding {@code range.start()} with a caret under that column:
     * <pre>
     * 1 + 2 * 3
     *     ^
     * </pre>
     */
    public static String render(String source, Range range) {
        int start = Math.min(range.start(), source.length());
        int lineStart = source.lastIndexOf('\n', start - 1) + 1;
        int lineEnd = source.indexOf('\n', start);
        if (lineEnd < 0) lineEnd = source.length();

        String line = source.substring(lineStart, lineEnd);
        return line + "\n" + " ".repeat(start - lineStart) + "^";
    }
}
