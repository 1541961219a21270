package stepcalc.ast;

/**
 * Half-open character span {@code [start, end)} in the source text.
 */
public record Range(int start, int end) {

    public static final Range EMPTY = new Range(0, 0);

    public Range {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Bad range [" + start + ", " + end + ")");
        }
    }

    public static Range of(int start, int end) {
        return new Range(start, end);
    }

    public static Range single(int pos) {
        return new Range(pos, pos + 1);
    }

    public Range union(Range other) {
        return new Range(Math.min(start, other.start), Math.max(end, other.end));
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
