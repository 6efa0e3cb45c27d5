/*
 * @LICENSE@
 */

package org.xtrms.automata;

/**
 * A byte range within a {@link Source}. Spans never hold text; the text is
 * resolved against the source buffer on demand. Instances are immutable.
 */
public final class Span {

    private final int offset;
    private final int length;

    public Span(int offset, int length) {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException(
                "bad span: offset=" + offset + ", length=" + length);
        }
        this.offset = offset;
        this.length = length;
    }

    public int offset() {
        return offset;
    }

    public int length() {
        return length;
    }

    public int end() {
        return offset + length;
    }

    @Override
    public int hashCode() {
        return 31 * offset + length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span span = (Span) o;
        return offset == span.offset && length == span.length;
    }

    @Override
    public String toString() {
        return "[" + offset + ".." + end() + ")";
    }
}
