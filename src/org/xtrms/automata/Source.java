/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.nio.charset.StandardCharsets;

/**
 * The single owned buffer of a machine description. The text is held as UTF-8
 * so that every {@link Span} produced by the {@link Lexer} is a byte range,
 * suitable for exact source location reporting. One instance per parse; every
 * consumer needing literal text resolves it through this object.
 */
public final class Source {

    private final String text;
    private final byte[] bytes;

    public Source(String text) {
        if (text == null) throw new NullPointerException("text");
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return the length of the buffer in bytes.
     */
    public int length() {
        return bytes.length;
    }

    /**
     * Resolves a span to the text it covers.
     * 
     * @throws IndexOutOfBoundsException
     *             if the span does not lie within this source.
     */
    public String text(Span span) {
        if (span.end() > bytes.length) {
            throw new IndexOutOfBoundsException(
                "span " + span + " outside source of length " + bytes.length);
        }
        return new String(bytes, span.offset(), span.length(),
            StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return text;
    }
}
