/*
 * @LICENSE@
 */

package org.xtrms.automata;

/**
 * A labelled source location attached to an {@link AutomatonException}.
 */
public final class Label {

    private final Span span;
    private final String text;

    public Label(Span span, String text) {
        this.span = span;
        this.text = text;
    }

    public Span span() {
        return span;
    }

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return span + " " + text;
    }
}
