/*
 * @LICENSE@
 */

package org.xtrms.automata;

/**
 * A lexical token: a {@link Kind} and the {@link Span} it covers. Identity is
 * structural (kind and span); the token text is resolved against the
 * {@link Source} it was scanned from.
 */
public final class Token {

    public enum Kind {
        LEFT_BRACKET("["),
        RIGHT_BRACKET("]"),
        LEFT_PAREN("("),
        RIGHT_PAREN(")"),
        COMMA(","),
        COLON(":"),
        ARROW("=>"),
        PUSH("PUSH"),
        POP("POP"),
        NOOP("NOOP"),
        WRITE("WRITE"),
        LEFT("LEFT"),
        RIGHT("RIGHT"),
        IDENTIFIER("<identifier>"),
        EOF("<EOF>");

        private final String display;

        Kind(String display) {
            this.display = display;
        }

        boolean isKeyword() {
            return compareTo(PUSH) >= 0 && compareTo(RIGHT) <= 0;
        }

        /**
         * @return the keyword kind spelled exactly <code>text</code>, or
         *         <code>null</code>.
         */
        static Kind keyword(String text) {
            for (Kind kind : values()) {
                if (kind.isKeyword() && kind.display.equals(text)) return kind;
            }
            return null;
        }

        @Override
        public String toString() {
            return display;
        }
    }

    private final Kind kind;
    private final Span span;

    public Token(Kind kind, Span span) {
        this.kind = kind;
        this.span = span;
    }

    public Kind kind() {
        return kind;
    }

    public Span span() {
        return span;
    }

    public String text(Source source) {
        return source.text(span);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + span.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return kind == token.kind && span.equals(token.span);
    }

    @Override
    public String toString() {
        return kind + "@" + span;
    }
}
