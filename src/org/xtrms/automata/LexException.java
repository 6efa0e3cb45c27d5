/*
 * @LICENSE@
 */

package org.xtrms.automata;

/**
 * A lexical error: the {@link Lexer} could not form a token.
 */
public final class LexException extends AutomatonException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNEXPECTED_CHARACTER,
        UNEXPECTED_EOF
    }

    private final Kind kind;

    LexException(Kind kind, String msg, String help, Label... labels) {
        super(msg, help, labels);
        this.kind = kind;
    }

    @Override
    public Kind kind() {
        return kind;
    }

    static LexException unexpectedCharacter(Span at, String expected) {
        return new LexException(Kind.UNEXPECTED_CHARACTER, "Unexpected character",
            "expected to find " + expected, new Label(at, "here"));
    }

    static LexException unexpectedEOF(Span last, String expected) {
        return new LexException(Kind.UNEXPECTED_EOF, "Unexpected EOF",
            "expected to find " + expected,
            new Label(last, "this was the last character"));
    }
}
