/*
 * @LICENSE@
 */

package org.xtrms.automata;

/**
 * A syntax error in a machine description, or a reference to a state or
 * symbol which was never declared.
 */
public final class ParseException extends AutomatonException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNEXPECTED_TOKEN,
        UNEXPECTED_EOF,
        MISSING_SECTION,
        DUPLICATE_SECTION,
        UNKNOWN_SECTION_NAME,
        UNKNOWN_STATE,
        UNKNOWN_ALPHABET_SYMBOL
    }

    private final Kind kind;

    ParseException(Kind kind, String msg, String help, Label... labels) {
        super(msg, help, labels);
        this.kind = kind;
    }

    @Override
    public Kind kind() {
        return kind;
    }

    static ParseException unexpectedToken(Token at, String expected) {
        return new ParseException(Kind.UNEXPECTED_TOKEN, "Unexpected token",
            "expected to find " + expected, new Label(at.span(), "here"));
    }

    static ParseException unexpectedEOF(Span at, String expected) {
        return new ParseException(Kind.UNEXPECTED_EOF, "Unexpected EOF",
            "expected to find " + expected, new Label(at, "input ends here"));
    }

    static ParseException missingSection(String section) {
        return new ParseException(Kind.MISSING_SECTION, "Missing section",
            "expected to find [" + section + "]");
    }

    static ParseException duplicateSection(Token at, Token other) {
        return new ParseException(Kind.DUPLICATE_SECTION, "Duplicate section",
            null,
            new Label(at.span(), "here"),
            new Label(other.span(), "already defined here"));
    }

    static ParseException unknownSectionName(Token at) {
        return new ParseException(Kind.UNKNOWN_SECTION_NAME,
            "Unknown section name", null, new Label(at.span(), "here"));
    }

    static ParseException unknownState(Token at) {
        return new ParseException(Kind.UNKNOWN_STATE, "Unknown state", null,
            new Label(at.span(), "here"));
    }

    static ParseException unknownAlphabetSymbol(Token at) {
        return new ParseException(Kind.UNKNOWN_ALPHABET_SYMBOL,
            "Unknown alphabet symbol", null, new Label(at.span(), "here"));
    }
}
