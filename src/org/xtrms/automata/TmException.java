/*
 * @LICENSE@
 */

package org.xtrms.automata;

/**
 * A description which is well formed but is not a tape machine.
 */
public final class TmException extends AutomatonException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNKNOWN_STATE,
        UNKNOWN_TAPE_SYMBOL,
        MISSING_SECTION,
        MISSING_TAPE_OPERATION,
        STACK_OPERATIONS_NOT_ALLOWED
    }

    private final Kind kind;

    TmException(Kind kind, String msg, String help, Label... labels) {
        super(msg, help, labels);
        this.kind = kind;
    }

    @Override
    public Kind kind() {
        return kind;
    }

    static TmException unknownState(Token at) {
        return new TmException(Kind.UNKNOWN_STATE, "Unknown state", null,
            new Label(at.span(), "here"));
    }

    static TmException unknownTapeSymbol(Token at) {
        return new TmException(Kind.UNKNOWN_TAPE_SYMBOL, "Unknown tape symbol",
            null, new Label(at.span(), "here"));
    }

    static TmException missingSection(String section) {
        return new TmException(Kind.MISSING_SECTION, "Missing section",
            "expected to find [" + section + "]");
    }

    static TmException missingWrite(Token at) {
        return new TmException(Kind.MISSING_TAPE_OPERATION,
            "Missing tape operation", "expected to find WRITE:<symbol>",
            new Label(at.span(), "here"));
    }

    static TmException missingDirection(Token at) {
        return new TmException(Kind.MISSING_TAPE_OPERATION,
            "Missing tape operation", "expected to find LEFT or RIGHT",
            new Label(at.span(), "here"));
    }

    static TmException stackOperationsNotAllowed(Token at) {
        return new TmException(Kind.STACK_OPERATIONS_NOT_ALLOWED,
            "Tape machine cannot have stack operations", null,
            new Label(at.span(), "here"));
    }
}
