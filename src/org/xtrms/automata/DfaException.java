/*
 * @LICENSE@
 */

package org.xtrms.automata;

/**
 * A description which is well formed but is not a deterministic, complete
 * finite automaton.
 */
public final class DfaException extends AutomatonException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        STACK_OPERATIONS_NOT_ALLOWED,
        TAPE_OPERATIONS_NOT_ALLOWED,
        MULTIPLE_TRANSITIONS,
        INCOMPLETE_DFA
    }

    private final Kind kind;

    DfaException(Kind kind, String msg, String help, Label... labels) {
        super(msg, help, labels);
        this.kind = kind;
    }

    @Override
    public Kind kind() {
        return kind;
    }

    static DfaException stackOperationsNotAllowed(Token at) {
        return new DfaException(Kind.STACK_OPERATIONS_NOT_ALLOWED,
            "DFA cannot have stack operations", null, new Label(at.span(), "here"));
    }

    static DfaException tapeOperationsNotAllowed(Token at) {
        return new DfaException(Kind.TAPE_OPERATIONS_NOT_ALLOWED,
            "DFA cannot have tape operations", null, new Label(at.span(), "here"));
    }

    static DfaException multipleTransitions(String state, String symbol,
            Token at, Token other) {
        return new DfaException(Kind.MULTIPLE_TRANSITIONS,
            "Cannot have multiple transitions from state '" + state
                + "' with symbol '" + symbol + "'",
            null,
            new Label(at.span(), "here"),
            new Label(other.span(), "first defined here"));
    }

    static DfaException incomplete(String state, String symbol, Token at) {
        return new DfaException(Kind.INCOMPLETE_DFA,
            "DFA is incomplete: no transition defined for state '" + state
                + "' with symbol '" + symbol + "'",
            "add a transition " + state + "(" + symbol + ") => ...",
            new Label(at.span(), "state declared here"));
    }
}
