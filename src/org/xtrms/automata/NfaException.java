/*
 * @LICENSE@
 */

package org.xtrms.automata;

/**
 * A description which is well formed but uses features a nondeterministic
 * finite automaton does not have.
 */
public final class NfaException extends AutomatonException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        STACK_OPERATIONS_NOT_ALLOWED,
        TAPE_OPERATIONS_NOT_ALLOWED
    }

    private final Kind kind;

    NfaException(Kind kind, String msg, String help, Label... labels) {
        super(msg, help, labels);
        this.kind = kind;
    }

    @Override
    public Kind kind() {
        return kind;
    }

    static NfaException stackOperationsNotAllowed(Token at) {
        return new NfaException(Kind.STACK_OPERATIONS_NOT_ALLOWED,
            "NFA cannot have stack operations", null, new Label(at.span(), "here"));
    }

    static NfaException tapeOperationsNotAllowed(Token at) {
        return new NfaException(Kind.TAPE_OPERATIONS_NOT_ALLOWED,
            "NFA cannot have tape operations", null, new Label(at.span(), "here"));
    }
}
