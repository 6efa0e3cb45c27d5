/*
 * @LICENSE@
 */

package org.xtrms.automata;

/**
 * A description which is well formed but is not a pushdown automaton.
 */
public final class PdaException extends AutomatonException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        STACK_OPERATIONS_REQUIRED,
        TAPE_OPERATIONS_NOT_ALLOWED
    }

    private static final String REQUIRED =
        "PDA must have a stack alphabet and stack information in each transition";

    private final Kind kind;

    PdaException(Kind kind, String msg, String help, Label... labels) {
        super(msg, help, labels);
        this.kind = kind;
    }

    @Override
    public Kind kind() {
        return kind;
    }

    static PdaException missingStackAlphabet() {
        return new PdaException(Kind.STACK_OPERATIONS_REQUIRED, REQUIRED,
            "expected to find [stack_alphabet]");
    }

    static PdaException stackOperationRequired(Token at) {
        return new PdaException(Kind.STACK_OPERATIONS_REQUIRED, REQUIRED,
            "expected one of PUSH:<symbol>, POP or NOOP",
            new Label(at.span(), "here"));
    }

    static PdaException tapeOperationsNotAllowed(Token at) {
        return new PdaException(Kind.TAPE_OPERATIONS_NOT_ALLOWED,
            "PDA cannot have tape operations", null, new Label(at.span(), "here"));
    }
}
