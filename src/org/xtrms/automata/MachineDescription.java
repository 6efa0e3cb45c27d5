/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.Collections;
import java.util.List;

/**
 * The untyped result of parsing a machine description: every section as the
 * raw {@link Token}s which appeared in it. Nothing is cross checked at this
 * stage; that is the job of the validator for the requested machine kind.
 * <p>
 * A description is consumed by exactly one validator. Handing the same
 * instance to a second validator is an {@link IllegalStateException}.
 */
public final class MachineDescription {

    /**
     * A stack or tape operation on the right hand side of a transition:
     * <code>PUSH:sym</code>, <code>POP</code>, <code>NOOP</code> or
     * <code>WRITE:sym</code>.
     */
    public static final class Operation {

        final Token keyword;
        final Token operand;    // null for POP and NOOP

        Operation(Token keyword, Token operand) {
            assert keyword.kind().isKeyword();
            assert (operand != null) == (keyword.kind() == Token.Kind.PUSH
                    || keyword.kind() == Token.Kind.WRITE);
            this.keyword = keyword;
            this.operand = operand;
        }

        public Token keyword() {
            return keyword;
        }

        public Token operand() {
            return operand;
        }

        public Token.Kind kind() {
            return keyword.kind();
        }

        boolean isWrite() {
            return keyword.kind() == Token.Kind.WRITE;
        }

        @Override
        public String toString() {
            return operand == null ? keyword.toString() : keyword + ":" + operand;
        }
    }

    /**
     * One line of the <code>[transitions]</code> section, e.g.
     * <code>q0(a,Z) =&gt; q1(PUSH:A)</code>.
     */
    public static final class Transition {

        final Token from;
        final Token symbol;
        final Token stackTop;       // optional
        final Token to;
        final Operation operation;  // optional
        final Token direction;      // optional: LEFT or RIGHT

        Transition(Token from, Token symbol, Token stackTop, Token to,
                Operation operation, Token direction) {
            this.from = from;
            this.symbol = symbol;
            this.stackTop = stackTop;
            this.to = to;
            this.operation = operation;
            this.direction = direction;
        }

        public Token from() {
            return from;
        }

        public Token symbol() {
            return symbol;
        }

        public Token stackTop() {
            return stackTop;
        }

        public Token to() {
            return to;
        }

        public Operation operation() {
            return operation;
        }

        public Token direction() {
            return direction;
        }

        @Override
        public String toString() {
            return "{" + from + "(" + symbol
                + (stackTop != null ? "," + stackTop : "") + ") => " + to
                + (operation != null ? " " + operation : "")
                + (direction != null ? " " + direction : "") + "}";
        }
    }

    final List<Token> states;
    final List<Token> alphabet;
    final List<Transition> transitions;
    final Token startState;
    final List<Token> finalStates;

    final List<Token> stackAlphabet;    // optional
    final Token startStack;             // optional
    final List<Token> tapeAlphabet;     // optional
    final Token blankSymbol;            // optional

    private boolean consumed = false;

    MachineDescription(List<Token> states, List<Token> alphabet,
            List<Transition> transitions, Token startState,
            List<Token> finalStates, List<Token> stackAlphabet,
            Token startStack, List<Token> tapeAlphabet, Token blankSymbol) {
        this.states = Collections.unmodifiableList(states);
        this.alphabet = Collections.unmodifiableList(alphabet);
        this.transitions = Collections.unmodifiableList(transitions);
        this.startState = startState;
        this.finalStates = Collections.unmodifiableList(finalStates);
        this.stackAlphabet = stackAlphabet == null
                ? null : Collections.unmodifiableList(stackAlphabet);
        this.startStack = startStack;
        this.tapeAlphabet = tapeAlphabet == null
                ? null : Collections.unmodifiableList(tapeAlphabet);
        this.blankSymbol = blankSymbol;
    }

    public List<Token> states() {
        return states;
    }

    public List<Token> alphabet() {
        return alphabet;
    }

    public List<Transition> transitions() {
        return transitions;
    }

    public Token startState() {
        return startState;
    }

    public List<Token> finalStates() {
        return finalStates;
    }

    /** @return the stack alphabet, or <code>null</code> if not declared. */
    public List<Token> stackAlphabet() {
        return stackAlphabet;
    }

    /** @return the initial stack symbol, or <code>null</code> if not declared. */
    public Token startStack() {
        return startStack;
    }

    /** @return the tape alphabet, or <code>null</code> if not declared. */
    public List<Token> tapeAlphabet() {
        return tapeAlphabet;
    }

    /** @return the blank symbol, or <code>null</code> if not declared. */
    public Token blankSymbol() {
        return blankSymbol;
    }

    /**
     * Marks this description as taken by a validator.
     */
    void consume() {
        if (consumed) {
            throw new IllegalStateException(
                "machine description already consumed by a validator");
        }
        consumed = true;
    }

    /**
     * @return the first token of a declared stack section, or
     *         <code>null</code> if neither stack section is present.
     */
    Token firstStackToken() {
        if (stackAlphabet != null) return stackAlphabet.get(0);
        return startStack;
    }

    /**
     * @return the first token of a declared tape section, or
     *         <code>null</code> if neither tape section is present.
     */
    Token firstTapeToken() {
        if (tapeAlphabet != null) return tapeAlphabet.get(0);
        return blankSymbol;
    }
}
