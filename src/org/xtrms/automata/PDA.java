/*
 * @LICENSE@
 */

package org.xtrms.automata;

import static org.xtrms.automata.Misc.EPSILON;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.automata.MachineDescription.Transition;

/**
 * A validated pushdown automaton. Each transition is keyed by state, input
 * symbol (possibly epsilon) and an optional required stack top; a key with no
 * stack top matches whatever is on the stack, including nothing. Several
 * moves may share a key and are kept in declaration order.
 */
public final class PDA {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    /**
     * What a move does to the stack.
     */
    enum Action {
        PUSH, POP, NOOP
    }

    /**
     * The right hand side of a transition.
     */
    static final class Move {

        final String state;
        final Action action;
        final String symbol;    // pushed symbol, null unless PUSH

        Move(String state, Action action, String symbol) {
            assert (symbol != null) == (action == Action.PUSH);
            this.state = state;
            this.action = action;
            this.symbol = symbol;
        }

        @Override
        public String toString() {
            return state + (action == Action.PUSH ? " PUSH:" + symbol : " " + action);
        }
    }

    final Set<String> alphabet;
    final Set<String> stackAlphabet;
    final Map<Key, List<Move>> table;
    final String start;
    final Set<String> accept;
    final String startStack;    // may be null

    /**
     * Validates the description as a PDA. The description is consumed.
     *
     * @throws PdaException
     *             if the stack alphabet or a transition's stack operation is
     *             missing, or tape features are present.
     * @throws ParseException
     *             if a state or symbol is referenced but not declared.
     */
    public PDA(MachineDescription description, Source source) {

        description.consume();

        Token token = description.firstTapeToken();
        if (token != null) throw PdaException.tapeOperationsNotAllowed(token);
        if (description.stackAlphabet == null) {
            throw PdaException.missingStackAlphabet();
        }

        final Resolver r = new Resolver(source);
        final Set<String> states = r.set(description.states);
        final Set<String> alphabet = r.set(description.alphabet);
        alphabet.add(EPSILON);
        this.alphabet = Collections.unmodifiableSet(alphabet);
        this.stackAlphabet = Collections.unmodifiableSet(r.set(description.stackAlphabet));
        this.startStack = description.startStack == null
                ? null : r.symbol(description.startStack, stackAlphabet);
        this.accept = Collections.unmodifiableSet(
            r.states(description.finalStates, states));
        this.start = r.state(description.startState, states);

        final Map<Key, List<Move>> table = new LinkedHashMap<Key, List<Move>>();

        for (Transition t : description.transitions) {
            if (t.direction != null) {
                throw PdaException.tapeOperationsNotAllowed(t.direction);
            }
            if (t.operation == null) {
                throw PdaException.stackOperationRequired(t.to);
            }
            if (t.operation.isWrite()) {
                throw PdaException.stackOperationRequired(t.operation.keyword);
            }

            String from = r.state(t.from, states);
            String to = r.state(t.to, states);
            String symbol = r.symbol(t.symbol, alphabet);
            String top = t.stackTop == null ? null : r.symbol(t.stackTop, stackAlphabet);

            Move move;
            switch (t.operation.kind()) {
            case PUSH:
                move = new Move(to, Action.PUSH,
                    r.symbol(t.operation.operand, stackAlphabet));
                break;
            case POP:
                move = new Move(to, Action.POP, null);
                break;
            case NOOP:
                move = new Move(to, Action.NOOP, null);
                break;
            default:
                throw new AssertionError(t.operation);
            }

            Key key = new Key(from, symbol, top);
            List<Move> moves = table.get(key);
            if (moves == null) {
                table.put(key, moves = new ArrayList<Move>());
            }
            moves.add(move);
        }
        for (Map.Entry<Key, List<Move>> e : table.entrySet()) {
            e.setValue(Collections.unmodifiableList(e.getValue()));
        }
        this.table = Collections.unmodifiableMap(table);

        if (logger.isLoggable(level)) {
            logger.log(level, "pda: " + toString());
        }
    }

    /**
     * The move taken from <code>state</code> on <code>symbol</code> with
     * <code>top</code> on the stack. An entry for the exact stack top wins
     * over an entry with no stack requirement; within an entry the first
     * declared move wins.
     *
     * @param top
     *            the stack top, <code>null</code> if the stack is empty.
     * @return the move, or <code>null</code> if none applies.
     */
    Move move(String state, String symbol, String top) {
        List<Move> moves = null;
        if (top != null) {
            moves = table.get(new Key(state, symbol, top));
        }
        if (moves == null) {
            moves = table.get(new Key(state, symbol));
        }
        return moves == null ? null : moves.get(0);
    }

    public String startState() {
        return start;
    }

    public Set<String> finalStates() {
        return accept;
    }

    public Set<String> alphabet() {
        return alphabet;
    }

    public Set<String> stackAlphabet() {
        return stackAlphabet;
    }

    /** @return the initial stack symbol, or <code>null</code> for none. */
    public String startStack() {
        return startStack;
    }

    @Override
    public String toString() {
        return "start=" + start + ", final=" + accept + ", stack=" + startStack
            + Misc.LS + Misc.stringFrom("delta", table);
    }
}
