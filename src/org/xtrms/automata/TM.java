/*
 * @LICENSE@
 */

package org.xtrms.automata;

import static org.xtrms.automata.Misc.EPSILON;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.automata.MachineDescription.Transition;

/**
 * A validated tape (Turing) machine. Every transition reads one tape symbol,
 * writes one tape symbol and moves the head one cell. The table is keyed by
 * (state, tape symbol); when two transitions share a key the later one
 * replaces the earlier.
 * <p>
 * Unlike the other validators, reference errors here are reported as
 * {@link TmException}s.
 */
public final class TM {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    public enum Direction {
        LEFT, RIGHT
    }

    static final class Move {

        final String state;
        final String write;
        final Direction direction;

        Move(String state, String write, Direction direction) {
            this.state = state;
            this.write = write;
            this.direction = direction;
        }

        @Override
        public String toString() {
            return "(" + state + ", " + write + ", " + direction + ")";
        }
    }

    final Set<String> alphabet;
    final Set<String> tapeAlphabet;
    final String blank;
    final Map<Key, Move> table;
    final String start;
    final Set<String> accept;

    private final Source source;

    /**
     * Validates the description as a tape machine. The description is
     * consumed.
     *
     * @throws TmException
     *             if a tape section or tape operation is missing, a state or
     *             tape symbol is not declared, or stack features are present.
     */
    public TM(MachineDescription description, Source source) {

        description.consume();

        Token token = description.firstStackToken();
        if (token != null) throw TmException.stackOperationsNotAllowed(token);
        if (description.tapeAlphabet == null) {
            throw TmException.missingSection(DescriptionParser.TAPE_ALPHABET);
        }
        if (description.blankSymbol == null) {
            throw TmException.missingSection(DescriptionParser.BLANK_SYMBOL);
        }

        this.source = source;
        final Set<String> states = set(description.states);
        this.alphabet = Collections.unmodifiableSet(set(description.alphabet));
        this.tapeAlphabet = Collections.unmodifiableSet(set(description.tapeAlphabet));
        this.blank = description.blankSymbol.text(source);

        final Set<String> accept = new LinkedHashSet<String>();
        for (Token t : description.finalStates) accept.add(state(t, states));
        this.accept = Collections.unmodifiableSet(accept);
        this.start = state(description.startState, states);

        final Map<Key, Move> table = new LinkedHashMap<Key, Move>();

        for (Transition t : description.transitions) {
            if (t.stackTop != null) {
                throw TmException.stackOperationsNotAllowed(t.stackTop);
            }

            String from = state(t.from, states);
            String symbol = t.symbol.text(source);
            if (!symbol.equals(EPSILON) && !tapeAlphabet.contains(symbol)) {
                throw TmException.unknownTapeSymbol(t.symbol);
            }
            String to = state(t.to, states);

            if (t.operation == null) {
                throw TmException.missingWrite(t.to);
            }
            if (!t.operation.isWrite()) {
                throw TmException.missingWrite(t.operation.keyword);
            }
            String write = t.operation.operand.text(source);
            if (!tapeAlphabet.contains(write)) {
                throw TmException.unknownTapeSymbol(t.operation.operand);
            }

            if (t.direction == null) {
                throw TmException.missingDirection(t.to);
            }
            Direction direction = t.direction.kind() == Token.Kind.LEFT
                    ? Direction.LEFT : Direction.RIGHT;

            Key key = new Key(from, symbol);
            Move old = table.put(key, new Move(to, write, direction));
            if (old != null) {
                logger.log(Level.FINE, "transition " + key + " --> " + old
                    + " replaced by " + t);
            }
        }
        this.table = Collections.unmodifiableMap(table);

        if (logger.isLoggable(level)) {
            logger.log(level, "tm: " + toString());
        }
    }

    private Set<String> set(List<Token> tokens) {
        Set<String> ret = new LinkedHashSet<String>();
        for (Token token : tokens) ret.add(token.text(source));
        return ret;
    }

    private String state(Token token, Set<String> states) {
        String ret = token.text(source);
        if (!states.contains(ret)) throw TmException.unknownState(token);
        return ret;
    }

    /**
     * @return the move for <code>state</code> reading <code>symbol</code>,
     *         or <code>null</code> if the machine halts there.
     */
    Move move(String state, String symbol) {
        return table.get(new Key(state, symbol));
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

    public Set<String> tapeAlphabet() {
        return tapeAlphabet;
    }

    public String blankSymbol() {
        return blank;
    }

    @Override
    public String toString() {
        return "start=" + start + ", final=" + accept + ", blank=" + blank
            + Misc.LS + Misc.stringFrom("delta", table);
    }
}
