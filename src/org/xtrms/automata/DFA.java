/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.automata.MachineDescription.Transition;

/**
 * A validated deterministic finite automaton: the transition table maps every
 * (state, symbol) pair over the declared states and alphabet to exactly one
 * next state. Instances are immutable.
 */
public final class DFA {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    final Set<String> alphabet;
    final Map<Key, String> table;
    final String start;
    final Set<String> accept;

    /**
     * Validates the description as a DFA. The description is consumed.
     *
     * @throws DfaException
     *             if the description has stack or tape features, or is not
     *             deterministic and complete.
     * @throws ParseException
     *             if a state or symbol is referenced but not declared.
     */
    public DFA(MachineDescription description, Source source) {

        description.consume();

        Token token = description.firstStackToken();
        if (token != null) throw DfaException.stackOperationsNotAllowed(token);
        token = description.firstTapeToken();
        if (token != null) throw DfaException.tapeOperationsNotAllowed(token);

        final Resolver r = new Resolver(source);
        final Set<String> states = r.set(description.states);
        this.alphabet = Collections.unmodifiableSet(r.set(description.alphabet));
        this.accept = Collections.unmodifiableSet(
            r.states(description.finalStates, states));
        this.start = r.state(description.startState, states);

        final Map<Key, String> table = new LinkedHashMap<Key, String>();
        final Map<Key, Transition> firsts = new HashMap<Key, Transition>();

        for (Transition t : description.transitions) {
            if (t.stackTop != null) {
                throw DfaException.stackOperationsNotAllowed(t.stackTop);
            }
            if (t.operation != null) {
                throw t.operation.isWrite()
                        ? DfaException.tapeOperationsNotAllowed(t.operation.keyword)
                        : DfaException.stackOperationsNotAllowed(t.operation.keyword);
            }
            if (t.direction != null) {
                throw DfaException.tapeOperationsNotAllowed(t.direction);
            }

            String from = r.state(t.from, states);
            String to = r.state(t.to, states);
            String symbol = r.symbol(t.symbol, alphabet);

            Key key = new Key(from, symbol);
            Transition first = firsts.get(key);
            if (first != null) {
                throw DfaException.multipleTransitions(from, symbol, t.from, first.from);
            }
            firsts.put(key, t);
            table.put(key, to);
        }

        for (Token stateToken : description.states) {
            String state = r.text(stateToken);
            for (String symbol : alphabet) {
                if (!table.containsKey(new Key(state, symbol))) {
                    throw DfaException.incomplete(state, symbol, stateToken);
                }
            }
        }

        this.table = Collections.unmodifiableMap(table);

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa: " + toString());
        }
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

    /**
     * @return the next state, or <code>null</code> if there is no entry.
     */
    public String next(String state, String symbol) {
        return table.get(new Key(state, symbol));
    }

    @Override
    public String toString() {
        return "start=" + start + ", final=" + accept + Misc.LS
            + Misc.stringFrom("delta", table);
    }
}
