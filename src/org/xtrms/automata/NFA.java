/*
 * @LICENSE@
 */

package org.xtrms.automata;

import static org.xtrms.automata.Misc.EPSILON;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.automata.MachineDescription.Transition;

/**
 * A validated nondeterministic finite automaton. The alphabet always
 * contains the reserved epsilon symbol, which need not be declared. The
 * table maps (state, symbol) to a set of next states; a missing entry simply
 * means no move. Instances are immutable.
 */
public final class NFA {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    final Set<String> alphabet;
    final Map<Key, Set<String>> table;
    final String start;
    final Set<String> accept;

    /**
     * Validates the description as an NFA. The description is consumed.
     *
     * @throws NfaException
     *             if the description has stack or tape features.
     * @throws ParseException
     *             if a state or symbol is referenced but not declared.
     */
    public NFA(MachineDescription description, Source source) {

        description.consume();

        Token token = description.firstStackToken();
        if (token != null) throw NfaException.stackOperationsNotAllowed(token);
        token = description.firstTapeToken();
        if (token != null) throw NfaException.tapeOperationsNotAllowed(token);

        final Resolver r = new Resolver(source);
        final Set<String> states = r.set(description.states);
        final Set<String> alphabet = r.set(description.alphabet);
        alphabet.add(EPSILON);
        this.alphabet = Collections.unmodifiableSet(alphabet);
        this.accept = Collections.unmodifiableSet(
            r.states(description.finalStates, states));
        this.start = r.state(description.startState, states);

        final Map<Key, Set<String>> table = new LinkedHashMap<Key, Set<String>>();

        for (Transition t : description.transitions) {
            if (t.stackTop != null) {
                throw NfaException.stackOperationsNotAllowed(t.stackTop);
            }
            if (t.operation != null) {
                throw t.operation.isWrite()
                        ? NfaException.tapeOperationsNotAllowed(t.operation.keyword)
                        : NfaException.stackOperationsNotAllowed(t.operation.keyword);
            }
            if (t.direction != null) {
                throw NfaException.tapeOperationsNotAllowed(t.direction);
            }

            String from = r.state(t.from, states);
            String to = r.state(t.to, states);
            String symbol = r.symbol(t.symbol, alphabet);

            Key key = new Key(from, symbol);
            Set<String> next = table.get(key);
            if (next == null) {
                table.put(key, next = new LinkedHashSet<String>());
            }
            next.add(to);
        }
        for (Map.Entry<Key, Set<String>> e : table.entrySet()) {
            e.setValue(Collections.unmodifiableSet(e.getValue()));
        }
        this.table = Collections.unmodifiableMap(table);

        if (logger.isLoggable(level)) {
            logger.log(level, "nfa: " + toString());
        }
    }

    /**
     * The epsilon closure: every state reachable from <code>states</code>
     * through zero or more epsilon moves. Never removes a state.
     */
    Set<String> closure(Set<String> states) {
        Set<String> ret = new LinkedHashSet<String>(states);
        LinkedList<String> work = new LinkedList<String>(states);
        while (!work.isEmpty()) {
            Set<String> next = table.get(new Key(work.removeFirst(), EPSILON));
            if (next == null) continue;
            for (String state : next) {
                if (ret.add(state)) work.addFirst(state);
            }
        }
        return ret;
    }

    /**
     * The union of the moves on <code>symbol</code> from every state in
     * <code>states</code>, without closure.
     */
    Set<String> move(Set<String> states, String symbol) {
        Set<String> ret = new LinkedHashSet<String>();
        for (String state : states) {
            Set<String> next = table.get(new Key(state, symbol));
            if (next != null) ret.addAll(next);
        }
        return ret;
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

    @Override
    public String toString() {
        return "start=" + start + ", final=" + accept + Misc.LS
            + Misc.stringFrom("delta", table);
    }
}
