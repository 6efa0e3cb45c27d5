/*
 * @LICENSE@
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.characters;
import static org.xtrms.automata.Misc.disjoint;
import static org.xtrms.automata.Misc.symbolFor;

import java.util.Collections;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an {@link NFA} by set simulation: the configuration is the set of all
 * states the automaton could be in, kept epsilon closed.
 */
public final class NFAMachine extends Machine {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINE;

    private final NFA nfa;
    private Set<String> states;

    public NFAMachine(NFA nfa) {
        super(MachineKind.NFA);
        this.nfa = nfa;
        this.states = nfa.closure(Collections.singleton(nfa.start));
    }

    @Override
    protected boolean eval(String input) {
        for (String c : characters(input)) {
            String symbol = symbolFor(nfa.alphabet, c);
            if (symbol == null) {
                logger.log(level, "Symbol '" + c
                    + "' not in alphabet. Counting as not accepted");
                return false;
            }
            states = nfa.closure(nfa.move(states, symbol));
            if (states.isEmpty()) {
                logger.log(level, "No valid transitions found for symbol '" + c
                    + "'. Counting as not accepted");
                return false;
            }
        }
        return !disjoint(states, nfa.accept);
    }

    Set<String> states() {
        return Collections.unmodifiableSet(states);
    }

    @Override
    protected String doToString() {
        return "states=" + states;
    }
}
