/*
 * @LICENSE@
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.characters;
import static org.xtrms.automata.Misc.symbolFor;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link DFA}: a single current state, advanced once per input
 * character. A character outside the alphabet rejects.
 */
public final class DFAMachine extends Machine {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINE;

    private final DFA dfa;
    private String state;

    public DFAMachine(DFA dfa) {
        super(MachineKind.DFA);
        this.dfa = dfa;
        this.state = dfa.start;
    }

    @Override
    protected boolean eval(String input) {
        for (String c : characters(input)) {
            String symbol = symbolFor(dfa.alphabet, c);
            if (symbol == null) {
                logger.log(level, "Symbol '" + c
                    + "' not in alphabet. Counting as not accepted");
                return false;
            }
            String next = dfa.table.get(new Key(state, symbol));
            if (next == null) {
                logger.log(level, "No transition found for state '" + state
                    + "' with symbol '" + symbol + "'. Counting as not accepted");
                return false;
            }
            state = next;
        }
        return dfa.accept.contains(state);
    }

    String state() {
        return state;
    }

    @Override
    protected String doToString() {
        return "state=" + state;
    }
}
