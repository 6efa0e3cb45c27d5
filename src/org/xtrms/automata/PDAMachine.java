/*
 * @LICENSE@
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.EPSILON;
import static org.xtrms.automata.Misc.characters;
import static org.xtrms.automata.Misc.symbolFor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link PDA} greedily: at every step the first applicable move is
 * taken and no alternative is ever revisited. This is not a full
 * nondeterministic simulation, so some languages a PDA recognizes are
 * rejected here.
 */
public final class PDAMachine extends Machine {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINE;

    private final PDA pda;
    private String state;
    private final Deque<String> stack = new ArrayDeque<String>();

    public PDAMachine(PDA pda) {
        super(MachineKind.PDA);
        this.pda = pda;
        this.state = pda.start;
        if (pda.startStack != null) {
            stack.push(pda.startStack);
        }
    }

    @Override
    protected boolean eval(String input) {
        fireEpsilons();
        for (String c : characters(input)) {
            String symbol = symbolFor(pda.alphabet, c);
            if (symbol == null) {
                logger.log(level, "Symbol '" + c
                    + "' not in alphabet. Counting as not accepted");
                return false;
            }
            fireEpsilons();
            if (!step(symbol)) {
                logger.log(level, "No valid transition found for state '" + state
                    + "', symbol '" + symbol + "', stack top '" + stack.peek()
                    + "'. Counting as not accepted");
                return false;
            }
        }
        fireEpsilons();
        return pda.accept.contains(state);
    }

    /*
     * does not return if the epsilon moves cycle
     */
    private void fireEpsilons() {
        while (step(EPSILON)) continue;
    }

    private boolean step(String symbol) {
        PDA.Move move = pda.move(state, symbol, stack.peek());
        if (move == null) return false;
        switch (move.action) {
        case PUSH:
            stack.push(move.symbol);
            break;
        case POP:
            stack.poll();   // no-op when empty
            break;
        case NOOP:
            break;
        }
        state = move.state;
        return true;
    }

    String state() {
        return state;
    }

    /** @return the stack contents, top first. */
    List<String> stack() {
        return Collections.unmodifiableList(new ArrayList<String>(stack));
    }

    /** @return the stack top, or <code>null</code> if the stack is empty. */
    String top() {
        return stack.peek();
    }

    @Override
    protected String doToString() {
        return "state=" + state + ", stack=" + stack;
    }
}
