/*
 * @LICENSE@
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.characters;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link TM}. The input is written on the tape from the origin and the
 * head rewound; the machine then steps until it enters a final state
 * (accept) or finds no transition (reject). There is no step limit: a
 * machine which does neither never returns.
 */
public final class TMMachine extends Machine {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    private final TM tm;
    private final Tape tape;
    private String state;

    public TMMachine(TM tm) {
        super(MachineKind.TM);
        this.tm = tm;
        this.tape = new Tape(tm.blank);
        this.state = tm.start;
    }

    @Override
    protected boolean eval(String input) {
        for (String c : characters(input)) {
            if (!tm.alphabet.contains(c)) {
                logger.log(Level.WARNING, "Symbol '" + c + "' is not in the alphabet");
            }
            tape.write(c);
            tape.moveRight();
        }
        tape.rewind();

        logger.log(level, "starting in state " + state);
        while (true) {
            String symbol = tape.read();
            TM.Move move = tm.move(state, symbol);
            if (move == null) {
                logger.log(Level.FINE, "No valid transition from state '" + state
                    + "' with symbol '" + symbol + "'. Counting as not accepted");
                return false;
            }
            tape.write(move.write);
            tape.move(move.direction);
            if (logger.isLoggable(level)) {
                logger.log(level, "(" + state + ", " + symbol + ") --> " + move
                    + " " + tape);
            }
            state = move.state;
            if (tm.accept.contains(state)) {
                logger.log(level, "reached final state " + state);
                return true;
            }
        }
    }

    String state() {
        return state;
    }

    Tape tape() {
        return tape;
    }

    @Override
    protected String doToString() {
        return "state=" + state + ", tape=" + tape;
    }
}
