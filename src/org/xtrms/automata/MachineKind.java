/*
 * @LICENSE@
 */
package org.xtrms.automata;

import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The four kinds of machine a description can be run as. Internally, this
 * enum class is used as a factory: each constant validates a
 * {@link MachineDescription} by the rules of its kind and builds the
 * corresponding {@link Machine}.
 */
public enum MachineKind {

    /**
     * Deterministic finite automaton: exactly one transition for every state
     * and alphabet symbol.
     */
    DFA {
        @Override
        public Machine newMachine(MachineDescription description, Source source) {
            return new DFAMachine(new DFA(description, source));
        }
    },

    /**
     * Nondeterministic finite automaton with epsilon moves.
     */
    NFA {
        @Override
        public Machine newMachine(MachineDescription description, Source source) {
            return new NFAMachine(new NFA(description, source));
        }
    },

    /**
     * Pushdown automaton, run with a greedy first match policy.
     */
    PDA {
        @Override
        public Machine newMachine(MachineDescription description, Source source) {
            return new PDAMachine(new PDA(description, source));
        }
    },

    /**
     * Tape (Turing) machine.
     */
    TM {
        @Override
        public Machine newMachine(MachineDescription description, Source source) {
            return new TMMachine(new TM(description, source));
        }
    };

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    /**
     * Validates the description as a machine of this kind and builds it. The
     * description is consumed.
     *
     * @throws AutomatonException
     *             if the description is not a valid machine of this kind.
     */
    public abstract Machine newMachine(MachineDescription description, Source source);

    /**
     * Resolves a machine kind selector such as <code>"dfa"</code> or
     * <code>"TM"</code>.
     *
     * @throws IllegalArgumentException
     *             if the name matches no kind.
     */
    public static MachineKind forName(String name) {
        try {
            MachineKind kind = valueOf(name.trim().toUpperCase(Locale.ROOT));
            logger.log(level, "MachineKind selected: " + kind);
            return kind;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown machine kind: '" + name
                + "', expected one of dfa, nfa, pda, tm", e);
        }
    }
}
