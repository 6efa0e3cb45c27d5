/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point tying the front end together: lexes and parses a machine
 * description, then validates it as the requested {@link MachineKind}.
 *
 * <pre>
 * Machine m = Automaton.compile(text, MachineKind.DFA);
 * boolean accepted = m.run("aab");
 * </pre>
 *
 * Every stage is fail fast; the first problem found is thrown as an
 * {@link AutomatonException} whose labels are byte spans into the
 * description text.
 */
public final class Automaton {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    private Automaton() {
    } // never instantiated

    public static Machine compile(String description, MachineKind kind) {
        return compile(new Source(description), kind);
    }

    public static Machine compile(Source source, MachineKind kind) {
        List<Token> tokens = Lexer.lex(source);
        MachineDescription description = DescriptionParser.parse(source, tokens);
        Machine machine = kind.newMachine(description, source);
        logger.log(level, "compiled: " + machine);
        return machine;
    }

    /**
     * Compiles the description and runs it once over the input.
     */
    public static boolean accepts(String description, MachineKind kind, String input) {
        return compile(description, kind).run(input);
    }
}
