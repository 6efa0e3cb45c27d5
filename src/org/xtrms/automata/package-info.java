/*
 * @LICENSE@
 */

/**
 * <h3><b>xtrms-automata</b> - textual descriptions of finite, pushdown and
 * tape automata, validated and run against input strings.</h3>
 * <p>
 * <h4>Description format.</h4>
 * <p>
 * A machine is written as a small sectioned text file: states, input
 * alphabet, initial and final states, and the transition table, plus a stack
 * alphabet for pushdown automata or a tape alphabet and blank symbol for tape
 * machines. See {@link org.xtrms.automata.DescriptionParser} for the grammar.
 * <code>#</code> starts a comment, and the symbol <code>&#949;</code> is
 * reserved for moves which consume no input.
 * <p>
 * <h4>Pipeline.</h4>
 * <p>
 * Processing is strictly staged and fail fast:
 * <ol>
 * <li>{@link org.xtrms.automata.Lexer} - text to tokens. Tokens carry only a
 * kind and a byte span into the {@link org.xtrms.automata.Source}.</li>
 * <li>{@link org.xtrms.automata.DescriptionParser} - tokens to an unchecked
 * {@link org.xtrms.automata.MachineDescription}.</li>
 * <li>a validator ({@link org.xtrms.automata.DFA},
 * {@link org.xtrms.automata.NFA}, {@link org.xtrms.automata.PDA} or
 * {@link org.xtrms.automata.TM}) - cross checks the description by the rules
 * of the requested {@link org.xtrms.automata.MachineKind} and builds an
 * immutable transition table.</li>
 * <li>a {@link org.xtrms.automata.Machine} - the table plus execution state,
 * run once over an input string.</li>
 * </ol>
 * {@link org.xtrms.automata.Automaton} strings the stages together.
 * <p>
 * <h4>Errors.</h4>
 * <p>
 * Every problem with a description is reported as a subclass of the unchecked
 * {@link org.xtrms.automata.AutomatonException}, carrying a kind, an optional
 * help line and zero or more labelled spans pointing into the description.
 * Rejecting an input is not an error: {@link org.xtrms.automata.Machine#run}
 * simply returns <code>false</code>.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * All classes log to the <code>org.xtrms.automata</code>
 * {@link java.util.logging.Logger}. Rejection reasons are logged at FINE,
 * transition tables and tape machine steps at FINEST.
 * <p>
 * <h4>Limitations.</h4>
 * <p>
 * Pushdown automata are run greedily, taking the first applicable move, so
 * they accept a subset of what a true nondeterministic simulation would.
 * Epsilon moves are followed until none applies, so a pushdown automaton
 * whose epsilon moves form a cycle, such as <code>s(&#949;) =&gt; s(NOOP)</code>,
 * never returns from {@link org.xtrms.automata.Machine#run}.
 * Tape machines run without a step limit.
 */
package org.xtrms.automata;
