/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Base of the structured errors reported while reading and validating a
 * machine description. The subclasses form a closed set, one per error
 * taxonomy: {@link LexException}, {@link ParseException},
 * {@link DfaException}, {@link NfaException}, {@link PdaException} and
 * {@link TmException}. Each carries a <code>Kind</code> constant from its own
 * enumeration, zero or more {@linkplain Label labelled} byte spans into the
 * {@link Source}, and optional help text. Rendering is left to the caller.
 * <p>
 * A machine rejecting its input is <em>not</em> an error; see
 * {@link Machine#run(String)}.
 */
public abstract class AutomatonException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<Label> labels;
    private final String help;

    AutomatonException(String msg, String help, Label... labels) {
        super(msg);
        this.help = help;
        this.labels = Collections.unmodifiableList(Arrays.asList(labels.clone()));
    }

    /**
     * @return the enumerated kind of this error.
     */
    public abstract Enum<?> kind();

    /**
     * @return the labelled source locations, possibly empty.
     */
    public List<Label> labels() {
        return labels;
    }

    /**
     * @return the help text, or <code>null</code> if there is none.
     */
    public String help() {
        return help;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName());
        sb.append('(').append(kind()).append("): ").append(getMessage());
        for (Label label : labels) {
            sb.append(Misc.LS).append("    ").append(label);
        }
        if (help != null) sb.append(Misc.LS).append("help: ").append(help);
        return sb.toString();
    }
}
