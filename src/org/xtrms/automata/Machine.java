/*
 * @LICENSE@
 */
package org.xtrms.automata;

/**
 * A validated machine together with its execution state. Running a machine
 * consumes it: the machines accumulate state while running, so
 * {@link #run(String)} may be invoked only once per instance.
 */
public abstract class Machine {

    final MachineKind kind;
    private boolean ran = false;

    Machine(MachineKind kind) {
        this.kind = kind;
    }

    public final MachineKind kind() {
        return kind;
    }

    /**
     * Runs the machine over the input, one character (Unicode code point) at
     * a time. Rejection is the ordinary negative outcome, never an exception.
     * A tape machine whose table never reaches a final state may not return.
     *
     * @return <code>true</code> if the input is accepted.
     * @throws IllegalStateException
     *             if this machine has already run.
     */
    public final boolean run(String input) {
        if (ran) {
            throw new IllegalStateException(this + " has already run");
        }
        ran = true;
        return eval(input);
    }

    abstract protected boolean eval(String input);

    @Override
    public final String toString() {
        return kind + ": " + doToString();
    }

    protected String doToString() {
        return getClass().getName() + "@" + Integer.toHexString(hashCode());
    }
}
