/*
 * @LICENSE@
 */

package org.xtrms.automata;

/**
 * Transition table key: a state, the symbol read, and for pushdown automata
 * an optional required stack top (<code>null</code> matches any stack).
 */
final class Key {

    final String state;
    final String symbol;
    final String stackTop;

    Key(String state, String symbol) {
        this(state, symbol, null);
    }

    Key(String state, String symbol, String stackTop) {
        assert state != null && symbol != null;
        this.state = state;
        this.symbol = symbol;
        this.stackTop = stackTop;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + state.hashCode();
        result = prime * result + symbol.hashCode();
        result = prime * result + ((stackTop == null) ? 0 : stackTop.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Key))
            return false;
        final Key key = (Key) o;
        if (stackTop == null) {
            if (key.stackTop != null)
                return false;
        } else if (!stackTop.equals(key.stackTop))
            return false;
        return state.equals(key.state) && symbol.equals(key.symbol);
    }

    @Override
    public String toString() {
        return "(" + state + ", " + symbol
            + (stackTop != null ? ", " + stackTop : "") + ")";
    }
}
