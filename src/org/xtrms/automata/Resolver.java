/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves tokens to their text and checks references against the declared
 * states and symbols, for the finite and pushdown automata validators.
 */
final class Resolver {

    private final Source source;

    Resolver(Source source) {
        this.source = source;
    }

    String text(Token token) {
        return token.text(source);
    }

    /*
     * declaration order is kept, so diagnostics are reproducible
     */
    Set<String> set(List<Token> tokens) {
        Set<String> ret = new LinkedHashSet<String>();
        for (Token token : tokens) ret.add(text(token));
        return ret;
    }

    String state(Token token, Set<String> states) {
        String ret = text(token);
        if (!states.contains(ret)) throw ParseException.unknownState(token);
        return ret;
    }

    Set<String> states(List<Token> tokens, Set<String> states) {
        Set<String> ret = new LinkedHashSet<String>();
        for (Token token : tokens) ret.add(state(token, states));
        return ret;
    }

    String symbol(Token token, Set<String> alphabet) {
        String ret = text(token);
        if (!alphabet.contains(ret)) throw ParseException.unknownAlphabetSymbol(token);
        return ret;
    }
}
