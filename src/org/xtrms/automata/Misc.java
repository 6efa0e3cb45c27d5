/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects and methods shared by the validators and the machines.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /**
     * The reserved symbol for a move which consumes no input.
     */
    public static final String EPSILON = "ε";

    /*
     * idiom suppression for walking a String one code point at a time
     */
    static Iterable<String> characters(final CharSequence cs) {
        return new Iterable<String>() {
            public Iterator<String> iterator() {
                return new Iterator<String>() {
                    private int i = 0;

                    public boolean hasNext() {
                        return i < cs.length();
                    }

                    public String next() {
                        int cp = Character.codePointAt(cs, i);
                        i += Character.charCount(cp);
                        return new String(Character.toChars(cp));
                    }

                    public void remove() {
                        throw new UnsupportedOperationException();
                    }
                };
            }
        };
    }

    /**
     * Finds the alphabet symbol whose text is exactly the single character
     * <code>c</code>. Multi character symbols, and epsilon, never match input.
     * 
     * @return the symbol, or <code>null</code> if there is none.
     */
    static String symbolFor(Set<String> alphabet, String c) {
        assert c.codePointCount(0, c.length()) == 1 : c;
        if (c.equals(EPSILON)) return null;
        return alphabet.contains(c) ? c : null;
    }

    static <T> boolean disjoint(Collection<T> lhs, Collection<T> rhs) {
        for (T t : lhs) if (rhs.contains(t)) return false;
        return true;
    }

    static <K, V> String stringFrom(String title, Map<K, V> map) {
        StringBuilder sb = new StringBuilder();
        sb.append("table: ").append(title).append(LS);
        for (Map.Entry<K, V> e : map.entrySet()) {
            sb.append("    ").append(e.getKey()).append(" --> ")
                .append(e.getValue()).append(LS);
        }
        return sb.toString();
    }
}
