/* @LICENSE@  
 */

package org.xtrms.automata;

import static org.xtrms.automata.AutomatonAssert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

public class NFATestCase extends AbstractAutomatonTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(NFATestCase.class);
    }

    public NFATestCase(String name) {
        super(name);
    }

    /*
     * strings over {a, b} ending in "ab"
     */
    private static final String ENDS_AB = lines(
        "[states] q0, q1, q2",
        "[alphabet] a, b",
        "[initial] q0",
        "[final] q2",
        "[transitions]",
        "q0(a) => q0",
        "q0(b) => q0",
        "q0(a) => q1",
        "q1(b) => q2");

    private static final String CYCLE = lines(
        "[states] p, q, r, s",
        "[alphabet] a",
        "[initial] p",
        "[final] s",
        "[transitions]",
        "p(ε) => q",
        "q(ε) => r",
        "r(ε) => p",
        "r(a) => s");

    private static NFA nfa(String text) {
        Source source = new Source(text);
        return new NFA(describe(source), source);
    }

    private static Set<String> set(String... states) {
        return new HashSet<String>(Arrays.asList(states));
    }

    public void testTable() {
        NFA nfa = nfa(ENDS_AB);
        assertTrue(nfa.alphabet().contains(Misc.EPSILON));
        assertEquals(3, nfa.alphabet().size());
        assertEquals(set("q0", "q1"), nfa.move(set("q0"), "a"));
        assertEquals(set("q0", "q2"), nfa.move(set("q0", "q1"), "b"));
        assertTrue(nfa.move(set("q2"), "a").isEmpty());
    }

    public void testClosure() {
        NFA nfa = nfa(CYCLE);
        Set<String> closure = nfa.closure(set("p"));
        assertEquals(set("p", "q", "r"), closure);
        // idempotent
        assertEquals(closure, nfa.closure(closure));
        // never shrinks
        assertEquals(set("p", "q", "r", "s"), nfa.closure(set("s", "q")));
        assertEquals(set("s"), nfa.closure(set("s")));
        assertTrue(nfa.closure(Collections.<String>emptySet()).isEmpty());
    }

    public void testRun() {
        assertAccepts(MachineKind.NFA, ENDS_AB, "ab", "aab", "bab", "abab");
        assertRejects(MachineKind.NFA, ENDS_AB, "", "a", "ba", "abb", "abc");

        NFAMachine m = new NFAMachine(nfa(ENDS_AB));
        assertEquals(set("q0"), m.states());
        assertFalse(m.run("aba"));
        assertEquals(set("q0", "q1"), m.states());
    }

    public void testEpsilon() {
        assertAccepts(MachineKind.NFA, CYCLE, "a");
        assertRejects(MachineKind.NFA, CYCLE, "", "aa");

        NFAMachine m = new NFAMachine(nfa(CYCLE));
        assertEquals(set("p", "q", "r"), m.states());
    }

    public void testEpsilonIsNotInput() {
        String text = lines(
            "[states] p, q",
            "[alphabet] a",
            "[initial] p",
            "[final] q",
            "[transitions] p(ε) => q");
        assertAccepts(MachineKind.NFA, text, "");
        assertRejects(MachineKind.NFA, text, "ε", "a");
    }

    public void testStackOperations() {
        assertFails(NfaException.class,
            NfaException.Kind.STACK_OPERATIONS_NOT_ALLOWED, MachineKind.NFA,
            ENDS_AB + "[stack_alphabet] Z");
        assertFails(NfaException.class,
            NfaException.Kind.STACK_OPERATIONS_NOT_ALLOWED, MachineKind.NFA,
            ENDS_AB.replace("q1(b) => q2", "q1(b, Z) => q2"));
        String text = ENDS_AB.replace("q1(b) => q2", "q1(b) => q2(PUSH:Z)");
        NfaException e = assertFails(NfaException.class,
            NfaException.Kind.STACK_OPERATIONS_NOT_ALLOWED, MachineKind.NFA, text);
        assertLabel(text, e, 0, "PUSH");
    }

    public void testTapeOperations() {
        assertFails(NfaException.class,
            NfaException.Kind.TAPE_OPERATIONS_NOT_ALLOWED, MachineKind.NFA,
            ENDS_AB + "[blank_symbol] B");
        assertFails(NfaException.class,
            NfaException.Kind.TAPE_OPERATIONS_NOT_ALLOWED, MachineKind.NFA,
            ENDS_AB.replace("q1(b) => q2", "q1(b) => q2(LEFT)"));
        assertFails(NfaException.class,
            NfaException.Kind.TAPE_OPERATIONS_NOT_ALLOWED, MachineKind.NFA,
            ENDS_AB.replace("q1(b) => q2", "q1(b) => q2(WRITE:a, LEFT)"));
    }

    public void testUnknownReferences() {
        assertFails(ParseException.class, ParseException.Kind.UNKNOWN_STATE,
            MachineKind.NFA, ENDS_AB.replace("q1(b) => q2", "q1(b) => q3"));
        assertFails(ParseException.class,
            ParseException.Kind.UNKNOWN_ALPHABET_SYMBOL, MachineKind.NFA,
            ENDS_AB.replace("q1(b) => q2", "q1(x) => q2"));
    }
}
