/* @LICENSE@  
 */

package org.xtrms.automata;

import static org.xtrms.automata.AutomatonAssert.*;

public class DFATestCase extends AbstractAutomatonTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(DFATestCase.class);
    }

    public DFATestCase(String name) {
        super(name);
    }

    private static final String HEADER = lines(
        "[states] q0, q1",
        "[alphabet] a, b",
        "[initial] q0",
        "[final] q0");

    /*
     * even number of a's
     */
    private static final String EVEN_A = HEADER + lines(
        "[transitions]",
        "q0(a) => q1",
        "q0(b) => q0",
        "q1(a) => q0",
        "q1(b) => q1");

    private static DFA dfa(String text) {
        Source source = new Source(text);
        return new DFA(describe(source), source);
    }

    public void testTable() {
        DFA dfa = dfa(EVEN_A);
        assertEquals("q0", dfa.startState());
        assertTrue(dfa.finalStates().contains("q0"));
        assertEquals(2, dfa.alphabet().size());
        assertEquals("q1", dfa.next("q0", "a"));
        assertEquals("q1", dfa.next("q1", "b"));
        assertNull(dfa.next("q0", "c"));
        assertEquals(4, dfa.table.size());
    }

    public void testRun() {
        assertAccepts(MachineKind.DFA, EVEN_A, "", "aa", "b", "abba", "bbaab");
        assertRejects(MachineKind.DFA, EVEN_A, "a", "ab", "aaa", "ab a", "c");

        DFAMachine m = new DFAMachine(dfa(EVEN_A));
        assertEquals("q0", m.state());
        assertFalse(m.run("abb"));
        assertEquals("q1", m.state());
    }

    public void testRunOnce() {
        Machine m = Automaton.compile(EVEN_A, MachineKind.DFA);
        assertEquals(MachineKind.DFA, m.kind());
        assertTrue(m.run("aa"));
        try {
            m.run("aa");
            fail("should throw");
        } catch (IllegalStateException e) {
            logger.log(level, e.toString());
        }
    }

    public void testConsumeOnce() {
        Source source = new Source(EVEN_A);
        MachineDescription d = describe(source);
        new DFA(d, source);
        try {
            new DFA(d, source);
            fail("should throw");
        } catch (IllegalStateException e) {
            logger.log(level, e.toString());
        }
        try {
            new NFA(d, source);
            fail("should throw");
        } catch (IllegalStateException e) {
            logger.log(level, e.toString());
        }
    }

    public void testMultiCharacterSymbol() {
        String text = lines(
            "[states] q0",
            "[alphabet] ab",
            "[initial] q0",
            "[final] q0",
            "[transitions] q0(ab) => q0");
        assertAccepts(MachineKind.DFA, text, "");
        assertRejects(MachineKind.DFA, text, "ab", "a");
    }

    public void testUnicodeSymbol() {
        String text = lines(
            "[states] q0, q1",
            "[alphabet] λ",
            "[initial] q0",
            "[final] q1",
            "[transitions] q0(λ) => q1",
            "q1(λ) => q0");
        assertAccepts(MachineKind.DFA, text, "λ", "λλλ");
        assertRejects(MachineKind.DFA, text, "", "λλ");
    }

    public void testMultipleTransitions() {
        String text = EVEN_A + "q1(a) => q1\n";
        DfaException e = assertFails(DfaException.class,
            DfaException.Kind.MULTIPLE_TRANSITIONS, MachineKind.DFA, text);
        assertEquals(2, e.labels().size());
        assertLabel(text, e, 0, "q1", text.lastIndexOf("q1(a)"));
        assertLabel(text, e, 1, "q1", text.indexOf("q1(a)"));
        assertTrue(e.getMessage().contains("'q1'"));
        assertTrue(e.getMessage().contains("'a'"));
    }

    public void testIncomplete() {
        String text = HEADER + lines(
            "[transitions]",
            "q0(a) => q1",
            "q0(b) => q0",
            "q1(a) => q0");
        DfaException e = assertFails(DfaException.class,
            DfaException.Kind.INCOMPLETE_DFA, MachineKind.DFA, text);
        assertLabel(text, e, 0, "q1");
        assertTrue(e.getMessage().contains("'b'"));
        assertNotNull(e.help());
    }

    public void testStackOperations() {
        assertFails(DfaException.class,
            DfaException.Kind.STACK_OPERATIONS_NOT_ALLOWED, MachineKind.DFA,
            EVEN_A + "[stack_alphabet] Z");
        assertFails(DfaException.class,
            DfaException.Kind.STACK_OPERATIONS_NOT_ALLOWED, MachineKind.DFA,
            EVEN_A + "[start_stack] Z");

        String text = EVEN_A.replace("q0(a) => q1", "q0(a, Z) => q1");
        DfaException e = assertFails(DfaException.class,
            DfaException.Kind.STACK_OPERATIONS_NOT_ALLOWED, MachineKind.DFA, text);
        assertLabel(text, e, 0, "Z");

        text = EVEN_A.replace("q0(a) => q1", "q0(a) => q1(POP)");
        e = assertFails(DfaException.class,
            DfaException.Kind.STACK_OPERATIONS_NOT_ALLOWED, MachineKind.DFA, text);
        assertLabel(text, e, 0, "POP");
    }

    public void testTapeOperations() {
        String text = EVEN_A + "[tape_alphabet] x, y";
        DfaException e = assertFails(DfaException.class,
            DfaException.Kind.TAPE_OPERATIONS_NOT_ALLOWED, MachineKind.DFA, text);
        assertLabel(text, e, 0, "x");

        assertFails(DfaException.class,
            DfaException.Kind.TAPE_OPERATIONS_NOT_ALLOWED, MachineKind.DFA,
            EVEN_A.replace("q0(a) => q1", "q0(a) => q1(WRITE:a)"));
        assertFails(DfaException.class,
            DfaException.Kind.TAPE_OPERATIONS_NOT_ALLOWED, MachineKind.DFA,
            EVEN_A.replace("q0(a) => q1", "q0(a) => q1(RIGHT)"));
    }

    public void testUnknownReferences() {
        String text = EVEN_A.replace("[final] q0", "[final] q9");
        ParseException e = assertFails(ParseException.class,
            ParseException.Kind.UNKNOWN_STATE, MachineKind.DFA, text);
        assertLabel(text, e, 0, "q9");

        assertFails(ParseException.class, ParseException.Kind.UNKNOWN_STATE,
            MachineKind.DFA, EVEN_A.replace("[initial] q0", "[initial] s"));
        assertFails(ParseException.class, ParseException.Kind.UNKNOWN_STATE,
            MachineKind.DFA, EVEN_A.replace("q1(b) => q1", "q1(b) => q2"));

        text = EVEN_A.replace("q1(b) => q1", "q1(c) => q1");
        e = assertFails(ParseException.class,
            ParseException.Kind.UNKNOWN_ALPHABET_SYMBOL, MachineKind.DFA, text);
        assertLabel(text, e, 0, "c");
    }

    public void testForName() {
        assertSame(MachineKind.DFA, MachineKind.forName("dfa"));
        assertSame(MachineKind.TM, MachineKind.forName(" TM "));
        try {
            MachineKind.forName("lba");
            fail("should throw");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("lba"));
        }
    }
}
