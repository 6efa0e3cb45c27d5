/* @LICENSE@  
 */

package org.xtrms.automata;

import static org.xtrms.automata.AutomatonAssert.*;

public class TMTestCase extends AbstractAutomatonTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(TMTestCase.class);
    }

    public TMTestCase(String name) {
        super(name);
    }

    /*
     * flips the leading run of 1s to 0s and writes a 1 after it
     */
    private static final String INCREMENT = lines(
        "[states] q0, qf",
        "[alphabet] 0, 1",
        "[tape_alphabet] 0, 1, B",
        "[blank_symbol] B",
        "[initial] q0",
        "[final] qf",
        "[transitions]",
        "q0(1) => q0(WRITE:0, RIGHT)",
        "q0(0) => qf(WRITE:1, LEFT)",
        "q0(B) => qf(WRITE:1, LEFT)");

    private static TM tm(String text) {
        Source source = new Source(text);
        return new TM(describe(source), source);
    }

    public void testTable() {
        TM tm = tm(INCREMENT);
        assertEquals("B", tm.blankSymbol());
        assertEquals(3, tm.tapeAlphabet().size());
        assertEquals(2, tm.alphabet().size());

        TM.Move move = tm.move("q0", "1");
        assertEquals("q0", move.state);
        assertEquals("0", move.write);
        assertEquals(TM.Direction.RIGHT, move.direction);
        assertNull(tm.move("qf", "1"));
    }

    public void testRun() {
        TMMachine m = new TMMachine(tm(INCREMENT));
        assertTrue(m.run("1"));
        assertEquals("qf", m.state());
        Tape tape = m.tape();
        assertEquals("0", tape.get(0));
        assertEquals("1", tape.get(1));
        assertEquals(0, tape.position());

        m = new TMMachine(tm(INCREMENT));
        assertTrue(m.run("110"));
        assertEquals("0", m.tape().get(0));
        assertEquals("0", m.tape().get(1));
        assertEquals("1", m.tape().get(2));

        assertAccepts(MachineKind.TM, INCREMENT, "", "0", "111");
    }

    public void testHaltReject() {
        String text = INCREMENT.replace("q0(B) => qf(WRITE:1, LEFT)\n", "");
        assertRejects(MachineKind.TM, text, "", "1", "11");
        assertAccepts(MachineKind.TM, text, "10");
    }

    public void testStartStateFinal() {
        String text = INCREMENT.replace("[final] qf", "[final] q0, qf")
            .replace("q0(B) => qf(WRITE:1, LEFT)\n", "");
        // acceptance is only checked after a move
        assertRejects(MachineKind.TM, text, "");
        assertAccepts(MachineKind.TM, text, "1");
    }

    public void testLeftAtOrigin() {
        String text = lines(
            "[states] q0, q1, qf",
            "[alphabet] 0, 1",
            "[tape_alphabet] 0, 1, B",
            "[blank_symbol] B",
            "[initial] q0",
            "[final] qf",
            "[transitions]",
            "q0(B) => q1(WRITE:1, LEFT)",
            "q1(B) => qf(WRITE:0, RIGHT)");
        TMMachine m = new TMMachine(tm(text));
        assertTrue(m.run(""));
        assertEquals("0", m.tape().get(0));
        assertEquals("1", m.tape().get(1));
        assertEquals(1, m.tape().position());
    }

    public void testInputOutsideAlphabet() {
        String text = INCREMENT.replace("[tape_alphabet] 0, 1, B",
            "[tape_alphabet] 0, 1, x, B") + "q0(x) => qf(WRITE:x, RIGHT)\n";
        // written to the tape anyway
        assertAccepts(MachineKind.TM, text, "x");
    }

    public void testDuplicateReplaces() {
        String text = INCREMENT + "q0(1) => qf(WRITE:1, RIGHT)\n";
        TM tm = tm(text);
        assertEquals("qf", tm.move("q0", "1").state);
        assertEquals("1", tm.move("q0", "1").write);
        TMMachine m = new TMMachine(tm);
        assertTrue(m.run("11"));
        assertEquals("1", m.tape().get(0));
        assertEquals("1", m.tape().get(1));
    }

    public void testMissingSection() {
        TmException e = assertFails(TmException.class,
            TmException.Kind.MISSING_SECTION, MachineKind.TM,
            INCREMENT.replace("[tape_alphabet] 0, 1, B\n", ""));
        assertEquals("expected to find [tape_alphabet]", e.help());

        e = assertFails(TmException.class,
            TmException.Kind.MISSING_SECTION, MachineKind.TM,
            INCREMENT.replace("[blank_symbol] B\n", ""));
        assertEquals("expected to find [blank_symbol]", e.help());
    }

    public void testMissingTapeOperation() {
        String text = INCREMENT.replace("q0(1) => q0(WRITE:0, RIGHT)", "q0(1) => q0(RIGHT)");
        TmException e = assertFails(TmException.class,
            TmException.Kind.MISSING_TAPE_OPERATION, MachineKind.TM, text);
        assertLabel(text, e, 0, "q0", text.indexOf("=> q0"));

        text = INCREMENT.replace("q0(1) => q0(WRITE:0, RIGHT)", "q0(1) => q0(POP, RIGHT)");
        e = assertFails(TmException.class,
            TmException.Kind.MISSING_TAPE_OPERATION, MachineKind.TM, text);
        assertLabel(text, e, 0, "POP");

        text = INCREMENT.replace("q0(1) => q0(WRITE:0, RIGHT)", "q0(1) => q0(WRITE:0)");
        e = assertFails(TmException.class,
            TmException.Kind.MISSING_TAPE_OPERATION, MachineKind.TM, text);
        assertEquals("expected to find LEFT or RIGHT", e.help());
    }

    public void testUnknownReferences() {
        String text = INCREMENT.replace("q0(0) => qf", "q0(0) => qx");
        TmException e = assertFails(TmException.class,
            TmException.Kind.UNKNOWN_STATE, MachineKind.TM, text);
        assertLabel(text, e, 0, "qx");

        assertFails(TmException.class, TmException.Kind.UNKNOWN_STATE,
            MachineKind.TM, INCREMENT.replace("[initial] q0", "[initial] qx"));

        text = INCREMENT.replace("q0(0) => qf(WRITE:1", "q0(2) => qf(WRITE:1");
        e = assertFails(TmException.class,
            TmException.Kind.UNKNOWN_TAPE_SYMBOL, MachineKind.TM, text);
        assertLabel(text, e, 0, "2");

        text = INCREMENT.replace("WRITE:0", "WRITE:2");
        e = assertFails(TmException.class,
            TmException.Kind.UNKNOWN_TAPE_SYMBOL, MachineKind.TM, text);
        assertLabel(text, e, 0, "2");
    }

    public void testStackOperations() {
        assertFails(TmException.class,
            TmException.Kind.STACK_OPERATIONS_NOT_ALLOWED, MachineKind.TM,
            INCREMENT + "[stack_alphabet] Z");
        String text = INCREMENT.replace("q0(1) =>", "q0(1, Z) =>");
        TmException e = assertFails(TmException.class,
            TmException.Kind.STACK_OPERATIONS_NOT_ALLOWED, MachineKind.TM, text);
        assertLabel(text, e, 0, "Z");
    }
}
