// Copyright 2026 The LWG Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package lwg.translate;

import static lwg.TestUtils.big;
import static lwg.TestUtils.loop;
import static lwg.TestUtils.vars;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import lwg.interpreter.LoopInterpreter;
import lwg.interpreter.WhileInterpreter;
import lwg.io.ProgramPrinter;
import lwg.lang.Assign;
import lwg.lang.LoopProgram;
import lwg.lang.WhileProgram;

public class Loop2WhileTest {

    private static final String MULTIPLY = "x0 := 5; x1 := 10; x2 := 0; LOOP x0 DO LOOP x1 DO x2 := x2 + 1; END END";

    @Test
    public void testNestedLoops() {
        WhileProgram w = new Loop2While().translate(loop(MULTIPLY));
        assertEquals(
                "x0 := 5;\n" +
                "x1 := 10;\n" +
                "x2 := 0;\n" +
                "x4 := x0;\n" +
                "WHILE x4 != 0 DO\n" +
                "  x3 := x1;\n" +
                "  WHILE x3 != 0 DO\n" +
                "    x2 := x2 + 1;\n" +
                "    x3 := x3 - 1;\n" +
                "  END\n" +
                "  x4 := x4 - 1;\n" +
                "END\n",
                ProgramPrinter.toText(w));
    }

    @Test
    public void testAssignmentsOnly() {
        LoopProgram p = loop("x0 := 1; x1 := x0 + 2;");
        WhileProgram w = new Loop2While().translate(p);
        assertEquals(2, w.getStatements().size());
        assertEquals(p.getStatements(), w.getStatements());
        // fresh nodes, not shared ones
        assertNotSame(p.getStatements().get(0), w.getStatements().get(0));
    }

    @Test
    public void testEmptyProgram() {
        assertTrue(new Loop2While().translate(loop("")).getStatements().isEmpty());
    }

    /** The count is copied before the body runs, so changing the control variable has no effect. */
    @Test
    public void testBodyChangesControlVariable() {
        LoopProgram p = loop("x0 := 3; x1 := 0; LOOP x0 DO x0 := 0; x1 := x1 + 1; END");
        Map<String, BigInteger> r = new WhileInterpreter().evaluate(new Loop2While().translate(p));
        assertEquals(big(3), r.get("x1"));
    }

    @Test
    public void testReservedNamesAvoided() {
        WhileProgram w = new Loop2While(Arrays.asList("x1")).translate(loop("LOOP x0 DO x2 := x2 + 1; END"));
        assertEquals("x3", ((Assign) w.getStatements().get(0)).getVariable());
    }

    @Test
    public void testCountersAreFresh() {
        LoopProgram p = loop(MULTIPLY);
        Set<String> before = FreshNames.namesOf(p);
        WhileProgram w = new Loop2While().translate(p);
        Set<String> after = FreshNames.namesOf(w);
        after.removeAll(before);
        assertEquals(2, after.size());
        for (String name : after) {
            assertFalse(before.contains(name));
        }
    }

    @Test
    public void testSameResults() {
        LoopProgram p = loop(MULTIPLY);
        WhileProgram w = new Loop2While(Arrays.asList("x0", "x1")).translate(p);
        Map<String, BigInteger> init = vars("x0", 3, "x1", 7);
        Map<String, BigInteger> expected = new LoopInterpreter().evaluate(p, init);
        Map<String, BigInteger> actual = new WhileInterpreter().evaluate(w, init);
        for (String name : expected.keySet()) {
            assertEquals(expected.get(name), actual.get(name), name);
        }
        assertEquals(big(21), actual.get("x2"));
    }

    @Test
    public void testInputUnchanged() {
        LoopProgram p = loop(MULTIPLY);
        String text = ProgramPrinter.toText(p);
        new Loop2While().translate(p);
        assertEquals(text, ProgramPrinter.toText(p));
        assertEquals(loop(MULTIPLY), p);
    }
}
