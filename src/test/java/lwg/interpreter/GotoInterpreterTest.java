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
package lwg.interpreter;

import static lwg.TestUtils.big;
import static lwg.TestUtils.gotoProgram;
import static lwg.TestUtils.vars;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.junit.jupiter.api.Test;

import lwg.TestUtils;
import lwg.util.Logger;
import lwg.lang.GotoProgram;
import lwg.lang.StructureError;

public class GotoInterpreterTest {

    private static final String COUNTDOWN =
            "x0 := 5; x1 := 0; M1: IF x0 = 0 THEN GOTO M2; x1 := x1 + x0; x0 := x0 - 1; GOTO M1; M2: HALT;";

    @Test
    public void testCountdown() {
        Map<String, BigInteger> r = new GotoInterpreter().evaluate(gotoProgram(COUNTDOWN));
        assertEquals(big(15), r.get("x1"));
        assertEquals(BigInteger.ZERO, r.get("x0"));
    }

    @Test
    public void testForwardJump() {
        Map<String, BigInteger> r = new GotoInterpreter().evaluate(gotoProgram("x0 := 1; GOTO M1; x0 := 100; M1: x1 := x0 + 1;"));
        assertEquals(big(1), r.get("x0"));
        assertEquals(big(2), r.get("x1"));
    }

    @Test
    public void testHaltIsImmediate() {
        Map<String, BigInteger> r = new GotoInterpreter().evaluate(gotoProgram("x0 := 1; HALT; x0 := 2;"));
        assertEquals(big(1), r.get("x0"));
    }

    @Test
    public void testEmptyProgram() {
        GotoProgram p = new GotoProgram(Collections.emptyList());
        assertTrue(new GotoInterpreter().evaluate(p).isEmpty());
        assertEquals(vars("x0", 3), new GotoInterpreter().evaluate(p, vars("x0", 3)));
    }

    @Test
    public void testInitialVariableLocked() {
        Map<String, BigInteger> r = new GotoInterpreter().evaluate(gotoProgram(COUNTDOWN), vars("x0", 3));
        assertEquals(big(6), r.get("x1"));
    }

    @Test
    public void testUndefinedLabel() {
        StructureError e = assertThrows(StructureError.class,
                () -> new GotoInterpreter().evaluate(gotoProgram("x0 := 1; GOTO M9;")));
        assertTrue(e.getMessage().startsWith("Undefined label: M9"));
    }

    /** Jumps are resolved when taken, so an unreachable bad jump is harmless. */
    @Test
    public void testUnreachableUndefinedLabel() {
        Map<String, BigInteger> r = new GotoInterpreter().evaluate(gotoProgram("x0 := 1; HALT; GOTO M9;"));
        assertEquals(big(1), r.get("x0"));
    }

    @Test
    public void testDuplicateLabel() {
        StructureError e = assertThrows(StructureError.class,
                () -> new GotoInterpreter().evaluate(gotoProgram("M1: x0 := 1; M1: HALT;")));
        assertTrue(e.getMessage().startsWith("Duplicate label: M1"));
    }

    @Test
    public void testSafetyLimit() {
        GotoInterpreter interpreter = new GotoInterpreter();
        interpreter.setSafetyLimit(10);
        SafetyLimitExceeded e = assertThrows(SafetyLimitExceeded.class,
                () -> interpreter.evaluate(gotoProgram("M1: GOTO M1;")));
        assertTrue(e.getMessage().startsWith("possible infinite loop (safety limit: 10 steps)"));
        // exactly ten steps is fine
        Map<String, BigInteger> r = interpreter.evaluate(gotoProgram(
                "x0 := 1; x0 := 2; x0 := 3; x0 := 4; x0 := 5; x0 := 6; x0 := 7; x0 := 8; x0 := 9; x0 := 10;"));
        assertEquals(big(10), r.get("x0"));
    }

    @Test
    public void testVerboseTrace() {
        TestUtils.RecordingLogger log = new TestUtils.RecordingLogger();
        GotoInterpreter interpreter = new GotoInterpreter();
        interpreter.setLogger(log);
        Map<String, BigInteger> r = interpreter.evaluate(gotoProgram(COUNTDOWN), vars("x0", 1));
        assertEquals(new GotoInterpreter().evaluate(gotoProgram(COUNTDOWN), vars("x0", 1)), r);
        assertTrue(log.messages.contains("  [0] x0 := 5"));
        assertTrue(log.messages.contains("       -> skipped (using initial value)"));
        assertTrue(log.messages.contains("       -> x1 = 0"));
        assertTrue(log.messages.contains("       -> true, jump to M2 (pc=6)"));
        assertTrue(log.messages.contains("       -> HALT"));
    }

    /** Tracing must not change the result, with or without initial variables. */
    @Test
    public void testVerboseDoesNotChangeResult() {
        String text = "x0 := 5; x1 := 0; M1: IF x0 = 0 THEN GOTO M2; x1 := x1 + x0; x0 := x0 - 1; GOTO M1; M2: HALT; x1 := 0;";
        for (Map<String, BigInteger> init : Arrays.asList(vars(), vars("x0", 9), vars("x0", 3, "x1", 2))) {
            GotoInterpreter quiet = new GotoInterpreter();
            quiet.setLogger(Logger.NULL);
            TestUtils.RecordingLogger log = new TestUtils.RecordingLogger();
            GotoInterpreter traced = new GotoInterpreter();
            traced.setLogger(log);
            Map<String, BigInteger> expected = quiet.evaluate(gotoProgram(text), init);
            assertEquals(expected, traced.evaluate(gotoProgram(text), init), "initial " + init);
            assertFalse(log.messages.isEmpty());
        }
    }
}
