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
package lwg.tasks;

import static lwg.TestUtils.big;
import static lwg.TestUtils.vars;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;

import org.junit.jupiter.api.Test;

import lwg.TestUtils;
import lwg.core.SourceFile;
import lwg.lang.GotoProgram;
import lwg.lang.Language;
import lwg.lang.WhileProgram;

public class TranslationTaskTest {

    private static final SourceFile MULTIPLY = new SourceFile("multiply.loop", Language.LOOP,
            "x0 := 5; x1 := 10; x2 := 0; LOOP x0 DO LOOP x1 DO x2 := x2 + 1; END END");

    private static final SourceFile COUNTDOWN = new SourceFile("countdown.goto", Language.GOTO,
            "x0 := 5; x1 := 0; M1: IF x0 = 0 THEN GOTO M2; x1 := x1 + x0; x0 := x0 - 1; GOTO M1; M2: HALT;");

    @Test
    public void testTranslateOnly() {
        TranslationTask.Result r = new TranslationTask(MULTIPLY, Language.GOTO).execute();
        assertTrue(r.getProgram() instanceof GotoProgram);
        assertFalse(r.isVerified());
        assertFalse(r.passed());
        assertNull(r.getSourceResult());
        assertTrue(r.getText().endsWith("HALT;\n"), r.getText());
    }

    @Test
    public void testVerifyLoopToGoto() {
        TranslationTask.Result r = new TranslationTask(MULTIPLY, Language.GOTO)
                .setVerification(true)
                .setInitialVariables(vars("x0", 3))
                .execute();
        assertTrue(r.isVerified());
        assertTrue(r.passed());
        assertEquals(big(30), r.getSourceResult().get("x2"));
        assertEquals(big(30), r.getTargetResult().get("x2"));
    }

    /** The GOTO to WHILE program counter is left over, but is not an observable difference. */
    @Test
    public void testVerifyGotoToWhile() {
        TranslationTask.Result r = new TranslationTask(COUNTDOWN, Language.WHILE).setVerification(true).execute();
        assertTrue(r.getProgram() instanceof WhileProgram);
        assertTrue(r.passed());
        assertNull(r.getSourceResult().get("x2"));
        assertEquals(big(7), r.getTargetResult().get("x2"));
    }

    @Test
    public void testVerboseLogsBothRuns() {
        TestUtils.RecordingLogger log = new TestUtils.RecordingLogger();
        new TranslationTask(COUNTDOWN, Language.WHILE).setVerification(true).setLogger(log).execute();
        assertTrue(log.messages.contains("\n[Running GOTO]"));
        assertTrue(log.messages.contains("\n[Running WHILE]"));
    }

    @Test
    public void testUnsupportedTarget() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new TranslationTask(COUNTDOWN, Language.LOOP).execute());
        assertEquals("Cannot translate from GOTO to LOOP", e.getMessage());
    }

    @Test
    public void testSameResults() {
        Map<String, BigInteger> a = vars("x0", 1, "x1", 0);
        Map<String, BigInteger> b = vars("x0", 1, "x9", 4);
        assertTrue(TranslationTask.sameResults(a, b, new HashSet<>(Arrays.asList("x0", "x1"))));
        assertFalse(TranslationTask.sameResults(a, b, new HashSet<>(Arrays.asList("x0", "x9"))));
    }

    @Test
    public void testObservableNames() {
        assertEquals(new HashSet<>(Arrays.asList("x0", "x1", "x2", "x7")),
                TranslationTask.observableNames(MULTIPLY.parse(), vars("x7", 1)));
    }
}
