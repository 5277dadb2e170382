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
package lwg.lang;

import static lwg.TestUtils.gotoProgram;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

public class GotoProgramTest {

    @Test
    public void testLabelMap() {
        GotoProgram p = gotoProgram("x0 := 1; M1: x0 := x0 + 1; M2: HALT;");
        Map<String, Integer> labels = p.getLabelMap();
        assertEquals(2, labels.size());
        assertEquals(1, labels.get("M1"));
        assertEquals(2, labels.get("M2"));
        assertEquals(3, p.size());
    }

    @Test
    public void testDuplicateLabel() {
        GotoProgram p = gotoProgram("M1: x0 := 1; M1: HALT;");
        StructureError e = assertThrows(StructureError.class, p::getLabelMap);
        assertTrue(e.getMessage().startsWith("Duplicate label: M1"));
    }

    @Test
    public void testResolve() {
        GotoProgram p = gotoProgram("M1: x0 := 1; GOTO M1; GOTO M9;");
        Map<String, Integer> labels = p.getLabelMap();
        assertEquals(0, GotoProgram.resolve(labels, (GotoProgram.Jump) p.getInstructions().get(1).getStatement()));
        GotoProgram.Jump bad = (GotoProgram.Jump) p.getInstructions().get(2).getStatement();
        StructureError e = assertThrows(StructureError.class, () -> GotoProgram.resolve(labels, bad));
        assertTrue(e.getMessage().startsWith("Undefined label: M9"));
        assertSame(bad, e.getLocation());
    }

    @Test
    public void testInstructionToString() {
        GotoProgram p = gotoProgram("M1: IF x0 = 0 THEN GOTO M2; x0 := x0 - 1; M2: HALT;");
        assertEquals("M1: IF x0 = 0 THEN GOTO M2", p.getInstructions().get(0).toString());
        assertEquals("x0 := x0 - 1", p.getInstructions().get(1).toString());
        assertFalse(p.getInstructions().get(1).hasLabel());
        assertNull(p.getInstructions().get(1).getLabel());
    }

    @Test
    public void testLanguageOfFile() {
        assertEquals(Language.GOTO, Language.fromFileName("examples/countdown.goto"));
        assertEquals(Language.LOOP, Language.fromFileName("a.LOOP"));
        assertNull(Language.fromFileName("notes.txt"));
        assertNull(Language.fromFileName("Makefile"));
    }
}
