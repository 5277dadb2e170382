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

import static lwg.TestUtils.gotoProgram;
import static lwg.TestUtils.loop;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class FreshNamesTest {

    @Test
    public void testSkipsUsedNames() {
        FreshNames names = new FreshNames(Arrays.asList("x0", "x2", "M1"));
        assertEquals("x1", names.freshVariable());
        assertEquals("x3", names.freshVariable());
        assertEquals("x4", names.freshVariable());
        assertEquals("M2", names.freshLabel());
        assertEquals("M3", names.freshLabel());
    }

    @Test
    public void testNeverRepeats() {
        FreshNames names = new FreshNames(Collections.emptySet());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            assertTrue(seen.add(names.freshVariable()));
            assertTrue(seen.add(names.freshLabel()));
        }
        assertTrue(names.isUsed("x99"));
        assertFalse(names.isUsed("x100"));
    }

    @Test
    public void testScansNestedBodies() {
        Set<String> used = FreshNames.namesOf(loop("LOOP x5 DO LOOP x7 DO x0 := x9 + 1; END END"));
        assertEquals(new HashSet<>(Arrays.asList("x5", "x7", "x0", "x9")), used);
    }

    @Test
    public void testLabelsAndVariablesShareOneNamespace() {
        FreshNames names = FreshNames.forProgram(gotoProgram("x0: GOTO M1; M1: HALT;"), Collections.emptySet());
        assertEquals("x1", names.freshVariable());
        assertEquals("M2", names.freshLabel());
    }

    @Test
    public void testReservedNames() {
        FreshNames names = FreshNames.forProgram(loop("x0 := 1;"), Arrays.asList("x1", "x2"));
        assertEquals("x3", names.freshVariable());
    }

    /** The allocator keeps its own copy of the used names. */
    @Test
    public void testDoesNotModifyInput() {
        Set<String> used = new HashSet<>(Arrays.asList("x0"));
        FreshNames names = new FreshNames(used);
        names.freshVariable();
        assertEquals(Collections.singleton("x0"), used);
    }
}
