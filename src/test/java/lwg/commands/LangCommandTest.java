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
package lwg.commands;

import static lwg.TestUtils.vars;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import lwg.lang.Language;

public class LangCommandTest {

    @TempDir
    Path tmp;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private LangCommand command;

    @BeforeEach
    public void setUp() {
        this.out = new ByteArrayOutputStream();
        this.err = new ByteArrayOutputStream();
        this.command = new LangCommand(this.out, this.err);
    }

    private String out() {
        return new String(this.out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(this.err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testNoArguments() {
        assertEquals(1, this.command.execute());
        assertTrue(out().startsWith("LOOP/WHILE/GOTO Interpreter & Translator"));
    }

    @Test
    public void testHelp() {
        assertEquals(0, this.command.execute("-help"));
        assertTrue(out().contains("Usage: lang <file> [options]"));
        assertEquals(0, new LangCommand(new ByteArrayOutputStream(), this.err).execute("multiply.loop", "--help"));
    }

    @Test
    public void testRun() {
        assertEquals(0, this.command.execute("examples/multiply.loop"));
        String text = out();
        assertTrue(text.startsWith("[LOOP] multiply.loop\n"), text);
        assertTrue(text.contains("\nResult:\n  x0 = 5\n  x1 = 10\n  x2 = 50\n"), text);
        assertEquals("", err());
    }

    @Test
    public void testRunFromExamplesFolder() {
        assertEquals(0, this.command.execute("divide.while"));
        assertTrue(out().contains("  x2 = 3\n"), out());
    }

    @Test
    public void testInitialVariables() {
        assertEquals(0, this.command.execute("multiply.loop", "-x0=2", "-x1=3"));
        String text = out();
        assertTrue(text.contains("Initial: x0=2, x1=3\n"), text);
        assertTrue(text.contains("  x2 = 6\n"), text);
    }

    @Test
    public void testTranslateAndVerify() {
        assertEquals(0, this.command.execute("multiply.loop", "-t2goto", "-verify"));
        String text = out();
        assertTrue(text.contains("\n[Translated to GOTO]\n"), text);
        assertTrue(text.contains("\nLOOP result:\n"), text);
        assertTrue(text.contains("\nGOTO result:\n"), text);
        assertTrue(text.endsWith("\nVerification: PASSED\n"), text);
    }

    @Test
    public void testTranslateWithoutVerify() {
        assertEquals(0, this.command.execute("countdown.goto", "-t2w"));
        String text = out();
        assertTrue(text.contains("[Translated to WHILE]\nx2 := 0;\nWHILE x2 != 7 DO\n"), text);
        assertFalse(text.contains("Verification"));
    }

    @Test
    public void testAlreadyInLanguage() {
        assertEquals(1, this.command.execute("divide.while", "-t2while"));
        assertEquals("Already in WHILE.\n", err());
    }

    @Test
    public void testLastTargetOptionWins() {
        assertEquals(0, this.command.execute("multiply.loop", "-t2goto", "-t2w"));
        assertTrue(out().contains("\n[Translated to WHILE]\n"), out());
        ByteArrayOutputStream errors = new ByteArrayOutputStream();
        assertEquals(1, new LangCommand(new ByteArrayOutputStream(), errors).execute("countdown.goto", "-t2w", "-t2g"));
        assertEquals("Already in GOTO.\n", new String(errors.toByteArray(), StandardCharsets.UTF_8));
    }

    @Test
    public void testUnknownExtension() {
        assertEquals(1, this.command.execute("program.txt"));
        assertTrue(err().startsWith("Cannot detect language."), err());
    }

    @Test
    public void testNoFile() {
        assertEquals(1, this.command.execute("-verbose"));
        assertEquals("No file specified.\n", err());
    }

    @Test
    public void testMissingFile() {
        assertEquals(1, this.command.execute("no-such-program.loop"));
        assertTrue(err().startsWith("Error: cannot read no-such-program.loop"), err());
    }

    @Test
    public void testSyntaxError() throws IOException {
        Path file = this.tmp.resolve("bad.loop");
        Files.write(file, "LOOP x0 DO".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, this.command.execute(file.toString()));
        assertTrue(err().startsWith("Error: Expected END but found end of input"), err());
    }

    @Test
    public void testSafetyLimitReported() throws IOException {
        Path file = this.tmp.resolve("forever.while");
        Files.write(file, "x0 := 1; WHILE x0 > 0 DO x1 := x1 + 1; END".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, this.command.execute(file.toString()));
        assertTrue(err().startsWith("Error: possible infinite loop (safety limit: 1,000,000 iterations)"), err());
    }

    @Test
    public void testVerbose() {
        assertEquals(0, this.command.execute("ifelse.while", "-verbose"));
        String text = out();
        assertTrue(text.contains("\nExecution:\n"), text);
        assertTrue(text.contains("  IF x0 > 5 -> true\n"), text);
    }

    @Test
    public void testSortedNames() {
        assertEquals(Arrays.asList("x1", "x2", "x10"),
                LangCommand.sortedNames(vars("x10", 0, "x2", 0, "x1", 0)));
        assertEquals(Arrays.asList("pc", "x1"), LangCommand.sortedNames(vars("pc", 0, "x1", 0)));
    }

    @Test
    public void testOptions() {
        LangCommand.Options opts = LangCommand.Options.parse("a.loop", "-x0=5", "-t2g", "-verify", "-ignored", "b.loop");
        assertEquals("a.loop", opts.file);
        assertEquals(vars("x0", 5), opts.variables);
        assertTrue(opts.verify);
        assertFalse(opts.verbose);
        assertEquals(Language.GOTO, opts.translateTo);
        assertEquals(Arrays.asList("-ignored"), opts.unrecognised);
    }

    @Test
    public void testMalformedVariableReported() {
        assertEquals(0, this.command.execute("multiply.loop", "-x0=5,", "-x1=3"));
        assertEquals("Ignoring unrecognised option: -x0=5,\n", err());
        String text = out();
        assertTrue(text.contains("Initial: x1=3\n"), text);
        assertTrue(text.contains("  x2 = 15\n"), text);
    }
}
