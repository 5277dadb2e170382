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

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lwg.core.SourceFile;
import lwg.lang.Language;
import lwg.lang.Program;
import lwg.lang.ProgramError;
import lwg.tasks.TranslationTask;
import lwg.util.Logger;

/**
 * The <code>lang</code> command: runs a LOOP, WHILE or GOTO program, or
 * translates it into another language and optionally verifies the translation.
 *
 * <pre>
 *   lang multiply.loop -x0=5 -x1=10
 *   lang divide.while -t2goto -verify
 * </pre>
 *
 * @author The LWG Project Developers
 */
public class LangCommand {
	private static final Pattern VARIABLE_OPTION = Pattern.compile("-([a-zA-Z0-9_]+)=(\\d+)");
	private static final Pattern DIGITS = Pattern.compile("\\d+");

	/**
	 * Where normal output is directed.
	 */
	private final PrintStream sysout;

	/**
	 * Where error output is directed.
	 */
	private final PrintStream syserr;

	public LangCommand(OutputStream sysout, OutputStream syserr) {
		this.sysout = sysout instanceof PrintStream ? (PrintStream) sysout : new PrintStream(sysout, true);
		this.syserr = syserr instanceof PrintStream ? (PrintStream) syserr : new PrintStream(syserr, true);
	}

	public static void main(String[] args) {
		System.exit(new LangCommand(System.out, System.err).execute(args));
	}

	/**
	 * The parsed command line.
	 */
	static final class Options {
		String file;
		final Map<String, BigInteger> variables = new LinkedHashMap<>();
		boolean verbose;
		boolean verify;
		Language translateTo;
		/**
		 * Options starting with "-" that were not understood, in command-line order.
		 */
		final List<String> unrecognised = new ArrayList<>();

		static Options parse(String... args) {
			final Options opts = new Options();
			for (String arg : args) {
				if (arg.equals("-verbose")) {
					opts.verbose = true;
				} else if (arg.equals("-verify")) {
					opts.verify = true;
				} else if (arg.equals("-t2while") || arg.equals("-t2w")) {
					opts.translateTo = Language.WHILE;
				} else if (arg.equals("-t2goto") || arg.equals("-t2g")) {
					opts.translateTo = Language.GOTO;
				} else if (arg.startsWith("-")) {
					final Matcher m = VARIABLE_OPTION.matcher(arg);
					if (m.matches()) {
						opts.variables.put(m.group(1), new BigInteger(m.group(2)));
					} else {
						opts.unrecognised.add(arg);
					}
				} else if (opts.file == null) {
					opts.file = arg;
				}
			}
			return opts;
		}
	}

	/**
	 * Run the command.
	 *
	 * @param args command-line arguments.
	 * @return the exit status: 0 on success, 1 on any error.
	 */
	public int execute(String... args) {
		if (args.length < 1 || contains(args, "-help") || contains(args, "-h") || contains(args, "--help")) {
			printHelp();
			return args.length < 1 ? 1 : 0;
		}
		final Options opts = Options.parse(args);
		for (String arg : opts.unrecognised) {
			this.syserr.println("Ignoring unrecognised option: " + arg);
		}
		if (opts.file == null) {
			this.syserr.println("No file specified.");
			return 1;
		}
		final Path path = SourceFile.resolve(opts.file);
		final Language lang = Language.fromFileName(path.getFileName().toString());
		if (lang == null) {
			this.syserr.println("Cannot detect language. Use .loop, .while, or .goto extension.");
			return 1;
		}
		final Logger logger = opts.verbose ? new Logger.Default(this.sysout) : Logger.NULL;
		try {
			final SourceFile source = SourceFile.read(path);
			this.sysout.printf("[%s] %s\n", lang, source.getName());
			if (!opts.variables.isEmpty()) {
				this.sysout.println("Initial: " + formatVariables(opts.variables));
			}
			this.sysout.println();
			this.sysout.println(source.getContents().trim());

			if (opts.translateTo != null) {
				if (opts.translateTo == lang) {
					this.syserr.println("Already in " + lang + ".");
					return 1;
				}
				final TranslationTask.Result r = new TranslationTask(source, opts.translateTo)
						.setVerification(opts.verify)
						.setInitialVariables(opts.variables)
						.setLogger(logger)
						.execute();
				this.sysout.println();
				this.sysout.println("[Translated to " + opts.translateTo + "]");
				this.sysout.print(r.getText());
				if (r.isVerified()) {
					printResult(r.getSourceResult(), lang + " result");
					printResult(r.getTargetResult(), opts.translateTo + " result");
					this.sysout.println();
					this.sysout.println("Verification: " + (r.passed() ? "PASSED" : "FAILED"));
				}
				return 0;
			}

			final Program program = source.parse();
			if (opts.verbose) {
				this.sysout.println();
				this.sysout.println("Execution:");
			}
			printResult(TranslationTask.evaluate(program, opts.variables, logger), null);
			return 0;
		} catch (ProgramError | IllegalArgumentException e) {
			this.syserr.println("Error: " + e.getMessage());
			return 1;
		} catch (IOException e) {
			this.syserr.println("Error: cannot read " + path + ": " + e.getMessage());
			if (opts.verbose) {
				e.printStackTrace(this.syserr);
			}
			return 1;
		}
	}

	/**
	 * Print final variables, one per line, ordered by the number in their name.
	 *
	 * @param label a heading, or null for "Result".
	 */
	protected void printResult(Map<String, BigInteger> result, String label) {
		this.sysout.println();
		this.sysout.println(label == null ? "Result:" : label + ":");
		for (String name : sortedNames(result)) {
			this.sysout.printf("  %s = %s\n", name, result.get(name));
		}
	}

	/**
	 * Sort variable names by their numeric part, so x2 comes before x10. Names
	 * without digits sort as zero; ties keep their original order.
	 */
	static List<String> sortedNames(Map<String, BigInteger> result) {
		final List<String> names = new ArrayList<>(result.keySet());
		names.sort(Comparator.comparing(LangCommand::numericPart));
		return names;
	}

	private static BigInteger numericPart(String name) {
		final StringBuilder digits = new StringBuilder();
		final Matcher m = DIGITS.matcher(name);
		while (m.find()) {
			digits.append(m.group());
		}
		return digits.length() == 0 ? BigInteger.ZERO : new BigInteger(digits.toString());
	}

	private static String formatVariables(Map<String, BigInteger> vars) {
		final StringBuilder sb = new StringBuilder();
		for (Map.Entry<String, BigInteger> e : vars.entrySet()) {
			if (sb.length() > 0) {
				sb.append(", ");
			}
			sb.append(e.getKey()).append('=').append(e.getValue());
		}
		return sb.toString();
	}

	private static boolean contains(String[] args, String option) {
		for (String arg : args) {
			if (arg.equals(option)) {
				return true;
			}
		}
		return false;
	}

	private void printHelp() {
		this.sysout.println("LOOP/WHILE/GOTO Interpreter & Translator");
		this.sysout.println();
		this.sysout.println("Usage: lang <file> [options]");
		this.sysout.println();
		this.sysout.println("Files are looked for as given, then in the " + SourceFile.EXAMPLES_DIR + "/ folder.");
		this.sysout.println();
		this.sysout.println("Options:");
		this.sysout.println("  -x0=5 -x1=10     Set initial variables (override program values)");
		this.sysout.println("  -t2while, -t2w   Translate to WHILE");
		this.sysout.println("  -t2goto, -t2g    Translate to GOTO");
		this.sysout.println("  -verify          Run original and translated, compare results");
		this.sysout.println("  -verbose         Show step-by-step execution");
		this.sysout.println("  -help            Show this help");
		this.sysout.println();
		this.sysout.println("Examples:");
		this.sysout.println("  lang multiply.loop                  Run with initial values");
		this.sysout.println("  lang multiply.loop -x0=5 -x1=10     Run with overridden values");
		this.sysout.println("  lang divide.while -t2goto           Translate WHILE to GOTO");
		this.sysout.println("  lang countdown.goto -t2while        Translate GOTO to WHILE");
		this.sysout.println("  lang multiply.loop -t2goto -verify  Translate to GOTO and verify results");
	}
}
