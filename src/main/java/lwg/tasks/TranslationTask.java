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

import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lwg.core.SourceFile;
import lwg.interpreter.GotoInterpreter;
import lwg.interpreter.LoopInterpreter;
import lwg.interpreter.WhileInterpreter;
import lwg.io.ProgramPrinter;
import lwg.lang.GotoProgram;
import lwg.lang.Language;
import lwg.lang.LoopProgram;
import lwg.lang.Program;
import lwg.lang.WhileProgram;
import lwg.translate.FreshNames;
import lwg.translate.Goto2While;
import lwg.translate.Loop2While;
import lwg.translate.While2Goto;
import lwg.util.Logger;

/**
 * Translates one source file into another language and, if verification is
 * enabled, checks the translation by running both programs on the same
 * initial variables and comparing their final variables.
 *
 * @author The LWG Project Developers
 */
public class TranslationTask {
	private final SourceFile source;
	private final Language target;

	/**
	 * Specify whether to run both programs and compare their results.
	 */
	private boolean verification;

	/**
	 * Initial variables for verification runs. Their names are also kept out of
	 * the fresh names a translation introduces.
	 */
	private Map<String, BigInteger> initialVariables = Collections.emptyMap();

	/**
	 * Receives the evaluation trace of verification runs.
	 */
	private Logger logger = Logger.NULL;

	public TranslationTask(SourceFile source, Language target) {
		this.source = source;
		this.target = target;
	}

	public TranslationTask setVerification(boolean flag) {
		this.verification = flag;
		return this;
	}

	public TranslationTask setInitialVariables(Map<String, BigInteger> vars) {
		this.initialVariables = new LinkedHashMap<>(vars);
		return this;
	}

	public TranslationTask setLogger(Logger logger) {
		this.logger = logger;
		return this;
	}

	/**
	 * Parse, translate and render the source file, then verify if asked to.
	 *
	 * @throws IllegalArgumentException if there is no translation to the target language.
	 */
	public Result execute() {
		final Program program = this.source.parse();
		final Program translated = translate(program, this.target, this.initialVariables.keySet());
		final String text = ProgramPrinter.toText(translated);
		if (!this.verification) {
			return new Result(translated, text, null, null, null);
		}
		this.logger.logMessage("\n[Running " + program.getLanguage() + "]");
		final Map<String, BigInteger> before = evaluate(program, this.initialVariables, this.logger);
		this.logger.logMessage("\n[Running " + translated.getLanguage() + "]");
		final Map<String, BigInteger> after = evaluate(translated, this.initialVariables, this.logger);
		return new Result(translated, text, before, after, observableNames(program, this.initialVariables));
	}

	/**
	 * Translate a program into another language, going through WHILE when
	 * translating LOOP to GOTO.
	 *
	 * @param program
	 * @param target
	 * @param reserved names the translation must not introduce.
	 * @throws IllegalArgumentException if there is no translation to the target language.
	 */
	public static Program translate(Program program, Language target, Collection<String> reserved) {
		switch (program.getLanguage()) {
		case LOOP: {
			final WhileProgram w = new Loop2While(reserved).translate((LoopProgram) program);
			if (target == Language.WHILE) {
				return w;
			} else if (target == Language.GOTO) {
				return new While2Goto(reserved).translate(w);
			}
			break;
		}
		case WHILE:
			if (target == Language.GOTO) {
				return new While2Goto(reserved).translate((WhileProgram) program);
			}
			break;
		case GOTO:
			if (target == Language.WHILE) {
				return new Goto2While(reserved).translate((GotoProgram) program);
			}
			break;
		default:
			break;
		}
		throw new IllegalArgumentException("Cannot translate from " + program.getLanguage() + " to " + target);
	}

	/**
	 * Run a program of any language with its reference interpreter.
	 *
	 * @param program
	 * @param initialVariables can be null.
	 * @param logger receives the evaluation trace.
	 */
	public static Map<String, BigInteger> evaluate(Program program, Map<String, BigInteger> initialVariables,
			Logger logger) {
		if (program instanceof LoopProgram) {
			final LoopInterpreter interpreter = new LoopInterpreter();
			interpreter.setLogger(logger);
			return interpreter.evaluate((LoopProgram) program, initialVariables);
		} else if (program instanceof WhileProgram) {
			final WhileInterpreter interpreter = new WhileInterpreter();
			interpreter.setLogger(logger);
			return interpreter.evaluate((WhileProgram) program, initialVariables);
		} else if (program instanceof GotoProgram) {
			final GotoInterpreter interpreter = new GotoInterpreter();
			interpreter.setLogger(logger);
			return interpreter.evaluate((GotoProgram) program, initialVariables);
		}
		throw new IllegalArgumentException("unknown program kind: " + program);
	}

	/**
	 * The variables whose final values a translation must preserve: those named
	 * in the source program, plus the initial variables. Counters introduced by
	 * a translation are not among them.
	 */
	public static Set<String> observableNames(Program source, Map<String, BigInteger> initialVariables) {
		final Set<String> names = new HashSet<>(FreshNames.namesOf(source));
		if (initialVariables != null) {
			names.addAll(initialVariables.keySet());
		}
		return names;
	}

	/**
	 * Compare two sets of final variables over the given names. A variable
	 * missing from one side counts as zero there, as it would read in the program.
	 */
	public static boolean sameResults(Map<String, BigInteger> a, Map<String, BigInteger> b, Set<String> names) {
		for (String key : names) {
			if (!a.getOrDefault(key, BigInteger.ZERO).equals(b.getOrDefault(key, BigInteger.ZERO))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * The outcome of a translation task.
	 */
	public static final class Result {
		private final Program program;
		private final String text;
		private final Map<String, BigInteger> sourceResult;
		private final Map<String, BigInteger> targetResult;
		private final Set<String> observable;

		Result(Program program, String text, Map<String, BigInteger> sourceResult,
				Map<String, BigInteger> targetResult, Set<String> observable) {
			this.program = program;
			this.text = text;
			this.sourceResult = sourceResult;
			this.targetResult = targetResult;
			this.observable = observable;
		}

		/** The translated program. */
		public Program getProgram() {
			return this.program;
		}

		/** The translated program as source text. */
		public String getText() {
			return this.text;
		}

		public boolean isVerified() {
			return this.sourceResult != null;
		}

		/** Final variables of the source program, or null without verification. */
		public Map<String, BigInteger> getSourceResult() {
			return this.sourceResult;
		}

		/** Final variables of the translated program, or null without verification. */
		public Map<String, BigInteger> getTargetResult() {
			return this.targetResult;
		}

		/**
		 * @return true if verification ran and both programs agreed on every
		 *         variable of the source program.
		 */
		public boolean passed() {
			return isVerified() && sameResults(this.sourceResult, this.targetResult, this.observable);
		}
	}
}
