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
package lwg;

import java.io.File;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lwg.io.GotoParser;
import lwg.io.LoopParser;
import lwg.io.WhileParser;
import lwg.lang.GotoProgram;
import lwg.lang.Language;
import lwg.lang.LoopProgram;
import lwg.lang.WhileProgram;
import lwg.util.Logger;

/**
 * Helpers shared by the test suites.
 */
public class TestUtils {

	/**
	 * Build a variable map from alternating names and values, e.g.
	 * <code>vars("x0", 5, "x1", 10)</code>.
	 */
	public static Map<String, BigInteger> vars(Object... namesAndValues) {
		if (namesAndValues.length % 2 != 0) {
			throw new IllegalArgumentException("odd number of arguments");
		}
		final Map<String, BigInteger> result = new LinkedHashMap<>();
		for (int i = 0; i < namesAndValues.length; i += 2) {
			final Number n = (Number) namesAndValues[i + 1];
			result.put((String) namesAndValues[i], BigInteger.valueOf(n.longValue()));
		}
		return result;
	}

	public static BigInteger big(long value) {
		return BigInteger.valueOf(value);
	}

	public static LoopProgram loop(String text) {
		return new LoopParser(text).parse();
	}

	public static WhileProgram whileProgram(String text) {
		return new WhileParser(text).parse();
	}

	public static GotoProgram gotoProgram(String text) {
		return new GotoParser(text).parse();
	}

	/**
	 * A logger which keeps every message, so tests can inspect the trace.
	 */
	public static class RecordingLogger implements Logger {
		public final List<String> messages = new ArrayList<>();

		@Override
		public void logMessage(String msg) {
			this.messages.add(msg);
		}
	}

	/**
	 * Scan a directory for program files, in name order.
	 *
	 * @param srcDir
	 * @return one single-element array per file, holding the file name.
	 */
	public static Collection<Object[]> findTestNames(String srcDir) {
		final List<Object[]> names = new ArrayList<>();
		final File[] files = new File(srcDir).listFiles();
		if (files == null) {
			return names;
		}
		Arrays.sort(files);
		for (File f : files) {
			if (f.isFile() && Language.fromFileName(f.getName()) != null) {
				names.add(new Object[] { f.getName() });
			}
		}
		return names;
	}
}
