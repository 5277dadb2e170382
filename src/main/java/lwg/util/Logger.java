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
package lwg.util;

import java.io.PrintStream;

/**
 * Where verbose tracing and progress messages are sent. Nothing that is logged
 * may affect a result, so a {@link #NULL} logger is always a safe choice.
 *
 * @author The LWG Project Developers
 */
public interface Logger {

	/**
	 * Log one line of diagnostic output.
	 */
	void logMessage(String msg);

	/**
	 * @return true if this logger actually records anything.
	 */
	default boolean isEnabled() {
		return true;
	}

	/**
	 * A logger which discards everything.
	 */
	Logger NULL = new Logger() {
		@Override
		public void logMessage(String msg) {
		}

		@Override
		public boolean isEnabled() {
			return false;
		}
	};

	/**
	 * Writes each message as a line on a print stream.
	 */
	class Default implements Logger {
		private final PrintStream out;

		public Default(PrintStream out) {
			this.out = out;
		}

		@Override
		public void logMessage(String msg) {
			this.out.println(msg);
		}
	}
}
