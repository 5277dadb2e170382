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

import java.util.Locale;

import lwg.lang.ProgramError;
import lwg.lang.SyntacticItem;

/**
 * Thrown when a loop runs for more iterations (or a GOTO program for more
 * steps) than the interpreter's safety limit allows. This is a diagnostic for
 * a program that probably never terminates, not part of the semantics.
 */
@SuppressWarnings("serial")
public class SafetyLimitExceeded extends ProgramError {
	private final int limit;

	public SafetyLimitExceeded(int limit, String unit, SyntacticItem loc) {
		super(String.format(Locale.ROOT, "possible infinite loop (safety limit: %,d %s)", limit, unit), loc);
		this.limit = limit;
	}

	public int getLimit() {
		return this.limit;
	}
}
