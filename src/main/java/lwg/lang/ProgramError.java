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

/**
 * An error in a program, with some context information.
 *
 * @author The LWG Project Developers
 */
@SuppressWarnings("serial")
public class ProgramError extends RuntimeException {
	protected final SyntacticItem location;

	/**
	 * Record an error message, with the syntactic item it concerns.
	 *
	 * @param message
	 * @param loc can be null if not known.
	 */
	public ProgramError(String message, SyntacticItem loc) {
		super(message);
		this.location = loc;
	}

	/**
	 * @return the item this error concerns, or null if not known.
	 */
	public SyntacticItem getLocation() {
		return this.location;
	}

	@Override
	public String getMessage() {
		final String msg = super.getMessage();
		if (this.location == null) {
			return msg;
		}
		return msg + " (at " + this.location + ")";
	}
}
