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
package lwg.io;

import lwg.lang.ProgramError;

/**
 * Program text that cannot be tokenised or parsed.
 */
@SuppressWarnings("serial")
public class SyntaxError extends ProgramError {
	private final int offset;

	/**
	 * @param message
	 * @param offset position in the source text where the problem was found.
	 */
	public SyntaxError(String message, int offset) {
		super(message, null);
		this.offset = offset;
	}

	public int getOffset() {
		return this.offset;
	}

	@Override
	public String getMessage() {
		return super.getMessage() + " at position " + this.offset;
	}
}
