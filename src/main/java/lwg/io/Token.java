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

/**
 * One token of program text.
 */
public final class Token {

	public enum Kind {
		IDENTIFIER,
		KEYWORD,
		NUMBER,
		ASSIGN,
		COLON,
		OPERATOR,
		COMPARISON,
		SEMICOLON,
		LEFT_PAREN,
		RIGHT_PAREN,
		EOF
	}

	public final Kind kind;
	public final String text;
	/** Offset of the first character of this token in the source text. */
	public final int start;

	public Token(Kind kind, String text, int start) {
		this.kind = kind;
		this.text = text;
		this.start = start;
	}

	public boolean is(Kind kind, String text) {
		return this.kind == kind && this.text.equals(text);
	}

	@Override
	public String toString() {
		return this.kind == Kind.EOF ? "end of input" : "'" + this.text + "'";
	}
}
