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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits LOOP, WHILE and GOTO program text into tokens. All three languages
 * share one lexer; each parser rejects the keywords it does not use.
 *
 * @author The LWG Project Developers
 */
public class Lexer {
	public static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
			"LOOP", "DO", "END", "WHILE", "IF", "THEN", "ELSE", "GOTO", "HALT"));

	private final String input;
	private int pos;

	public Lexer(String input) {
		this.input = input;
		this.pos = 0;
	}

	/**
	 * @return every token of the input, ending with a single EOF token.
	 * @throws SyntaxError on any character that cannot start a token.
	 */
	public List<Token> scan() {
		final List<Token> tokens = new ArrayList<>();
		while (true) {
			skipWhitespace();
			if (this.pos >= this.input.length()) {
				break;
			}
			final char c = this.input.charAt(this.pos);
			final int start = this.pos;
			if (isLetter(c)) {
				tokens.add(scanIdentifier());
			} else if (isDigit(c)) {
				tokens.add(scanNumber());
			} else if (c == ':' && peek(1) == '=') {
				this.pos += 2;
				tokens.add(new Token(Token.Kind.ASSIGN, ":=", start));
			} else if (c == ':') {
				this.pos++;
				tokens.add(new Token(Token.Kind.COLON, ":", start));
			} else if (c == '+' || c == '-') {
				this.pos++;
				tokens.add(new Token(Token.Kind.OPERATOR, String.valueOf(c), start));
			} else if ((c == '!' || c == '<' || c == '>') && peek(1) == '=') {
				this.pos += 2;
				tokens.add(new Token(Token.Kind.COMPARISON, c + "=", start));
			} else if (c == '=' || c == '<' || c == '>') {
				this.pos++;
				tokens.add(new Token(Token.Kind.COMPARISON, String.valueOf(c), start));
			} else if (c == ';') {
				this.pos++;
				tokens.add(new Token(Token.Kind.SEMICOLON, ";", start));
			} else if (c == '(') {
				this.pos++;
				tokens.add(new Token(Token.Kind.LEFT_PAREN, "(", start));
			} else if (c == ')') {
				this.pos++;
				tokens.add(new Token(Token.Kind.RIGHT_PAREN, ")", start));
			} else {
				throw new SyntaxError("Unexpected character '" + c + "'", start);
			}
		}
		tokens.add(new Token(Token.Kind.EOF, "", this.input.length()));
		return tokens;
	}

	private Token scanIdentifier() {
		final int start = this.pos;
		while (this.pos < this.input.length()
				&& (isLetter(this.input.charAt(this.pos)) || isDigit(this.input.charAt(this.pos)))) {
			this.pos++;
		}
		final String text = this.input.substring(start, this.pos);
		final Token.Kind kind = KEYWORDS.contains(text) ? Token.Kind.KEYWORD : Token.Kind.IDENTIFIER;
		return new Token(kind, text, start);
	}

	private Token scanNumber() {
		final int start = this.pos;
		while (this.pos < this.input.length() && isDigit(this.input.charAt(this.pos))) {
			this.pos++;
		}
		return new Token(Token.Kind.NUMBER, this.input.substring(start, this.pos), start);
	}

	private void skipWhitespace() {
		while (this.pos < this.input.length() && Character.isWhitespace(this.input.charAt(this.pos))) {
			this.pos++;
		}
	}

	private char peek(int offset) {
		final int i = this.pos + offset;
		return i < this.input.length() ? this.input.charAt(i) : '\0';
	}

	private static boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}
}
