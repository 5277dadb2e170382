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
import java.util.List;

import lwg.lang.LoopProgram;

/**
 * Parser for LOOP programs.
 *
 * <pre>
 *   program ::= stmt*
 *   stmt    ::= assign | 'LOOP' IDENTIFIER 'DO' stmt* 'END' ';'?
 * </pre>
 */
public class LoopParser extends AbstractParser {

	public LoopParser(String text) {
		super(text);
	}

	public LoopProgram parse() {
		final List<LoopProgram.Stmt> stmts = parseBlock();
		if (!atEnd()) {
			throw syntaxError("Unexpected " + peek(), peek());
		}
		return new LoopProgram(stmts);
	}

	private List<LoopProgram.Stmt> parseBlock() {
		final List<LoopProgram.Stmt> stmts = new ArrayList<>();
		while (!atEnd() && !atKeyword("END")) {
			stmts.add(parseStatement());
		}
		return stmts;
	}

	private LoopProgram.Stmt parseStatement() {
		if (atKeyword("LOOP")) {
			advance();
			final Token var = expect(Token.Kind.IDENTIFIER, "variable");
			expectKeyword("DO");
			final List<LoopProgram.Stmt> body = parseBlock();
			expectKeyword("END");
			skipOptionalSemicolon();
			return new LoopProgram.Loop(var.text, body);
		} else if (peek().kind == Token.Kind.IDENTIFIER) {
			return parseAssign();
		} else {
			throw syntaxError("Unexpected " + peek() + " in LOOP program", peek());
		}
	}
}
