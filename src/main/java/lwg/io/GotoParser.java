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

import lwg.lang.Condition;
import lwg.lang.GotoProgram;

/**
 * Parser for GOTO programs.
 *
 * <pre>
 *   program     ::= instruction*
 *   instruction ::= (IDENTIFIER ':')? stmt
 *   stmt        ::= assign
 *                 | 'GOTO' IDENTIFIER ';'
 *                 | 'IF' condition 'THEN' 'GOTO' IDENTIFIER ';'
 *                 | 'HALT' ';'
 * </pre>
 *
 * Labels are not checked here; see {@link GotoProgram#getLabelMap()}.
 */
public class GotoParser extends AbstractParser {

	public GotoParser(String text) {
		super(text);
	}

	public GotoProgram parse() {
		final List<GotoProgram.Instruction> instructions = new ArrayList<>();
		while (!atEnd()) {
			instructions.add(parseInstruction());
		}
		return new GotoProgram(instructions);
	}

	private GotoProgram.Instruction parseInstruction() {
		String label = null;
		if (peek().kind == Token.Kind.IDENTIFIER && peek(1).kind == Token.Kind.COLON) {
			label = advance().text;
			advance();
		}
		return new GotoProgram.Instruction(label, parseStatement());
	}

	private GotoProgram.Stmt parseStatement() {
		if (atKeyword("GOTO")) {
			advance();
			final Token target = expect(Token.Kind.IDENTIFIER, "label");
			expect(Token.Kind.SEMICOLON, "';'");
			return new GotoProgram.Goto(target.text);
		} else if (atKeyword("IF")) {
			advance();
			final Condition cond = parseCondition();
			expectKeyword("THEN");
			expectKeyword("GOTO");
			final Token target = expect(Token.Kind.IDENTIFIER, "label");
			expect(Token.Kind.SEMICOLON, "';'");
			return new GotoProgram.IfGoto(cond, target.text);
		} else if (atKeyword("HALT")) {
			advance();
			expect(Token.Kind.SEMICOLON, "';'");
			return new GotoProgram.Halt();
		} else if (peek().kind == Token.Kind.IDENTIFIER) {
			return parseAssign();
		} else {
			throw syntaxError("Unexpected " + peek() + " in GOTO program", peek());
		}
	}
}
