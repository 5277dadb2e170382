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
import lwg.lang.WhileProgram;

/**
 * Parser for WHILE programs.
 *
 * <pre>
 *   program ::= stmt*
 *   stmt    ::= assign
 *             | 'WHILE' condition 'DO' stmt* 'END' ';'?
 *             | 'IF' condition 'THEN' stmt* ('ELSE' stmt*)? 'END' ';'?
 * </pre>
 */
public class WhileParser extends AbstractParser {

	public WhileParser(String text) {
		super(text);
	}

	public WhileProgram parse() {
		final List<WhileProgram.Stmt> stmts = parseBlock();
		if (!atEnd()) {
			throw syntaxError("Unexpected " + peek(), peek());
		}
		return new WhileProgram(stmts);
	}

	private List<WhileProgram.Stmt> parseBlock() {
		final List<WhileProgram.Stmt> stmts = new ArrayList<>();
		while (!atEnd() && !atKeyword("END") && !atKeyword("ELSE")) {
			stmts.add(parseStatement());
		}
		return stmts;
	}

	private WhileProgram.Stmt parseStatement() {
		if (atKeyword("WHILE")) {
			advance();
			final Condition cond = parseCondition();
			expectKeyword("DO");
			final List<WhileProgram.Stmt> body = parseBlock();
			expectKeyword("END");
			skipOptionalSemicolon();
			return new WhileProgram.While(cond, body);
		} else if (atKeyword("IF")) {
			advance();
			final Condition cond = parseCondition();
			expectKeyword("THEN");
			final List<WhileProgram.Stmt> trueBranch = parseBlock();
			WhileProgram.If stmt;
			if (atKeyword("ELSE")) {
				advance();
				stmt = new WhileProgram.If(cond, trueBranch, parseBlock());
			} else {
				stmt = new WhileProgram.If(cond, trueBranch);
			}
			expectKeyword("END");
			skipOptionalSemicolon();
			return stmt;
		} else if (peek().kind == Token.Kind.IDENTIFIER) {
			return parseAssign();
		} else {
			throw syntaxError("Unexpected " + peek() + " in WHILE program", peek());
		}
	}
}
