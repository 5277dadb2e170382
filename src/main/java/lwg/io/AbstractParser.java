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

import java.math.BigInteger;
import java.util.List;

import lwg.lang.Assign;
import lwg.lang.Condition;
import lwg.lang.Expr;

/**
 * Token handling plus the grammar shared by all three languages: expressions,
 * conditions and assignments.
 *
 * <pre>
 *   expr      ::= term (('+' | '-') term)*
 *   term      ::= NUMBER | IDENTIFIER | '(' expr ')'
 *   condition ::= expr ('=' | '!=' | '<' | '>' | '<=' | '>=') expr
 *   assign    ::= IDENTIFIER ':=' expr ';'
 * </pre>
 *
 * @author The LWG Project Developers
 */
public abstract class AbstractParser {
	private final List<Token> tokens;
	private int index;

	protected AbstractParser(List<Token> tokens) {
		this.tokens = tokens;
		this.index = 0;
	}

	protected AbstractParser(String text) {
		this(new Lexer(text).scan());
	}

	protected Token peek() {
		return this.tokens.get(this.index);
	}

	protected Token peek(int offset) {
		final int i = Math.min(this.index + offset, this.tokens.size() - 1);
		return this.tokens.get(i);
	}

	protected Token advance() {
		final Token t = this.tokens.get(this.index);
		if (t.kind != Token.Kind.EOF) {
			this.index++;
		}
		return t;
	}

	protected boolean atEnd() {
		return peek().kind == Token.Kind.EOF;
	}

	protected boolean atKeyword(String keyword) {
		return peek().is(Token.Kind.KEYWORD, keyword);
	}

	protected Token expect(Token.Kind kind, String what) {
		final Token t = peek();
		if (t.kind != kind) {
			throw syntaxError("Expected " + what + " but found " + t, t);
		}
		return advance();
	}

	protected void expectKeyword(String keyword) {
		final Token t = peek();
		if (!t.is(Token.Kind.KEYWORD, keyword)) {
			throw syntaxError("Expected " + keyword + " but found " + t, t);
		}
		advance();
	}

	/** A semicolon is allowed, but not needed, after END. */
	protected void skipOptionalSemicolon() {
		if (peek().kind == Token.Kind.SEMICOLON) {
			advance();
		}
	}

	protected Expr parseExpression() {
		Expr lhs = parseTerm();
		while (peek().kind == Token.Kind.OPERATOR) {
			final Expr.Operator op = Expr.Operator.fromSymbol(advance().text);
			lhs = new Expr.BinaryOperator(lhs, op, parseTerm());
		}
		return lhs;
	}

	protected Expr parseTerm() {
		final Token t = peek();
		switch (t.kind) {
		case NUMBER:
			advance();
			return new Expr.Constant(new BigInteger(t.text));
		case IDENTIFIER:
			advance();
			return new Expr.VariableAccess(t.text);
		case LEFT_PAREN: {
			advance();
			final Expr e = parseExpression();
			expect(Token.Kind.RIGHT_PAREN, "')'");
			return e;
		}
		default:
			throw syntaxError("Expected number or variable but found " + t, t);
		}
	}

	protected Condition parseCondition() {
		final Expr lhs = parseExpression();
		final Token cmp = expect(Token.Kind.COMPARISON, "comparison");
		final Expr rhs = parseExpression();
		return new Condition(lhs, Condition.Comparator.fromSymbol(cmp.text), rhs);
	}

	protected Assign parseAssign() {
		final Token var = expect(Token.Kind.IDENTIFIER, "variable");
		expect(Token.Kind.ASSIGN, "':='");
		final Expr value = parseExpression();
		expect(Token.Kind.SEMICOLON, "';'");
		return new Assign(var.text, value);
	}

	protected SyntaxError syntaxError(String message, Token at) {
		return new SyntaxError(message, at.start);
	}
}
