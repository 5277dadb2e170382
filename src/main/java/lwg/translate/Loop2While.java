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
package lwg.translate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import lwg.lang.Assign;
import lwg.lang.Condition;
import lwg.lang.Expr;
import lwg.lang.LoopProgram;
import lwg.lang.SyntacticItem;
import lwg.lang.WhileProgram;

/**
 * Translates LOOP programs into WHILE programs.
 *
 * Assignments are copied. Each <code>LOOP x DO body END</code> becomes
 *
 * <pre>
 *   c := x;
 *   WHILE c != 0 DO
 *     body';
 *     c := c - 1;
 *   END
 * </pre>
 *
 * where <code>body'</code> is the translated body and <code>c</code> is a
 * fresh counter. The counter takes a copy of <code>x</code> exactly once, on
 * entry, and the body cannot name it, so the loop runs exactly as many times as
 * the LOOP would have. When <code>x</code> is zero the condition is false at
 * once and the body never runs.
 *
 * @author The LWG Project Developers
 */
public class Loop2While {

	/** Names that fresh counters must also avoid. */
	private final Collection<String> reserved;

	public Loop2While() {
		this(Collections.emptySet());
	}

	/**
	 * @param reserved extra names that no fresh counter may take, such as the
	 *            names of initial variables the translation will be run with.
	 */
	public Loop2While(Collection<String> reserved) {
		this.reserved = reserved;
	}

	public WhileProgram translate(LoopProgram program) {
		final FreshNames names = FreshNames.forProgram(program, this.reserved);
		return new WhileProgram(translateBlock(program.getStatements(), names));
	}

	private List<WhileProgram.Stmt> translateBlock(List<LoopProgram.Stmt> block, FreshNames names) {
		final List<WhileProgram.Stmt> result = new ArrayList<>();
		for (LoopProgram.Stmt stmt : block) {
			translateStatement(stmt, names, result);
		}
		return result;
	}

	private void translateStatement(LoopProgram.Stmt stmt, FreshNames names, List<WhileProgram.Stmt> out) {
		switch (stmt.getOpcode()) {
		case SyntacticItem.STMT_assign: {
			final Assign a = (Assign) stmt;
			out.add(new Assign(a.getVariable(), a.getValue()));
			break;
		}
		case SyntacticItem.STMT_loop:
			translateLoop((LoopProgram.Loop) stmt, names, out);
			break;
		default:
			throw new IllegalArgumentException("unknown LOOP statement encountered: " + stmt);
		}
	}

	private void translateLoop(LoopProgram.Loop loop, FreshNames names, List<WhileProgram.Stmt> out) {
		// inner loops take their counters first; all come from the same allocator
		final List<WhileProgram.Stmt> body = translateBlock(loop.getBody(), names);
		final String counter = names.freshVariable();
		final Expr c = Expr.variable(counter);
		body.add(new Assign(counter, Expr.sub(c, Expr.constant(1))));
		out.add(new Assign(counter, Expr.variable(loop.getVariable())));
		out.add(new WhileProgram.While(new Condition(c, Condition.Comparator.NEQ, Expr.constant(0)), body));
	}
}
