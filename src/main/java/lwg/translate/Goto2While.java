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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lwg.lang.Assign;
import lwg.lang.Condition;
import lwg.lang.Expr;
import lwg.lang.GotoProgram;
import lwg.lang.SyntacticItem;
import lwg.lang.WhileProgram;

/**
 * Translates GOTO programs into WHILE programs, by simulating the program
 * counter with a fresh variable <code>pc</code>.
 *
 * <pre>
 *   pc := 0;
 *   WHILE pc != n DO
 *     IF pc = 0 THEN ... ELSE
 *       IF pc = 1 THEN ... ELSE
 *         ...
 *           IF pc = n-1 THEN ... ELSE pc := n END
 *       END
 *     END
 *   END
 * </pre>
 *
 * where <code>n</code> is the number of instructions, and means "halted". Each
 * branch performs one instruction and then updates <code>pc</code>:
 * an assignment is kept and followed by <code>pc := pc + 1</code>;
 * <code>GOTO L</code> becomes <code>pc := index(L)</code>;
 * <code>IF c THEN GOTO L</code> becomes
 * <code>IF c THEN pc := index(L) ELSE pc := pc + 1 END</code>;
 * and <code>HALT</code> becomes <code>pc := n</code>.
 * The innermost ELSE can never run, since <code>pc</code> always holds the
 * index of an instruction while the loop is running.
 *
 * @author The LWG Project Developers
 */
public class Goto2While {

	/** Names that the fresh program counter must also avoid. */
	private final Collection<String> reserved;

	public Goto2While() {
		this(Collections.emptySet());
	}

	public Goto2While(Collection<String> reserved) {
		this.reserved = reserved;
	}

	/**
	 * Translation never fails. Broken labels are left for the GOTO evaluator
	 * to report: a repeated label resolves to its first occurrence, and a jump
	 * to an undefined label halts.
	 */
	public WhileProgram translate(GotoProgram program) {
		final Map<String, Integer> labels = collectLabels(program);
		final FreshNames names = FreshNames.forProgram(program, this.reserved);
		final String pc = names.freshVariable();
		final int halted = program.size();
		final Condition running = new Condition(Expr.variable(pc), Condition.Comparator.NEQ, Expr.constant(halted));
		return new WhileProgram(Arrays.asList(
				new Assign(pc, Expr.constant(0)),
				new WhileProgram.While(running, writeDispatch(program, labels, pc))));
	}

	private static Map<String, Integer> collectLabels(GotoProgram program) {
		final Map<String, Integer> labels = new HashMap<>();
		final List<GotoProgram.Instruction> instructions = program.getInstructions();
		for (int i = 0; i < instructions.size(); i++) {
			final GotoProgram.Instruction instr = instructions.get(i);
			if (instr.hasLabel()) {
				labels.putIfAbsent(instr.getLabel(), i);
			}
		}
		return labels;
	}

	/**
	 * Build the chain of IF statements which selects and runs instruction pc.
	 */
	private List<WhileProgram.Stmt> writeDispatch(GotoProgram program, Map<String, Integer> labels, String pc) {
		final List<GotoProgram.Instruction> instructions = program.getInstructions();
		final int halted = instructions.size();
		if (halted == 0) {
			return Collections.emptyList();
		}
		// built from the last instruction back to the first
		List<WhileProgram.Stmt> otherwise = Collections.singletonList(setPc(pc, Expr.constant(halted)));
		for (int i = halted - 1; i >= 0; i--) {
			final Condition select = new Condition(Expr.variable(pc), Condition.Comparator.EQ, Expr.constant(i));
			final List<WhileProgram.Stmt> body = writeInstruction(instructions.get(i), labels, pc, halted);
			otherwise = Collections.singletonList(new WhileProgram.If(select, body, otherwise));
		}
		return otherwise;
	}

	private List<WhileProgram.Stmt> writeInstruction(GotoProgram.Instruction instr, Map<String, Integer> labels,
			String pc, int halted) {
		final GotoProgram.Stmt stmt = instr.getStatement();
		final List<WhileProgram.Stmt> body = new ArrayList<>();
		switch (stmt.getOpcode()) {
		case SyntacticItem.STMT_assign: {
			final Assign a = (Assign) stmt;
			body.add(new Assign(a.getVariable(), a.getValue()));
			body.add(nextPc(pc));
			break;
		}
		case SyntacticItem.STMT_goto: {
			final int target = targetOf(labels, (GotoProgram.Goto) stmt, halted);
			body.add(setPc(pc, Expr.constant(target)));
			break;
		}
		case SyntacticItem.STMT_ifgoto: {
			final GotoProgram.IfGoto g = (GotoProgram.IfGoto) stmt;
			final int target = targetOf(labels, g, halted);
			body.add(new WhileProgram.If(g.getCondition(),
					Collections.singletonList(setPc(pc, Expr.constant(target))),
					Collections.singletonList(nextPc(pc))));
			break;
		}
		case SyntacticItem.STMT_halt:
			body.add(setPc(pc, Expr.constant(halted)));
			break;
		default:
			throw new IllegalArgumentException("unknown GOTO statement encountered: " + stmt);
		}
		return body;
	}

	private static int targetOf(Map<String, Integer> labels, GotoProgram.Jump jump, int halted) {
		final Integer index = labels.get(jump.getTarget());
		return index == null ? halted : index;
	}

	private static Assign setPc(String pc, Expr value) {
		return new Assign(pc, value);
	}

	private static Assign nextPc(String pc) {
		return new Assign(pc, Expr.add(Expr.variable(pc), Expr.constant(1)));
	}
}
