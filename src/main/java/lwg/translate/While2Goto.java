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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lwg.lang.Assign;
import lwg.lang.GotoProgram;
import lwg.lang.SyntacticItem;
import lwg.lang.WhileProgram;

/**
 * Translates WHILE programs into GOTO programs, by flattening every nested
 * block into one labelled instruction sequence.
 *
 * <pre>
 *   WHILE c DO S END           Lstart: IF !c THEN GOTO Lend;
 *                                      S;
 *                                      GOTO Lstart;
 *                              Lend:   ...
 *
 *   IF c THEN S END                    IF !c THEN GOTO Lend;
 *                                      S;
 *                              Lend:   ...
 *
 *   IF c THEN S ELSE T END             IF !c THEN GOTO Lelse;
 *                                      S;
 *                                      GOTO Lend;
 *                              Lelse:  T;
 *                              Lend:   ...
 * </pre>
 *
 * Here <code>!c</code> is <code>c</code> with its comparator negated. A label
 * such as <code>Lend</code> goes on whatever instruction is emitted next, and a
 * final <code>HALT</code> is always appended, so every label has an instruction
 * to sit on. When two labels fall on the same instruction (e.g. the ends of two
 * nested IFs) the later one becomes an alias of the first, and jumps to it are
 * redirected once the whole program has been emitted.
 *
 * @author The LWG Project Developers
 */
public class While2Goto {

	/** Names that fresh labels must also avoid. */
	private final Collection<String> reserved;

	public While2Goto() {
		this(Collections.emptySet());
	}

	public While2Goto(Collection<String> reserved) {
		this.reserved = reserved;
	}

	public GotoProgram translate(WhileProgram program) {
		final Emitter emitter = new Emitter(FreshNames.forProgram(program, this.reserved));
		emitter.writeBlock(program.getStatements());
		emitter.emit(new GotoProgram.Halt());
		return new GotoProgram(emitter.finish());
	}

	/**
	 * The state of one translation: the instructions so far, the label waiting
	 * for the next instruction, and the label aliases.
	 */
	private static final class Emitter {
		private final FreshNames names;
		private final List<GotoProgram.Instruction> instructions = new ArrayList<>();
		private final Map<String, String> aliases = new HashMap<>();

		/** The label to attach to the next emitted instruction, or null. */
		private String pendingLabel;

		Emitter(FreshNames names) {
			this.names = names;
		}

		void writeBlock(List<WhileProgram.Stmt> block) {
			for (WhileProgram.Stmt stmt : block) {
				writeStatement(stmt);
			}
		}

		void writeStatement(WhileProgram.Stmt stmt) {
			switch (stmt.getOpcode()) {
			case SyntacticItem.STMT_assign: {
				final Assign a = (Assign) stmt;
				emit(new Assign(a.getVariable(), a.getValue()));
				break;
			}
			case SyntacticItem.STMT_while:
				writeWhile((WhileProgram.While) stmt);
				break;
			case SyntacticItem.STMT_if:
				writeIf((WhileProgram.If) stmt);
				break;
			default:
				throw new IllegalArgumentException("unknown WHILE statement encountered: " + stmt);
			}
		}

		private void writeWhile(WhileProgram.While stmt) {
			final String start = this.names.freshLabel();
			final String end = this.names.freshLabel();
			placeLabel(start);
			emit(new GotoProgram.IfGoto(stmt.getCondition().negate(), end));
			writeBlock(stmt.getBody());
			emit(new GotoProgram.Goto(start));
			placeLabel(end);
		}

		private void writeIf(WhileProgram.If stmt) {
			if (!stmt.hasFalseBranch()) {
				final String end = this.names.freshLabel();
				emit(new GotoProgram.IfGoto(stmt.getCondition().negate(), end));
				writeBlock(stmt.getTrueBranch());
				placeLabel(end);
			} else {
				final String otherwise = this.names.freshLabel();
				final String end = this.names.freshLabel();
				emit(new GotoProgram.IfGoto(stmt.getCondition().negate(), otherwise));
				writeBlock(stmt.getTrueBranch());
				emit(new GotoProgram.Goto(end));
				placeLabel(otherwise);
				writeBlock(stmt.getFalseBranch());
				placeLabel(end);
			}
		}

		/**
		 * Put a label on the next instruction to be emitted.
		 */
		void placeLabel(String label) {
			if (this.pendingLabel == null) {
				this.pendingLabel = label;
			} else {
				this.aliases.put(label, this.pendingLabel);
			}
		}

		void emit(GotoProgram.Stmt stmt) {
			this.instructions.add(new GotoProgram.Instruction(this.pendingLabel, stmt));
			this.pendingLabel = null;
		}

		/**
		 * @return the emitted instructions, with jumps to aliased labels redirected.
		 */
		List<GotoProgram.Instruction> finish() {
			if (this.aliases.isEmpty()) {
				return this.instructions;
			}
			final List<GotoProgram.Instruction> result = new ArrayList<>();
			for (GotoProgram.Instruction instr : this.instructions) {
				final GotoProgram.Stmt stmt = instr.getStatement();
				switch (stmt.getOpcode()) {
				case SyntacticItem.STMT_goto: {
					final String target = ((GotoProgram.Goto) stmt).getTarget();
					result.add(new GotoProgram.Instruction(instr.getLabel(), new GotoProgram.Goto(unalias(target))));
					break;
				}
				case SyntacticItem.STMT_ifgoto: {
					final GotoProgram.IfGoto g = (GotoProgram.IfGoto) stmt;
					result.add(new GotoProgram.Instruction(instr.getLabel(),
							new GotoProgram.IfGoto(g.getCondition(), unalias(g.getTarget()))));
					break;
				}
				default:
					result.add(instr);
				}
			}
			return result;
		}

		private String unalias(String label) {
			final String target = this.aliases.get(label);
			return target == null ? label : target;
		}
	}
}
