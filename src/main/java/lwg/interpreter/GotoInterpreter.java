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
package lwg.interpreter;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import lwg.lang.Assign;
import lwg.lang.GotoProgram;
import lwg.lang.StructureError;
import lwg.lang.SyntacticItem;

/**
 * The reference semantics of GOTO programs.
 *
 * A program counter walks the instructions from index 0. Assignments and
 * untaken conditional jumps fall through to the next instruction; taken jumps
 * move the counter to the index of the target label. Execution ends at a
 * <code>HALT</code>, or when the counter runs past the last instruction.
 *
 * @author The LWG Project Developers
 */
public class GotoInterpreter extends AbstractInterpreter {

	public Map<String, BigInteger> evaluate(GotoProgram program) {
		return evaluate(program, null);
	}

	/**
	 * Run a GOTO program.
	 *
	 * @param program
	 * @param initialVariables write-once locks (see {@link AbstractInterpreter#createFrame(Map)}), or null.
	 * @return the final value of every variable the program (or caller) set.
	 * @throws StructureError if a label is defined twice, or a jump is taken to an undefined label.
	 * @throws SafetyLimitExceeded if the program runs for more steps than the safety limit.
	 */
	public Map<String, BigInteger> evaluate(GotoProgram program, Map<String, BigInteger> initialVariables) {
		final Frame frame = createFrame(initialVariables);
		final Map<String, Integer> labels = program.getLabelMap();
		final List<GotoProgram.Instruction> instructions = program.getInstructions();
		int pc = 0;
		long steps = 0;
		while (pc < instructions.size()) {
			final GotoProgram.Instruction instr = instructions.get(pc);
			steps++;
			checkSafetyLimit(steps, instr, "steps");
			if (isVerbose()) {
				this.logger.logMessage(String.format("  [%d] %s", pc, instr));
			}
			final GotoProgram.Stmt stmt = instr.getStatement();
			switch (stmt.getOpcode()) {
			case SyntacticItem.STMT_assign:
				assign((Assign) stmt, frame);
				pc = pc + 1;
				break;
			case SyntacticItem.STMT_goto: {
				final GotoProgram.Goto g = (GotoProgram.Goto) stmt;
				pc = GotoProgram.resolve(labels, g);
				if (isVerbose()) {
					this.logger.logMessage(String.format("       -> jump to %s (pc=%d)", g.getTarget(), pc));
				}
				break;
			}
			case SyntacticItem.STMT_ifgoto: {
				final GotoProgram.IfGoto g = (GotoProgram.IfGoto) stmt;
				if (evaluate(g.getCondition(), frame)) {
					pc = GotoProgram.resolve(labels, g);
					if (isVerbose()) {
						this.logger.logMessage(String.format("       -> true, jump to %s (pc=%d)", g.getTarget(), pc));
					}
				} else {
					pc = pc + 1;
					if (isVerbose()) {
						this.logger.logMessage("       -> false, continue");
					}
				}
				break;
			}
			case SyntacticItem.STMT_halt:
				if (isVerbose()) {
					this.logger.logMessage("       -> HALT");
				}
				return finish(frame);
			default:
				throw new IllegalArgumentException("unknown GOTO statement encountered: " + stmt);
			}
		}
		return finish(frame);
	}

	@Override
	protected void traceAssigned(String var, BigInteger value, BigInteger old) {
		this.logger.logMessage(String.format("       -> %s = %s", var, value));
	}

	@Override
	protected void traceSkipped(String var, BigInteger value) {
		this.logger.logMessage("       -> skipped (using initial value)");
	}
}
