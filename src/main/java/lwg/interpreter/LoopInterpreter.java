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
import lwg.lang.LoopProgram;
import lwg.lang.SyntacticItem;

/**
 * The reference semantics of LOOP programs.
 *
 * <code>LOOP x DO body END</code> reads <code>x</code> once, on entry, and runs
 * the body exactly that many times; assignments to <code>x</code> inside the
 * body do not change the count.
 *
 * @author The LWG Project Developers
 */
public class LoopInterpreter extends AbstractInterpreter {

	public Map<String, BigInteger> evaluate(LoopProgram program) {
		return evaluate(program, null);
	}

	/**
	 * Run a LOOP program.
	 *
	 * @param program
	 * @param initialVariables write-once locks (see {@link AbstractInterpreter#createFrame(Map)}), or null.
	 * @return the final value of every variable the program (or caller) set.
	 * @throws SafetyLimitExceeded if a loop count is larger than the safety limit.
	 */
	public Map<String, BigInteger> evaluate(LoopProgram program, Map<String, BigInteger> initialVariables) {
		final Frame frame = createFrame(initialVariables);
		executeBlock(program.getStatements(), frame);
		return finish(frame);
	}

	private void executeBlock(List<LoopProgram.Stmt> block, Frame frame) {
		for (LoopProgram.Stmt stmt : block) {
			execute(stmt, frame);
		}
	}

	private void execute(LoopProgram.Stmt stmt, Frame frame) {
		switch (stmt.getOpcode()) {
		case SyntacticItem.STMT_assign:
			assign((Assign) stmt, frame);
			break;
		case SyntacticItem.STMT_loop:
			executeLoop((LoopProgram.Loop) stmt, frame);
			break;
		default:
			throw new IllegalArgumentException("unknown LOOP statement encountered: " + stmt);
		}
	}

	private void executeLoop(LoopProgram.Loop stmt, Frame frame) {
		// the count is fixed here, once
		final BigInteger count = frame.get(stmt.getVariable());
		if (isVerbose()) {
			this.logger.logMessage(String.format("  LOOP %s (%s iterations)", stmt.getVariable(), count));
		}
		if (count.compareTo(BigInteger.valueOf(this.safetyLimit)) > 0) {
			throw new SafetyLimitExceeded(this.safetyLimit, "iterations", stmt);
		}
		final long n = count.longValueExact();
		for (long i = 1; i <= n; i++) {
			if (isVerbose()) {
				this.logger.logMessage("    iteration " + i);
			}
			executeBlock(stmt.getBody(), frame);
		}
	}
}
