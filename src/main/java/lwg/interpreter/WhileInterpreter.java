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
import lwg.lang.SyntacticItem;
import lwg.lang.WhileProgram;

/**
 * The reference semantics of WHILE programs.
 *
 * @author The LWG Project Developers
 */
public class WhileInterpreter extends AbstractInterpreter {

	public Map<String, BigInteger> evaluate(WhileProgram program) {
		return evaluate(program, null);
	}

	/**
	 * Run a WHILE program.
	 *
	 * @param program
	 * @param initialVariables write-once locks (see {@link AbstractInterpreter#createFrame(Map)}), or null.
	 * @return the final value of every variable the program (or caller) set.
	 * @throws SafetyLimitExceeded if one execution of a WHILE statement iterates too often.
	 */
	public Map<String, BigInteger> evaluate(WhileProgram program, Map<String, BigInteger> initialVariables) {
		final Frame frame = createFrame(initialVariables);
		executeBlock(program.getStatements(), frame);
		return finish(frame);
	}

	private void executeBlock(List<WhileProgram.Stmt> block, Frame frame) {
		for (WhileProgram.Stmt stmt : block) {
			execute(stmt, frame);
		}
	}

	private void execute(WhileProgram.Stmt stmt, Frame frame) {
		switch (stmt.getOpcode()) {
		case SyntacticItem.STMT_assign:
			assign((Assign) stmt, frame);
			break;
		case SyntacticItem.STMT_while:
			executeWhile((WhileProgram.While) stmt, frame);
			break;
		case SyntacticItem.STMT_if:
			executeIf((WhileProgram.If) stmt, frame);
			break;
		default:
			throw new IllegalArgumentException("unknown WHILE statement encountered: " + stmt);
		}
	}

	private void executeWhile(WhileProgram.While stmt, Frame frame) {
		if (isVerbose()) {
			this.logger.logMessage("  WHILE " + stmt.getCondition());
		}
		long iteration = 0;
		while (evaluate(stmt.getCondition(), frame)) {
			iteration++;
			checkSafetyLimit(iteration, stmt, "iterations");
			if (isVerbose()) {
				this.logger.logMessage("    iteration " + iteration);
			}
			executeBlock(stmt.getBody(), frame);
		}
		if (isVerbose() && iteration == 0) {
			this.logger.logMessage("    (condition false, skipped)");
		}
	}

	private void executeIf(WhileProgram.If stmt, Frame frame) {
		final boolean holds = evaluate(stmt.getCondition(), frame);
		if (isVerbose()) {
			this.logger.logMessage("  IF " + stmt.getCondition() + " -> " + holds);
		}
		if (holds) {
			executeBlock(stmt.getTrueBranch(), frame);
		} else {
			executeBlock(stmt.getFalseBranch(), frame);
		}
	}
}
