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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lwg.lang.Assign;
import lwg.lang.Condition;
import lwg.lang.Expr;
import lwg.lang.SyntacticItem;
import lwg.util.Logger;

/**
 * Shared machinery of the three reference interpreters: the variable store,
 * write-once locks for initial variables, expression and condition evaluation,
 * and the safety limit on loops.
 *
 * Interpreters hold configuration only. Each call to <code>evaluate</code>
 * builds its own {@link Frame} and discards it on return, so one interpreter
 * can be used for any number of (concurrent) evaluations.
 *
 * @author The LWG Project Developers
 */
public abstract class AbstractInterpreter {

	/** Default ceiling on loop iterations, or on GOTO steps. */
	public static final int DEFAULT_SAFETY_LIMIT = 1_000_000;

	protected int safetyLimit = DEFAULT_SAFETY_LIMIT;

	/** Where the verbose trace goes. */
	protected Logger logger = Logger.NULL;

	public void setSafetyLimit(int limit) {
		if (limit < 0) {
			throw new IllegalArgumentException("negative safety limit " + limit);
		}
		this.safetyLimit = limit;
	}

	public int getSafetyLimit() {
		return this.safetyLimit;
	}

	public void setLogger(Logger logger) {
		this.logger = logger == null ? Logger.NULL : logger;
	}

	protected boolean isVerbose() {
		return this.logger.isEnabled();
	}

	/**
	 * The state of one evaluation: the variables, plus the set of variables
	 * which are still locked to their initial values.
	 */
	protected static final class Frame {
		final Map<String, BigInteger> variables = new LinkedHashMap<>();
		final Set<String> locked = new HashSet<>();

		/** Unset variables read as zero. */
		BigInteger get(String name) {
			final BigInteger value = this.variables.get(name);
			return value == null ? BigInteger.ZERO : value;
		}
	}

	/**
	 * Create the frame for a new evaluation. Every initial variable is pinned:
	 * it keeps its value until the first assignment to it, which is skipped.
	 *
	 * @param initialVariables can be null.
	 */
	protected Frame createFrame(Map<String, BigInteger> initialVariables) {
		final Frame frame = new Frame();
		if (initialVariables != null) {
			for (Map.Entry<String, BigInteger> e : initialVariables.entrySet()) {
				if (e.getValue().signum() < 0) {
					throw new IllegalArgumentException("variable " + e.getKey() + " is not a natural number: " + e.getValue());
				}
				frame.variables.put(e.getKey(), e.getValue());
				frame.locked.add(e.getKey());
			}
		}
		return frame;
	}

	/**
	 * @return the final variables of an evaluation; the caller owns the map.
	 */
	protected Map<String, BigInteger> finish(Frame frame) {
		return frame.variables;
	}

	/**
	 * Execute an assignment, honouring any write-once lock on its variable.
	 *
	 * @return false if the assignment was suppressed by a lock.
	 */
	protected boolean assign(Assign stmt, Frame frame) {
		final String var = stmt.getVariable();
		final BigInteger value = evaluate(stmt.getValue(), frame);
		if (frame.locked.remove(var)) {
			if (isVerbose()) {
				traceSkipped(var, value);
			}
			return false;
		}
		final BigInteger old = frame.get(var);
		frame.variables.put(var, value);
		if (isVerbose()) {
			traceAssigned(var, value, old);
		}
		return true;
	}

	protected void traceAssigned(String var, BigInteger value, BigInteger old) {
		this.logger.logMessage(String.format("  %s := %s (was %s)", var, value, old));
	}

	protected void traceSkipped(String var, BigInteger value) {
		this.logger.logMessage(String.format("  [skip] %s := %s (using initial value)", var, value));
	}

	protected BigInteger evaluate(Expr expr, Frame frame) {
		switch (expr.getOpcode()) {
		case SyntacticItem.EXPR_const:
			return ((Expr.Constant) expr).getValue();
		case SyntacticItem.EXPR_variable:
			return frame.get(((Expr.VariableAccess) expr).getName());
		case SyntacticItem.EXPR_binop: {
			final Expr.BinaryOperator b = (Expr.BinaryOperator) expr;
			final BigInteger lhs = evaluate(b.getLeftHandSide(), frame);
			final BigInteger rhs = evaluate(b.getRightHandSide(), frame);
			return b.getOperator().apply(lhs, rhs);
		}
		default:
			throw new IllegalArgumentException("unknown expression encountered: " + expr);
		}
	}

	protected boolean evaluate(Condition cond, Frame frame) {
		final BigInteger lhs = evaluate(cond.getLeftHandSide(), frame);
		final BigInteger rhs = evaluate(cond.getRightHandSide(), frame);
		return cond.getComparator().test(lhs, rhs);
	}

	/**
	 * Count one more iteration (or step) and abort once the safety limit is passed.
	 *
	 * @param count the number of iterations so far, including this one.
	 * @param item the loop being executed, for the error message.
	 * @param unit "iterations" or "steps".
	 */
	protected void checkSafetyLimit(long count, SyntacticItem item, String unit) {
		if (count > this.safetyLimit) {
			throw new SafetyLimitExceeded(this.safetyLimit, unit, item);
		}
	}
}
